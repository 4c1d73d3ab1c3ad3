package com.mealshift.orderservice.mapper;

import com.mealshift.orderservice.dto.RestrictionResponse;
import com.mealshift.orderservice.model.Restriction;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.time.Instant;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface RestrictionMapper {

    // inEffect depends on the clock, so callers pass the instant to judge against
    @Mapping(target = "inEffect", expression = "java(restriction.isInEffectAt(at))")
    RestrictionResponse toRestrictionResponse(Restriction restriction, @Context Instant at);
}
