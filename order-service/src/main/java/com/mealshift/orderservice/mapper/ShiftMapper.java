package com.mealshift.orderservice.mapper;

import com.mealshift.orderservice.dto.HolidayResponse;
import com.mealshift.orderservice.dto.ShiftResponse;
import com.mealshift.orderservice.model.Holiday;
import com.mealshift.orderservice.model.Shift;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ShiftMapper {

    ShiftResponse toShiftResponse(Shift shift);

    HolidayResponse toHolidayResponse(Holiday holiday);
}
