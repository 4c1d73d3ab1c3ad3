package com.mealshift.orderservice.mapper;

import com.mealshift.orderservice.dto.OrderResponse;
import com.mealshift.orderservice.model.Order;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);
}
