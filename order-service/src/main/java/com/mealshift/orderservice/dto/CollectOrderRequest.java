package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CollectOrderRequest {

    // counter or canteen where the meal was handed out
    @Size(max = 100)
    private String collectionPoint;
}
