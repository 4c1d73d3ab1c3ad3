package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CollectByCodeRequest {

    @NotBlank(message = "Pickup code is required")
    @Size(max = 16)
    private String pickupCode;

    @Size(max = 100)
    private String collectionPoint;
}
