package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LiftRestrictionRequest {

    @NotBlank(message = "Reason is required")
    @Size(min = 10, max = 500)
    private String reason;
}
