package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class RestrictRequest {

    @NotBlank(message = "Reason is required")
    @Size(max = 500)
    private String reason;

    // null restricts indefinitely
    @Min(1)
    private Integer durationDays;
}
