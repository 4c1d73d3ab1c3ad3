package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class StrikeReductionRequest {

    // ignored when toZero is set
    @Min(1)
    private Integer amount;

    private boolean toZero;

    @NotBlank(message = "Reason is required")
    @Size(min = 5, max = 500)
    private String reason;
}
