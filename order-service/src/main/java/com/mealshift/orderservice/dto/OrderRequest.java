package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

@Data
public class OrderRequest {

    @NotNull(message = "Shift is required")
    private UUID shiftId;

    @NotNull(message = "Order date is required")
    private LocalDate orderDate;
}
