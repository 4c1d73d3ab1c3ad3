package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalDate;
import java.util.UUID;

@Data
public class HolidayRequest {

    @NotNull
    private LocalDate date;

    // omit to close every shift on that date
    private UUID shiftId;

    @NotBlank
    @Size(max = 200)
    private String description;
}
