package com.mealshift.orderservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.time.LocalTime;

@Data
public class ShiftRequest {

    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private LocalTime startTime;

    // at or before startTime means the shift ends the next day
    @NotNull
    private LocalTime endTime;

    // optional meal break; set both or neither
    private LocalTime breakStartTime;

    private LocalTime breakEndTime;

    private Boolean active;
}
