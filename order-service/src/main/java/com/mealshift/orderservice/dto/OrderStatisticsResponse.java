package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class OrderStatisticsResponse {
    private LocalDate from;
    private LocalDate to;
    private long total;
    private long placed;
    private long collected;
    private long notCollected;
    private long cancelled;
    // collected / (collected + notCollected) in percent, one decimal
    private double pickupRate;
}
