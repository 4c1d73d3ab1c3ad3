package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
public class ServerTimeResponse {
    private Instant serverTime;
    private String zone;
    private LocalDate today;
    private boolean referenceEnabled;
    private long offsetMillis;
    private Instant lastSyncAt;
}
