package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SweepResult {
    Instant ranAt;
    // orders whose collection window had closed
    int due;
    int transitioned;
    // lost the conditional update to someone else
    int skipped;
    int failed;
    int restrictionsOpened;
}
