package com.mealshift.orderservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestrictionResponse {
    private UUID id;
    private UUID personId;
    private String reason;
    private Instant startsAt;
    private Instant endsAt;
    private boolean automatic;
    // evaluated against the clock, not just the stored flag
    private boolean inEffect;
    private Instant liftedAt;
    private UUID liftedBy;
    private String liftReason;
}
