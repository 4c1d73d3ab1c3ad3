package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class StrikeReductionResponse {
    private UUID personId;
    private int previousCount;
    private int newCount;
    private int threshold;
    private boolean restrictionLifted;
    private String reason;
}
