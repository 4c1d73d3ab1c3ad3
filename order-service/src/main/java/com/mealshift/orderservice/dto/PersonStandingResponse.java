package com.mealshift.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class PersonStandingResponse {
    private UUID personId;
    private String displayName;
    private int strikeCount;
    private int strikeThreshold;
    private boolean restricted;
    private RestrictionResponse restriction;
}
