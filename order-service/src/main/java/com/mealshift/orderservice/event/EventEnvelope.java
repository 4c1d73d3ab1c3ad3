package com.mealshift.orderservice.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of every stream event. Clients treat it as a hint to re-fetch, not as the source of truth.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventEnvelope {

    private String event;
    private Object data;
    private Instant timestamp;

    public static EventEnvelope of(EngineEvent engineEvent) {
        return EventEnvelope.builder()
                .event(engineEvent.getType().getWireName())
                .data(engineEvent.getPayload())
                .timestamp(engineEvent.getOccurredAt())
                .build();
    }
}
