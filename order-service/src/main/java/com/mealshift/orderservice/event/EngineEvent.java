package com.mealshift.orderservice.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@RequiredArgsConstructor
@ToString(exclude = "payload")
public class EngineEvent {

    private final EventType type;
    private final Object payload;
    private final Instant occurredAt;
}
