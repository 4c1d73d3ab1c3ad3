package com.mealshift.orderservice.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Internal signal that a person was restricted; their open future orders are released.
 */
@Getter
@RequiredArgsConstructor
public class RestrictionOpenedEvent {

    private final UUID personId;
    private final UUID restrictionId;
    // null for an indefinite restriction
    private final Instant endsAt;
}
