package com.mealshift.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Structured record of a single engine action, published to the audit exchange.
 * The routing key equals {@link #action}, e.g. {@code order.cancelled.late}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecordContract {

    private String action;

    // ORDER, PERSON, RESTRICTION, POLICY, SHIFT, HOLIDAY
    private String entityType;
    private String entityId;

    // null when the engine itself acted (sweep, automatic restriction)
    private UUID actorId;

    private UUID personId;
    private String fromStatus;
    private String toStatus;
    private String description;
    private Map<String, Object> metadata;
    private Instant occurredAt;
}
