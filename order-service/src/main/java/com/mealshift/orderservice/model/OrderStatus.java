package com.mealshift.orderservice.model;

/**
 * Lifecycle of a meal order. PLACED is the only non-terminal status.
 */
public enum OrderStatus {
    PLACED,
    COLLECTED,
    NOT_COLLECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PLACED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return this == PLACED && target != PLACED;
    }
}
