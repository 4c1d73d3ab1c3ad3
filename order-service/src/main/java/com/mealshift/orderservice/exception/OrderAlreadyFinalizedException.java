package com.mealshift.orderservice.exception;

import com.mealshift.orderservice.model.OrderStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * Exception thrown when a transition is attempted on an order that already left PLACED,
 * including when a concurrent request won the conditional update.
 * HTTP Status: 409 Conflict
 */
@Getter
public class OrderAlreadyFinalizedException extends RuntimeException {

    private final UUID orderId;
    private final OrderStatus currentStatus;

    public OrderAlreadyFinalizedException(UUID orderId, OrderStatus currentStatus) {
        super("Order " + orderId + " is already finalized with status " + currentStatus);
        this.orderId = orderId;
        this.currentStatus = currentStatus;
    }
}
