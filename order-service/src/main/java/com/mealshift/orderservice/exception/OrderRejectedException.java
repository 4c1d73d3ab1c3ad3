package com.mealshift.orderservice.exception;

import lombok.Getter;

/**
 * Exception thrown when a booking rule refuses an order operation.
 * HTTP Status: 422 Unprocessable Entity, error code = reason
 */
@Getter
public class OrderRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public OrderRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
