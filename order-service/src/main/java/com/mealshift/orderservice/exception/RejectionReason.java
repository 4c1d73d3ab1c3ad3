package com.mealshift.orderservice.exception;

/**
 * Expected, user-facing reasons an order operation is refused. The name is sent as the error code.
 */
public enum RejectionReason {
    CUTOFF_PASSED,
    RESTRICTED,
    HORIZON_EXCEEDED,
    DUPLICATE_FOR_DATE,
    SHIFT_UNAVAILABLE,
    COLLECTION_WINDOW_CLOSED
}
