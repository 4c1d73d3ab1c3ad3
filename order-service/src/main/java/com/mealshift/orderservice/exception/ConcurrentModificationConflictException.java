package com.mealshift.orderservice.exception;

/**
 * Exception thrown when a write kept colliding with concurrent writers after all retries.
 * The caller may safely repeat the request.
 * HTTP Status: 409 Conflict (retryable)
 */
public class ConcurrentModificationConflictException extends RuntimeException {

    public ConcurrentModificationConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
