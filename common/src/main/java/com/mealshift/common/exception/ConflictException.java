package com.mealshift.common.exception;

/**
 * Thrown when the request conflicts with the current state of a resource,
 * e.g. restricting a person who already has an active restriction.
 * HTTP Status: 409 Conflict (set in GlobalExceptionHandler)
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
