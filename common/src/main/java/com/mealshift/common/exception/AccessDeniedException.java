package com.mealshift.common.exception;

/**
 * Thrown when the caller's role or identity does not allow the operation.
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
