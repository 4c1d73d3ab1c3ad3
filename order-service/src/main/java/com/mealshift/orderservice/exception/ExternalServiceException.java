package com.mealshift.orderservice.exception;

/**
 * Thrown when an external collaborator such as the time reference cannot be
 * reached or answers with something unusable.
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
