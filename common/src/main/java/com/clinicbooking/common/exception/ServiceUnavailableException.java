package com.clinicbooking.common.exception;

/**
 * Thrown when a required dependency is temporarily unavailable.
 * Mapped to HTTP 503; the caller may retry with the same idempotency key.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getErrorCode() {
        return ErrorCodes.SERVICE_UNAVAILABLE;
    }
}
