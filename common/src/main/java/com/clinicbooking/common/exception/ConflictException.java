package com.clinicbooking.common.exception;

/**
 * Request conflicts with the current state of a booking or resource. Mapped to HTTP 409.
 */
public abstract class ConflictException extends BusinessException {

    protected ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }
}
