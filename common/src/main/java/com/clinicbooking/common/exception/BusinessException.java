package com.clinicbooking.common.exception;

import lombok.Getter;

/**
 * Business rule violation. Mapped to HTTP 400 unless a subclass family says otherwise.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = ErrorCodes.BUSINESS_ERROR;
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
