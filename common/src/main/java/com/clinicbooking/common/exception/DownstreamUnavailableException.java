package com.clinicbooking.common.exception;

/**
 * A call to the sibling service failed or timed out without a definite answer.
 */
public class DownstreamUnavailableException extends ServiceUnavailableException {

    public DownstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return ErrorCodes.DOWNSTREAM_UNAVAILABLE;
    }
}
