package com.clinicbooking.common.exception;

public class InvalidTransitionException extends ConflictException {

    public InvalidTransitionException(String from, String to) {
        super(String.format("Cannot change booking status from %s to %s", from, to),
                ErrorCodes.INVALID_TRANSITION);
    }

    public InvalidTransitionException(String message) {
        super(message, ErrorCodes.INVALID_TRANSITION);
    }
}
