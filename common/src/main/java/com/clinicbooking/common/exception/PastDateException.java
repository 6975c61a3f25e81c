package com.clinicbooking.common.exception;

public class PastDateException extends BusinessException {

    public PastDateException(String message) {
        super(message, ErrorCodes.PAST_DATE);
    }
}
