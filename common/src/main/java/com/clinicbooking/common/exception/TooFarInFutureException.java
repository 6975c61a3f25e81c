package com.clinicbooking.common.exception;

public class TooFarInFutureException extends BusinessException {

    public TooFarInFutureException(int maxAdvanceDays) {
        super(String.format("Bookings are accepted at most %d days ahead", maxAdvanceDays),
                ErrorCodes.TOO_FAR_IN_FUTURE);
    }
}
