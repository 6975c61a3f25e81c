package com.clinicbooking.common.exception;

public class ActiveLimitReachedException extends BusinessException {

    public ActiveLimitReachedException(Long userId, int limit) {
        super(String.format("User %d already has %d active bookings", userId, limit),
                ErrorCodes.ACTIVE_LIMIT_REACHED);
    }
}
