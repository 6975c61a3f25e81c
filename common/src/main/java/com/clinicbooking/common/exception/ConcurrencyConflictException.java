package com.clinicbooking.common.exception;

/**
 * The booking was modified since the caller read it. Re-read and retry.
 */
public class ConcurrencyConflictException extends ConflictException {

    public ConcurrencyConflictException(Long bookingId, long expectedVersion) {
        super(String.format("Booking %d was modified concurrently (expected version %d)", bookingId, expectedVersion),
                ErrorCodes.CONCURRENCY_CONFLICT);
    }
}
