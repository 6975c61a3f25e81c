package com.clinicbooking.room.domain.model;

/**
 * Outcome of reserving the device attached to a room booking.
 */
public enum DeviceReservationStatus {
    /** No device requested. */
    NOT_REQUESTED,
    CONFIRMED,
    /** The device call failed without a definite answer; retried by the recovery job. */
    UNCONFIRMED,
    /** device-service refused: no capacity, unknown device or invalid date. */
    REJECTED
}
