package com.clinicbooking.room.domain.service;

import com.clinicbooking.room.domain.model.HourlyBooking;

/**
 * @param booking the booking as written, version already incremented
 * @param deviceHeld true when device-service may still hold a booking under the old values
 */
public record ChangedBooking(HourlyBooking booking, boolean deviceHeld) {
}
