package com.clinicbooking.room.domain.service;

import com.clinicbooking.room.domain.model.HourlyBooking;

/**
 * @param replayed true when the client's external booking id was already used
 */
public record CreatedBooking(HourlyBooking booking, boolean replayed) {
}
