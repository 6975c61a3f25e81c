package com.clinicbooking.room.client.dto;

import com.clinicbooking.common.booking.BookingStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceBookingResult(
        Long bookingId,
        String externalBookingId,
        Long deviceId,
        String deviceName,
        BookingStatus status,
        boolean replayed
) {
}
