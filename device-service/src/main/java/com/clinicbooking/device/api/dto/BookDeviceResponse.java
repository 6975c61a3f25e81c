package com.clinicbooking.device.api.dto;

import com.clinicbooking.common.booking.BookingStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param replayed true when the external id was already used and the original booking is returned
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BookDeviceResponse(
        Long bookingId,
        String externalBookingId,
        Long deviceId,
        String deviceName,
        BookingStatus status,
        boolean replayed
) {
}
