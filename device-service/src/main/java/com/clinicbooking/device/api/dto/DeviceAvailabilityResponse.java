package com.clinicbooking.device.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;

/**
 * Availability of one device on one day. {@code booked} counts approved bookings only.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceAvailabilityResponse(
        Long deviceId,
        String deviceName,
        LocalDate date,
        int totalQuantity,
        long booked,
        boolean permanentReserved,
        boolean available
) {
}
