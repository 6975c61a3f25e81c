package com.clinicbooking.room.client.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;

/**
 * Body of {@code POST /api/book-device}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceBookingRequest(
        Long deviceId,
        String deviceName,
        LocalDate date,
        String externalBookingId,
        String clientName,
        String clientPhone
) {
}
