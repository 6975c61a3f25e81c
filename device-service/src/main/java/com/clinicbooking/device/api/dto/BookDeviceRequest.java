package com.clinicbooking.device.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Booking request from room-service. Either {@code deviceId} or {@code deviceName} identifies the device.
 * @param externalBookingId idempotency key, e.g. "crm-42"; a replay returns the original booking
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BookDeviceRequest(
        Long deviceId,

        String deviceName,

        @NotNull(message = "date is required")
        LocalDate date,

        @NotBlank(message = "external_booking_id is required")
        @Size(max = 255, message = "external_booking_id is too long")
        String externalBookingId,

        String clientName,

        String clientPhone
) {
}
