package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Replaces the device of a booking, identified by id or name.
 */
public record ChangeDeviceRequest(
        @NotNull(message = "Expected version cannot be null")
        Long expectedVersion,

        Long deviceId,

        String deviceName
) {
}
