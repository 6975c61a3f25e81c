package com.clinicbooking.device.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * Booking made directly by a user (or a manager on their behalf).
 * @param endDate null for a single day
 * @param createdByManager true creates the booking already approved
 */
public record CreateDeviceBookingRequest(
        @NotNull(message = "User ID cannot be null")
        @Positive(message = "User ID must be positive")
        Long userId,

        String userName,

        String phone,

        @NotNull(message = "Device ID cannot be null")
        Long deviceId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        LocalDate endDate,

        @Size(max = 1000, message = "Comment is too long")
        String comment,

        boolean createdByManager
) {
}
