package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalTime;

/**
 * @param slotDurationMinutes null keeps the current duration
 */
public record UpdateHoursRequest(
        @NotNull(message = "startTime is required")
        LocalTime startTime,

        @NotNull(message = "endTime is required")
        LocalTime endTime,

        @Positive(message = "slotDurationMinutes must be positive")
        @Max(value = 480, message = "slotDurationMinutes is too long")
        Integer slotDurationMinutes
) {
}
