package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Replacement hours for one date. Without start/end the weekly hours apply but a holiday
 * on that date no longer closes the room.
 */
public record SpecialHoursRequest(
        @NotNull(message = "date is required")
        LocalDate date,

        LocalTime startTime,

        LocalTime endTime,

        LocalTime lunchStart,

        LocalTime lunchEnd,

        @Size(max = 255, message = "reason is too long")
        String reason
) {
}
