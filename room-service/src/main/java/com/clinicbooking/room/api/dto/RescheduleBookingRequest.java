package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;

/**
 * Moves a booking to a new interval. A booking with a device gets it re-reserved for the new day.
 */
public record RescheduleBookingRequest(
        @NotNull(message = "Expected version cannot be null")
        Long expectedVersion,

        @NotNull(message = "Start time cannot be null")
        LocalDateTime startTime,

        @NotNull(message = "End time cannot be null")
        LocalDateTime endTime
) {
}
