package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * Room booking, optionally with a device from device-service identified by id or name.
 *
 * @param externalBookingId optional client idempotency key; a replay returns the original booking
 * @param createdByManager true creates the booking already approved and skips the per-user limit
 */
public record CreateRoomBookingRequest(
        @NotNull(message = "User ID cannot be null")
        @Positive(message = "User ID must be positive")
        Long userId,

        @NotNull(message = "Room ID cannot be null")
        Long roomId,

        @NotNull(message = "Start time cannot be null")
        LocalDateTime startTime,

        @NotNull(message = "End time cannot be null")
        LocalDateTime endTime,

        Long deviceId,

        String deviceName,

        String clientName,

        String clientPhone,

        @Size(max = 1000, message = "Comment is too long")
        String comment,

        @Size(max = 255, message = "External booking ID is too long")
        String externalBookingId,

        boolean createdByManager
) {
}
