package com.clinicbooking.common.dto;

import com.clinicbooking.common.booking.BookingStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Status change carrying the version the caller last read.
 */
public record StatusUpdateRequest(
        @NotNull(message = "Expected version cannot be null")
        @Positive(message = "Expected version must be positive")
        Long expectedVersion,

        @NotNull(message = "Target status cannot be null")
        BookingStatus status,

        @Size(max = 1000, message = "Comment is too long")
        String comment
) {
}
