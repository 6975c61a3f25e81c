package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record DayOffRequest(
        @NotNull(message = "date is required")
        LocalDate date,

        @Size(max = 255, message = "reason is too long")
        String reason
) {
}
