package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record HolidayRequest(
        @NotNull(message = "date is required")
        LocalDate date,

        @NotBlank(message = "name is required")
        String name
) {
}
