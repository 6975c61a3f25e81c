package com.clinicbooking.device.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

/**
 * @param itemIds optional filter; empty or null means every active device
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AvailabilityRangeRequest(
        @NotNull(message = "start_date is required")
        LocalDate startDate,

        @NotNull(message = "end_date is required")
        LocalDate endDate,

        List<Long> itemIds
) {
}
