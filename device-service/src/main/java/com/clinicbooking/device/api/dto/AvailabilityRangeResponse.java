package com.clinicbooking.device.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AvailabilityRangeResponse(
        LocalDate start,
        LocalDate end,
        List<ItemAvailability> items
) {

    public record ItemAvailability(
            Long id,
            String name,
            List<DateAvailability> availability
    ) {
    }

    /**
     * @param reason "reserved" or "booked" when unavailable, absent otherwise
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DateAvailability(
            LocalDate date,
            boolean available,
            String reason
    ) {
    }
}
