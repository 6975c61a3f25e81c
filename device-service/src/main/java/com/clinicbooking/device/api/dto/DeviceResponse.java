package com.clinicbooking.device.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceResponse(
        Long id,
        String name,
        String description,
        boolean available,
        boolean permanentReserved
) {
}
