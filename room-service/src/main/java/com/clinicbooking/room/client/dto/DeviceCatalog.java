package com.clinicbooking.room.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DeviceCatalog(
        LocalDate date,
        List<DeviceSummary> devices
) {
}
