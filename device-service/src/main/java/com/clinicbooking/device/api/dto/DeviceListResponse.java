package com.clinicbooking.device.api.dto;

import java.time.LocalDate;
import java.util.List;

public record DeviceListResponse(
        LocalDate date,
        List<DeviceResponse> devices
) {
}
