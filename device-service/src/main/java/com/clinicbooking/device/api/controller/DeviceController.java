package com.clinicbooking.device.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.device.api.dto.AvailabilityRangeRequest;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse;
import com.clinicbooking.device.api.dto.DeviceAvailabilityResponse;
import com.clinicbooking.device.api.dto.DeviceListResponse;
import com.clinicbooking.device.domain.service.DeviceCatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
public class DeviceController {

    private final DeviceCatalogService catalogService;

    @GetMapping
    public ResponseEntity<BaseResponse<DeviceListResponse>> listDevices(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "include_reserved", defaultValue = "false") boolean includeReserved) {
        return ResponseEntity.ok(BaseResponse.success(catalogService.listDevices(date, includeReserved)));
    }

    @GetMapping("/{deviceId}/availability")
    public ResponseEntity<BaseResponse<DeviceAvailabilityResponse>> getAvailability(
            @PathVariable Long deviceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(catalogService.getAvailability(deviceId, date)));
    }

    @PostMapping("/availability")
    public ResponseEntity<BaseResponse<AvailabilityRangeResponse>> getAvailabilityRange(
            @Valid @RequestBody AvailabilityRangeRequest request) {
        return ResponseEntity.ok(BaseResponse.success(catalogService.getAvailability(request)));
    }
}
