package com.clinicbooking.room.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.room.bridge.DeviceCatalogService;
import com.clinicbooking.room.client.dto.DeviceCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Devices bookable on a date, proxied from device-service for the booking form.
 */
@RestController
@RequestMapping("/api/v1/devices")
@RequiredArgsConstructor
public class DeviceCatalogController {

    private final DeviceCatalogService deviceCatalogService;

    @GetMapping
    public ResponseEntity<BaseResponse<DeviceCatalog>> listDevices(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(deviceCatalogService.listDevices(date)));
    }
}
