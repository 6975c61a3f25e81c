package com.clinicbooking.device.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.device.api.dto.CreateDeviceBookingRequest;
import com.clinicbooking.device.api.dto.DeviceBookingResponse;
import com.clinicbooking.device.api.dto.DeviceResponse;
import com.clinicbooking.device.domain.service.DeviceBookingService;
import com.clinicbooking.device.domain.service.DeviceCatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * User and manager operations on device bookings.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DeviceBookingController {

    private final DeviceBookingService bookingService;
    private final DeviceCatalogService catalogService;

    @PostMapping("/device-bookings")
    public ResponseEntity<BaseResponse<DeviceBookingResponse>> createBooking(
            @Valid @RequestBody CreateDeviceBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking created successfully", bookingService.createBooking(request)));
    }

    @GetMapping("/device-bookings/{id}")
    public ResponseEntity<BaseResponse<DeviceBookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBooking(id)));
    }

    @GetMapping("/device-bookings")
    public ResponseEntity<BaseResponse<List<DeviceBookingResponse>>> getBookingsForUser(@RequestParam Long userId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingsForUser(userId)));
    }

    /**
     * 409 with CONCURRENCY_CONFLICT when {@code expectedVersion} is stale: re-read and retry.
     */
    @PatchMapping("/device-bookings/{id}/status")
    public ResponseEntity<BaseResponse<StatusUpdateResponse>> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.updateStatus(id, request)));
    }

    @PutMapping("/devices/{deviceId}/permanent-reserved")
    public ResponseEntity<BaseResponse<Void>> setPermanentReserved(
            @PathVariable Long deviceId,
            @RequestParam boolean reserved) {
        catalogService.setPermanentReserved(deviceId, reserved);
        return ResponseEntity.ok(BaseResponse.success(null));
    }

    @GetMapping("/devices/permanent-reserved")
    public ResponseEntity<BaseResponse<List<DeviceResponse>>> listPermanentReserved() {
        return ResponseEntity.ok(BaseResponse.success(catalogService.listPermanentReserved()));
    }
}
