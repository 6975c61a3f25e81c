package com.clinicbooking.device.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.device.api.dto.BookDeviceRequest;
import com.clinicbooking.device.api.dto.BookDeviceResponse;
import com.clinicbooking.device.domain.service.DeviceBookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Booking endpoints called by room-service, authenticated by {@code ApiKeyAuthFilter}.
 */
@RestController
@RequestMapping("/api/book-device")
@RequiredArgsConstructor
public class ExternalBookingController {

    private final DeviceBookingService bookingService;

    /**
     * Idempotent by {@code external_booking_id}: 200 with the original booking on replay,
     * 404 unknown device, 409 no capacity.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<BookDeviceResponse>> bookDevice(
            @Valid @RequestBody BookDeviceRequest request) {
        BookDeviceResponse response = bookingService.bookForExternalSystem(request);
        String message = response.replayed() ? "Device booking already exists" : "Device booked successfully";
        return ResponseEntity.ok(BaseResponse.success(message, response));
    }

    @DeleteMapping("/{externalBookingId}")
    public ResponseEntity<BaseResponse<Void>> cancelBooking(@PathVariable String externalBookingId) {
        bookingService.cancelExternalBooking(externalBookingId);
        return ResponseEntity.ok(BaseResponse.success("Device booking canceled", null));
    }
}
