package com.clinicbooking.room.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.room.api.dto.ChangeDeviceRequest;
import com.clinicbooking.room.api.dto.CreateRoomBookingRequest;
import com.clinicbooking.room.api.dto.RescheduleBookingRequest;
import com.clinicbooking.room.api.dto.RoomBookingResponse;
import com.clinicbooking.room.domain.service.HourlyBookingService;
import com.clinicbooking.room.saga.RoomBookingOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/room-bookings")
@RequiredArgsConstructor
public class RoomBookingController {

    private final RoomBookingOrchestrator orchestrator;
    private final HourlyBookingService bookingService;

    /**
     * Creates a booking. When a device is requested the response carries the device outcome;
     * {@code unconfirmed} means device-service did not answer and the reservation is retried in the background.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<RoomBookingResponse>> createBooking(
            @Valid @RequestBody CreateRoomBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking created successfully", orchestrator.createBooking(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<RoomBookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBooking(id)));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<RoomBookingResponse>>> getBookingsForUser(@RequestParam Long userId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingsForUser(userId)));
    }

    @GetMapping("/pending")
    public ResponseEntity<BaseResponse<List<RoomBookingResponse>>> getPendingBookings() {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getPendingBookings()));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<BaseResponse<StatusUpdateResponse>> updateStatus(
            @PathVariable Long id,
            @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(BaseResponse.success(orchestrator.updateStatus(id, request)));
    }

    @PutMapping("/{id}/schedule")
    public ResponseEntity<BaseResponse<RoomBookingResponse>> reschedule(
            @PathVariable Long id,
            @Valid @RequestBody RescheduleBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking rescheduled", orchestrator.reschedule(id, request)));
    }

    @PutMapping("/{id}/device")
    public ResponseEntity<BaseResponse<RoomBookingResponse>> changeDevice(
            @PathVariable Long id,
            @Valid @RequestBody ChangeDeviceRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Device changed", orchestrator.changeDevice(id, request)));
    }
}
