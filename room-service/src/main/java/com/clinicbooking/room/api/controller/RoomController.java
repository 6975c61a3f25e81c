package com.clinicbooking.room.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.room.api.dto.CreateRoomRequest;
import com.clinicbooking.room.api.dto.DurationOptionsResponse;
import com.clinicbooking.room.api.dto.RoomBookingResponse;
import com.clinicbooking.room.api.dto.RoomResponse;
import com.clinicbooking.room.api.dto.RoomSlotsResponse;
import com.clinicbooking.room.domain.service.HourlyBookingService;
import com.clinicbooking.room.domain.service.RoomService;
import com.clinicbooking.room.domain.service.SlotService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/rooms")
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;
    private final SlotService slotService;
    private final HourlyBookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<RoomResponse>> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Room created successfully", roomService.createRoom(request)));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<RoomResponse>>> listRooms() {
        return ResponseEntity.ok(BaseResponse.success(roomService.listRooms()));
    }

    @GetMapping("/{roomId}/slots")
    public ResponseEntity<BaseResponse<RoomSlotsResponse>> getSlots(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(slotService.getSlots(roomId, date)));
    }

    /**
     * Durations (minutes) bookable from {@code start} over consecutive free slots.
     */
    @GetMapping("/{roomId}/slots/durations")
    public ResponseEntity<BaseResponse<DurationOptionsResponse>> getDurationOptions(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime start) {
        return ResponseEntity.ok(BaseResponse.success(slotService.getDurationOptions(roomId, date, start)));
    }

    @GetMapping("/{roomId}/bookings")
    public ResponseEntity<BaseResponse<List<RoomBookingResponse>>> getRoomBookings(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getRoomBookings(roomId, date)));
    }
}
