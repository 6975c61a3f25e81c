package com.clinicbooking.room.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.room.api.dto.DayOffRequest;
import com.clinicbooking.room.api.dto.DayOffResponse;
import com.clinicbooking.room.api.dto.RoomScheduleResponse;
import com.clinicbooking.room.api.dto.ScheduleOverrideResponse;
import com.clinicbooking.room.api.dto.SpecialHoursRequest;
import com.clinicbooking.room.api.dto.UpdateHoursRequest;
import com.clinicbooking.room.api.dto.UpdateLunchRequest;
import com.clinicbooking.room.domain.schedule.EffectiveSchedule;
import com.clinicbooking.room.domain.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Weekly schedule and per-date overrides of a room. Days of week are ISO numbered (1 = Monday).
 */
@RestController
@RequestMapping("/api/v1/rooms/{roomId}/schedule")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleService scheduleService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<RoomScheduleResponse>>> getWeeklySchedule(@PathVariable Long roomId) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.getWeeklySchedule(roomId)));
    }

    @PostMapping("/defaults")
    public ResponseEntity<BaseResponse<List<RoomScheduleResponse>>> ensureDefaults(@PathVariable Long roomId) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.ensureDefaultSchedules(roomId)));
    }

    @PutMapping("/{dayOfWeek}/hours")
    public ResponseEntity<BaseResponse<RoomScheduleResponse>> updateHours(
            @PathVariable Long roomId,
            @PathVariable int dayOfWeek,
            @Valid @RequestBody UpdateHoursRequest request) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.updateHours(roomId, dayOfWeek, request)));
    }

    @PutMapping("/{dayOfWeek}/lunch")
    public ResponseEntity<BaseResponse<RoomScheduleResponse>> updateLunch(
            @PathVariable Long roomId,
            @PathVariable int dayOfWeek,
            @Valid @RequestBody UpdateLunchRequest request) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.updateLunch(roomId, dayOfWeek, request)));
    }

    @GetMapping("/effective")
    public ResponseEntity<BaseResponse<EffectiveSchedule>> getEffectiveSchedule(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.getEffectiveSchedule(roomId, date)));
    }

    /**
     * Whether any booking still blocks the date; checked before closing a day.
     */
    @GetMapping("/has-bookings")
    public ResponseEntity<BaseResponse<Boolean>> hasActiveBookings(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.hasActiveBookingsOnDate(roomId, date)));
    }

    /**
     * Closes the room for a date. Existing bookings are kept and returned for the manager to handle.
     */
    @PostMapping("/overrides/day-off")
    public ResponseEntity<BaseResponse<DayOffResponse>> setDayOff(
            @PathVariable Long roomId,
            @Valid @RequestBody DayOffRequest request) {
        return ResponseEntity.ok(BaseResponse.success(
                scheduleService.setDayOff(roomId, request.date(), request.reason())));
    }

    @PostMapping("/overrides/special-hours")
    public ResponseEntity<BaseResponse<ScheduleOverrideResponse>> setSpecialHours(
            @PathVariable Long roomId,
            @Valid @RequestBody SpecialHoursRequest request) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.setSpecialHours(roomId, request)));
    }

    @DeleteMapping("/overrides/{date}")
    public ResponseEntity<BaseResponse<Void>> removeOverride(
            @PathVariable Long roomId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        scheduleService.removeOverride(roomId, date);
        return ResponseEntity.ok(BaseResponse.success("Override removed", null));
    }

    @GetMapping("/overrides")
    public ResponseEntity<BaseResponse<List<ScheduleOverrideResponse>>> listOverrides(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(BaseResponse.success(scheduleService.listOverrides(roomId, from, to)));
    }
}
