package com.clinicbooking.room.api.controller;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.room.api.dto.HolidayRequest;
import com.clinicbooking.room.api.dto.HolidayResponse;
import com.clinicbooking.room.domain.service.HolidayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Clinic-wide holidays. A holiday closes every room unless the room has its own override for the date.
 */
@RestController
@RequestMapping("/api/v1/holidays")
@RequiredArgsConstructor
public class HolidayController {

    private final HolidayService holidayService;

    @PostMapping
    public ResponseEntity<BaseResponse<HolidayResponse>> addHoliday(@Valid @RequestBody HolidayRequest request) {
        return ResponseEntity.ok(BaseResponse.success(holidayService.addHoliday(request)));
    }

    @DeleteMapping("/{date}")
    public ResponseEntity<BaseResponse<Void>> removeHoliday(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        holidayService.removeHoliday(date);
        return ResponseEntity.ok(BaseResponse.success("Holiday removed", null));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<HolidayResponse>>> listHolidays(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(BaseResponse.success(holidayService.listHolidays(from, to)));
    }
}
