package com.clinicbooking.room.api.dto;

import com.clinicbooking.room.domain.model.Holiday;

import java.time.LocalDate;

public record HolidayResponse(Long id, LocalDate date, String name) {

    public static HolidayResponse from(Holiday holiday) {
        return new HolidayResponse(holiday.getId(), holiday.getDate(), holiday.getName());
    }
}
