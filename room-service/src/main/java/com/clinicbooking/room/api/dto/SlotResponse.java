package com.clinicbooking.room.api.dto;

import com.clinicbooking.room.domain.slot.TimeSlot;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalTime;

public record SlotResponse(
        @JsonFormat(pattern = "HH:mm") LocalTime start,
        @JsonFormat(pattern = "HH:mm") LocalTime end,
        String label,
        boolean available,
        boolean booked,
        boolean past
) {
    public static SlotResponse from(TimeSlot slot) {
        return new SlotResponse(
                slot.start().toLocalTime(),
                slot.end().toLocalTime(),
                slot.label(),
                slot.available(),
                slot.booked(),
                slot.past());
    }
}
