package com.clinicbooking.room.api.dto;

import com.clinicbooking.room.domain.model.ScheduleOverride;

import java.time.LocalDate;
import java.time.LocalTime;

public record ScheduleOverrideResponse(
        Long id,
        Long roomId,
        LocalDate date,
        boolean closed,
        LocalTime startTime,
        LocalTime endTime,
        LocalTime lunchStart,
        LocalTime lunchEnd,
        String reason
) {
    public static ScheduleOverrideResponse from(ScheduleOverride override) {
        return new ScheduleOverrideResponse(
                override.getId(),
                override.getRoomId(),
                override.getDate(),
                override.isClosed(),
                override.getStartTime(),
                override.getEndTime(),
                override.getLunchStart(),
                override.getLunchEnd(),
                override.getReason());
    }
}
