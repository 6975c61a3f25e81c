package com.clinicbooking.room.api.dto;

import com.clinicbooking.room.domain.model.RoomSchedule;

import java.time.LocalTime;

public record RoomScheduleResponse(
        int dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        LocalTime lunchStart,
        LocalTime lunchEnd,
        int slotDurationMinutes,
        boolean active
) {
    public static RoomScheduleResponse from(RoomSchedule schedule) {
        return new RoomScheduleResponse(
                schedule.getDayOfWeek(),
                schedule.getStartTime(),
                schedule.getEndTime(),
                schedule.getLunchStart(),
                schedule.getLunchEnd(),
                schedule.getSlotDurationMinutes(),
                schedule.isActive());
    }
}
