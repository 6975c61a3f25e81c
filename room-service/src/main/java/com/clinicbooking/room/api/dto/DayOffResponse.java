package com.clinicbooking.room.api.dto;

import java.util.List;

/**
 * @param affectedBookings bookings on that date that are still active; they are not canceled automatically
 */
public record DayOffResponse(
        ScheduleOverrideResponse override,
        List<RoomBookingResponse> affectedBookings
) {
}
