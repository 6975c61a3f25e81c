package com.clinicbooking.room.domain.slot;

import com.clinicbooking.common.interval.TimeRange;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One bookable slot. {@code available} is {@code !booked && !past}.
 */
public record TimeSlot(
        LocalDateTime start,
        LocalDateTime end,
        boolean booked,
        boolean past,
        boolean available
) {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static TimeSlot of(LocalDateTime start, LocalDateTime end, boolean booked, boolean past) {
        return new TimeSlot(start, end, booked, past, !booked && !past);
    }

    public TimeRange extent() {
        return new TimeRange(start, end);
    }

    /** "HH:mm-HH:mm" */
    public String label() {
        return start.format(HH_MM) + "-" + end.format(HH_MM);
    }
}
