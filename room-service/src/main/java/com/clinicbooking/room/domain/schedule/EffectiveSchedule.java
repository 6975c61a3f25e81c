package com.clinicbooking.room.domain.schedule;

import com.clinicbooking.common.interval.TimeRange;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Opening hours that actually apply to one room on one date, after overrides and holidays.
 * A closed schedule carries only {@code closedReason}.
 */
public record EffectiveSchedule(
        boolean open,
        LocalTime start,
        LocalTime end,
        LocalTime lunchStart,
        LocalTime lunchEnd,
        int slotDurationMinutes,
        String closedReason
) {

    public static final int DEFAULT_SLOT_DURATION_MINUTES = 30;

    public static EffectiveSchedule open(LocalTime start, LocalTime end,
                                         LocalTime lunchStart, LocalTime lunchEnd,
                                         Integer slotDurationMinutes) {
        int duration = slotDurationMinutes == null || slotDurationMinutes <= 0
                ? DEFAULT_SLOT_DURATION_MINUTES
                : slotDurationMinutes;
        return new EffectiveSchedule(true, start, end, lunchStart, lunchEnd, duration, null);
    }

    public static EffectiveSchedule closed(String reason) {
        return new EffectiveSchedule(false, null, null, null, null, 0, reason);
    }

    public boolean hasLunch() {
        return lunchStart != null && lunchEnd != null && lunchStart.isBefore(lunchEnd);
    }

    public TimeRange hoursOn(LocalDate date) {
        return new TimeRange(date.atTime(start), date.atTime(end));
    }

    public Optional<TimeRange> lunchOn(LocalDate date) {
        return hasLunch() ? Optional.of(new TimeRange(date.atTime(lunchStart), date.atTime(lunchEnd))) : Optional.empty();
    }
}
