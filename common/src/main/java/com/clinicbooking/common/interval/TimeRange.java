package com.clinicbooking.common.interval;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Sub-day extent, half-open {@code [start, end)}: a booking ending at 10:00 does not
 * overlap one starting at 10:00.
 */
public record TimeRange(LocalDateTime start, LocalDateTime end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end " + end + " must be after start " + start);
        }
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
