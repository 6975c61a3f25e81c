package com.clinicbooking.common.interval;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Whole-day extent with inclusive bounds on both ends.
 * A booking ending on day N and another starting on day N overlap.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        if (end == null) {
            end = start;
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end date " + end + " is before start date " + start);
        }
    }

    public static DateRange of(LocalDate start, LocalDate endOrNull) {
        return new DateRange(start, endOrNull);
    }

    public static DateRange singleDay(LocalDate date) {
        return new DateRange(date, date);
    }

    public boolean overlaps(DateRange other) {
        return !end.isBefore(other.start) && !other.end.isBefore(start);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public boolean isMultiDay() {
        return end.isAfter(start);
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }
}
