package com.clinicbooking.common.interval;

import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Finds existing reservations that collide with a candidate extent.
 * Whole-day and hourly bookings keep their own overlap rules, see {@link DateRange} and {@link TimeRange}.
 */
public final class ConflictDetector {

    private ConflictDetector() {
    }

    public static <T> List<T> conflicts(DateRange candidate, Collection<T> existing, Function<T, DateRange> extent) {
        return existing.stream()
                .filter(e -> extent.apply(e).overlaps(candidate))
                .toList();
    }

    public static <T> List<T> conflicts(TimeRange candidate, Collection<T> existing, Function<T, TimeRange> extent) {
        return existing.stream()
                .filter(e -> extent.apply(e).overlaps(candidate))
                .toList();
    }

    public static <T> boolean hasConflict(TimeRange candidate, Collection<T> existing, Function<T, TimeRange> extent) {
        return existing.stream().anyMatch(e -> extent.apply(e).overlaps(candidate));
    }

    public static <T> long countOverlapping(DateRange candidate, Collection<T> existing, Function<T, DateRange> extent) {
        return existing.stream().filter(e -> extent.apply(e).overlaps(candidate)).count();
    }
}
