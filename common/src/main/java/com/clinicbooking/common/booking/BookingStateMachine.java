package com.clinicbooking.common.booking;

import com.clinicbooking.common.exception.InvalidTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal booking status transitions. Terminal states accept none.
 */
public final class BookingStateMachine {

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = new EnumMap<>(BookingStatus.class);

    static {
        TRANSITIONS.put(BookingStatus.PENDING, EnumSet.of(
                BookingStatus.APPROVED, BookingStatus.CONFIRMED, BookingStatus.REJECTED,
                BookingStatus.NEEDS_REVISION, BookingStatus.CANCELED));
        TRANSITIONS.put(BookingStatus.NEEDS_REVISION, EnumSet.of(BookingStatus.PENDING, BookingStatus.CANCELED));
        TRANSITIONS.put(BookingStatus.APPROVED, EnumSet.of(
                BookingStatus.CONFIRMED, BookingStatus.COMPLETED, BookingStatus.CANCELED));
        TRANSITIONS.put(BookingStatus.CONFIRMED, EnumSet.of(BookingStatus.COMPLETED, BookingStatus.CANCELED));
        TRANSITIONS.put(BookingStatus.REJECTED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(BookingStatus.CANCELED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(BookingStatus.COMPLETED, EnumSet.noneOf(BookingStatus.class));
    }

    private BookingStateMachine() {
    }

    public static boolean canTransition(BookingStatus from, BookingStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * @throws InvalidTransitionException when {@code from -> to} is not allowed
     */
    public static void requireTransition(BookingStatus from, BookingStatus to) {
        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(from.value(), to.value());
        }
    }

    public static Set<BookingStatus> allowedTargets(BookingStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, Set.of()));
    }

    /** Statuses from which a booking may still be canceled. */
    public static Set<BookingStatus> cancellableStates() {
        EnumSet<BookingStatus> result = EnumSet.noneOf(BookingStatus.class);
        TRANSITIONS.forEach((from, targets) -> {
            if (targets.contains(BookingStatus.CANCELED)) {
                result.add(from);
            }
        });
        return result;
    }
}
