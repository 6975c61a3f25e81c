package com.clinicbooking.common.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states shared by device and room bookings.
 * Serialized in lower case ({@code "needs_revision"}) on the wire.
 */
public enum BookingStatus {
    PENDING,
    APPROVED,
    CONFIRMED,
    REJECTED,
    NEEDS_REVISION,
    CANCELED,
    COMPLETED;

    /** Statuses that hold capacity. Only these are counted against resource quantity. */
    public static final Set<BookingStatus> APPROVED_STATES = EnumSet.of(APPROVED, CONFIRMED);

    /** Statuses that still occupy a slot in listings and count towards a user's active limit. */
    public static final Set<BookingStatus> ACTIVE_STATES = EnumSet.of(PENDING, APPROVED, CONFIRMED, NEEDS_REVISION);

    /** Statuses that make a slot look taken: anything not canceled or rejected. */
    public static final Set<BookingStatus> BLOCKING_STATES = EnumSet.complementOf(EnumSet.of(CANCELED, REJECTED));

    public boolean isTerminal() {
        return this == REJECTED || this == CANCELED || this == COMPLETED;
    }

    public boolean isApproved() {
        return APPROVED_STATES.contains(this);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BookingStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        // "cancelled" is accepted as an alias
        if ("CANCELLED".equals(normalized)) {
            return CANCELED;
        }
        return BookingStatus.valueOf(normalized);
    }
}
