package com.clinicbooking.room.api.dto;

import java.time.LocalTime;

/**
 * Both null removes the lunch break.
 */
public record UpdateLunchRequest(
        LocalTime lunchStart,
        LocalTime lunchEnd
) {
}
