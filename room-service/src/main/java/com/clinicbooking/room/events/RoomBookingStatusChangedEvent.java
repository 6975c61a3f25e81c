package com.clinicbooking.room.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Published after a room booking is created, after every status change and after a reschedule
 * or device change (then {@code previousStatus} equals {@code status}).
 * {@code previousStatus} is null for a new booking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomBookingStatusChangedEvent {
    private Long bookingId;
    private Long roomId;
    private String roomName;
    private Long userId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String previousStatus;
    private String status;
    private long version;
    private String deviceReservationStatus;
    private Instant timestamp;
}
