package com.clinicbooking.room.domain.model;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.interval.TimeRange;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Room booking over {@code [startTime, endTime)}, optionally with a device reserved
 * in device-service under the key {@code crm-{id}}.
 *
 * As for device bookings, {@code version} is maintained by conditional updates in
 * {@code HourlyBookingRepository}, not by JPA.
 */
@Entity
@Table(name = "hourly_bookings", indexes = {
        @Index(name = "idx_hourly_bookings_room_time", columnList = "room_id,start_time,end_time"),
        @Index(name = "idx_hourly_bookings_user", columnList = "user_id"),
        @Index(name = "idx_hourly_bookings_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourlyBooking {

    public static final String DEVICE_KEY_PREFIX = "crm-";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "room_name", nullable = false)
    private String roomName;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(name = "device_id")
    private Long deviceId;

    @Column(name = "device_name")
    private String deviceName;

    @Column(name = "client_name")
    private String clientName;

    @Column(name = "client_phone")
    private String clientPhone;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "comment", length = 1000)
    private String comment;

    @Column(name = "manager_comment", length = 1000)
    private String managerComment;

    @Column(name = "external_booking_id", unique = true)
    private String externalBookingId;

    @Column(name = "external_device_booking_id")
    private String externalDeviceBookingId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "device_reservation_status", nullable = false, length = 20)
    private DeviceReservationStatus deviceReservationStatus = DeviceReservationStatus.NOT_REQUESTED;

    @Builder.Default
    @Column(name = "reminder_sent", nullable = false)
    private boolean reminderSent = false;

    @Builder.Default
    @Column(name = "version", nullable = false)
    private Long version = 1L;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = BookingStatus.PENDING;
        }
        if (version == null) {
            version = 1L;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public TimeRange extent() {
        return new TimeRange(startTime, endTime);
    }

    /** Idempotency key sent to device-service. */
    public String deviceBookingKey() {
        return DEVICE_KEY_PREFIX + id;
    }
}
