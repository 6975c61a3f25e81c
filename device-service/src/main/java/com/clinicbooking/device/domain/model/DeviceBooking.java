package com.clinicbooking.device.domain.model;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.interval.DateRange;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Whole-day device reservation. {@code endDate == null} means a single day.
 *
 * {@code version} is not a JPA {@code @Version}: status changes go through
 * {@code DeviceBookingRepository#updateStatusIfVersionMatches} so the check and the
 * increment happen in one conditional UPDATE.
 */
@Entity
@Table(name = "device_bookings", indexes = {
        @Index(name = "idx_device_bookings_device_dates", columnList = "device_id,start_date,end_date"),
        @Index(name = "idx_device_bookings_user", columnList = "user_id"),
        @Index(name = "idx_device_bookings_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceBooking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false)
    private Long deviceId;

    @Column(name = "device_name", nullable = false)
    private String deviceName;

    /** 0 for bookings created through the external API. */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "user_name")
    private String userName;

    @Column(name = "phone")
    private String phone;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "comment", length = 1000)
    private String comment;

    @Column(name = "manager_comment", length = 1000)
    private String managerComment;

    @Column(name = "external_booking_id", unique = true)
    private String externalBookingId;

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

    public LocalDate getEffectiveEndDate() {
        return endDate != null ? endDate : startDate;
    }

    public DateRange extent() {
        return DateRange.of(startDate, endDate);
    }
}
