package com.clinicbooking.room.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Date-specific exception to the weekly schedule: a day off, or replacement hours.
 * An open override without hours keeps the weekly hours but still shadows a holiday.
 */
@Entity
@Table(name = "schedule_overrides", uniqueConstraints = {
        @UniqueConstraint(name = "uk_schedule_overrides_room_date", columnNames = {"room_id", "override_date"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleOverride {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "override_date", nullable = false)
    private LocalDate date;

    @Column(name = "is_closed", nullable = false)
    private boolean closed;

    @Column(name = "start_time")
    private LocalTime startTime;

    @Column(name = "end_time")
    private LocalTime endTime;

    @Column(name = "lunch_start")
    private LocalTime lunchStart;

    @Column(name = "lunch_end")
    private LocalTime lunchEnd;

    @Column(name = "reason")
    private String reason;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    public boolean hasOwnHours() {
        return startTime != null && endTime != null;
    }
}
