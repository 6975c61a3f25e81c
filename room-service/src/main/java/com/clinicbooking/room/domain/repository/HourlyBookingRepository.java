package com.clinicbooking.room.domain.repository;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.room.domain.model.DeviceReservationStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Hourly bookings. Overlap is half-open: {@code start < :to AND end > :from}.
 */
public interface HourlyBookingRepository extends JpaRepository<HourlyBooking, Long> {

    Optional<HourlyBooking> findByExternalBookingId(String externalBookingId);

    List<HourlyBooking> findByUserIdOrderByStartTimeDesc(Long userId);

    List<HourlyBooking> findByStatusOrderByStartTimeAsc(BookingStatus status);

    long countByUserIdAndStatusIn(Long userId, Collection<BookingStatus> statuses);

    /**
     * Bookings of a room in the given statuses overlapping {@code [from, to)}, ignoring
     * booking {@code excludeId} (0 for none).
     */
    @Query("""
           SELECT COUNT(b) FROM HourlyBooking b
           WHERE b.roomId = :roomId
             AND b.status IN :statuses
             AND b.startTime < :to
             AND b.endTime > :from
             AND b.id <> :excludeId
           """)
    long countOverlapping(@Param("roomId") Long roomId,
                          @Param("from") LocalDateTime from,
                          @Param("to") LocalDateTime to,
                          @Param("statuses") Collection<BookingStatus> statuses,
                          @Param("excludeId") long excludeId);

    @Query("""
           SELECT b FROM HourlyBooking b
           WHERE b.roomId = :roomId
             AND b.status IN :statuses
             AND b.startTime < :to
             AND b.endTime > :from
           ORDER BY b.startTime
           """)
    List<HourlyBooking> findOverlapping(@Param("roomId") Long roomId,
                                        @Param("from") LocalDateTime from,
                                        @Param("to") LocalDateTime to,
                                        @Param("statuses") Collection<BookingStatus> statuses);

    /**
     * Compare-and-swap status change. 1 row: applied and version incremented; 0 rows: stale version.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE HourlyBooking b
           SET b.status = :status,
               b.managerComment = COALESCE(:comment, b.managerComment),
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.version = :expectedVersion
           """)
    int updateStatusIfVersionMatches(@Param("id") Long id,
                                     @Param("expectedVersion") long expectedVersion,
                                     @Param("status") BookingStatus status,
                                     @Param("comment") String comment,
                                     @Param("now") LocalDateTime now);

    /**
     * Versioned move to a new interval. The device status is written in the same statement so a
     * crash before the device is re-reserved leaves the booking for recovery.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE HourlyBooking b
           SET b.startTime = :start,
               b.endTime = :end,
               b.deviceReservationStatus = :deviceStatus,
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.version = :expectedVersion
           """)
    int updateScheduleIfVersionMatches(@Param("id") Long id,
                                       @Param("expectedVersion") long expectedVersion,
                                       @Param("start") LocalDateTime start,
                                       @Param("end") LocalDateTime end,
                                       @Param("deviceStatus") DeviceReservationStatus deviceStatus,
                                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE HourlyBooking b
           SET b.deviceId = :deviceId,
               b.deviceName = :deviceName,
               b.deviceReservationStatus = :deviceStatus,
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.version = :expectedVersion
           """)
    int updateDeviceIfVersionMatches(@Param("id") Long id,
                                     @Param("expectedVersion") long expectedVersion,
                                     @Param("deviceId") Long deviceId,
                                     @Param("deviceName") String deviceName,
                                     @Param("deviceStatus") DeviceReservationStatus deviceStatus,
                                     @Param("now") LocalDateTime now);

    /**
     * Records the device-service outcome. Does not touch {@code status} or {@code version}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE HourlyBooking b
           SET b.deviceReservationStatus = :deviceStatus,
               b.externalDeviceBookingId = COALESCE(:externalDeviceBookingId, b.externalDeviceBookingId),
               b.updatedAt = :now
           WHERE b.id = :id
           """)
    int updateDeviceReservation(@Param("id") Long id,
                                @Param("deviceStatus") DeviceReservationStatus deviceStatus,
                                @Param("externalDeviceBookingId") String externalDeviceBookingId,
                                @Param("now") LocalDateTime now);

    /** Recovery candidates: device still unconfirmed, booking active and not started, untouched since {@code updatedBefore}. */
    @Query("""
           SELECT b FROM HourlyBooking b
           WHERE b.deviceReservationStatus = :deviceStatus
             AND b.status IN :statuses
             AND b.startTime > :now
             AND b.updatedAt < :updatedBefore
           ORDER BY b.startTime
           """)
    List<HourlyBooking> findDeviceReservationsToRecover(@Param("deviceStatus") DeviceReservationStatus deviceStatus,
                                                        @Param("statuses") Collection<BookingStatus> statuses,
                                                        @Param("now") LocalDateTime now,
                                                        @Param("updatedBefore") LocalDateTime updatedBefore);

    List<HourlyBooking> findByStatusInAndEndTimeLessThanEqualOrderByEndTimeAsc(Collection<BookingStatus> statuses,
                                                                               LocalDateTime endedBy);
}
