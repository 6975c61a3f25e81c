package com.clinicbooking.device.domain.repository;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.device.domain.model.DeviceBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Device bookings. Range overlap is inclusive on both ends:
 * {@code start <= :to AND coalesce(end, start) >= :from}.
 */
public interface DeviceBookingRepository extends JpaRepository<DeviceBooking, Long> {

    Optional<DeviceBooking> findByExternalBookingId(String externalBookingId);

    List<DeviceBooking> findByUserIdOrderByStartDateDesc(Long userId);

    long countByUserIdAndStatusIn(Long userId, Collection<BookingStatus> statuses);

    /**
     * Approved occupancy for a device over an inclusive date range, ignoring booking {@code excludeId}
     * (the one being approved, or 0 for none). Always reads live rows; never served from a cache.
     */
    @Query("""
           SELECT COUNT(b) FROM DeviceBooking b
           WHERE b.deviceId = :deviceId
             AND b.status IN :statuses
             AND b.startDate <= :to
             AND COALESCE(b.endDate, b.startDate) >= :from
             AND b.id <> :excludeId
           """)
    long countOverlapping(@Param("deviceId") Long deviceId,
                          @Param("from") LocalDate from,
                          @Param("to") LocalDate to,
                          @Param("statuses") Collection<BookingStatus> statuses,
                          @Param("excludeId") long excludeId);

    @Query("""
           SELECT b FROM DeviceBooking b
           WHERE b.deviceId = :deviceId
             AND b.status IN :statuses
             AND b.startDate <= :to
             AND COALESCE(b.endDate, b.startDate) >= :from
           ORDER BY b.startDate
           """)
    List<DeviceBooking> findOverlapping(@Param("deviceId") Long deviceId,
                                        @Param("from") LocalDate from,
                                        @Param("to") LocalDate to,
                                        @Param("statuses") Collection<BookingStatus> statuses);

    /**
     * Compare-and-swap status change.
     *
     * Returns the number of rows affected:
     * - 1: status changed and version incremented by exactly one
     * - 0: the booking does not exist or its version moved on
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE DeviceBooking b
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

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE DeviceBooking b
           SET b.status = :canceled,
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.externalBookingId = :externalBookingId
             AND b.status IN :cancellable
           """)
    int cancelByExternalBookingId(@Param("externalBookingId") String externalBookingId,
                                  @Param("canceled") BookingStatus canceled,
                                  @Param("cancellable") Collection<BookingStatus> cancellable,
                                  @Param("now") LocalDateTime now);

    /**
     * Puts a canceled or rejected external booking back into service on a new single day.
     * Guarded by version like {@link #updateStatusIfVersionMatches}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE DeviceBooking b
           SET b.deviceId = :deviceId,
               b.deviceName = :deviceName,
               b.startDate = :date,
               b.endDate = NULL,
               b.status = :status,
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.version = :expectedVersion
           """)
    int reopenIfVersionMatches(@Param("id") Long id,
                               @Param("expectedVersion") long expectedVersion,
                               @Param("deviceId") Long deviceId,
                               @Param("deviceName") String deviceName,
                               @Param("date") LocalDate date,
                               @Param("status") BookingStatus status,
                               @Param("now") LocalDateTime now);
}
