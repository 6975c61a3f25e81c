package com.clinicbooking.room.saga;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.room.domain.model.DeviceReservationStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.repository.HourlyBookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Retries device reservations left UNCONFIRMED for bookings that have not started yet.
 * Uses the same {@code crm-{id}} key, so a reservation that did go through is replayed, not duplicated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceReservationRecoveryJob {

    private final HourlyBookingRepository bookingRepository;
    private final RoomBookingOrchestrator orchestrator;
    private final Clock clock;

    @Value("${room.device-recovery.enabled:true}")
    private boolean recoveryEnabled;

    /** Skip bookings touched more recently than this; their first attempt may still be running. */
    @Value("${room.device-recovery.threshold-minutes:5}")
    private int recoveryThresholdMinutes;

    @Scheduled(fixedDelayString = "${room.device-recovery.interval-ms:300000}")
    public void recoverUnconfirmedDevices() {
        if (!recoveryEnabled) return;
        LocalDateTime now = LocalDateTime.now(clock);
        List<HourlyBooking> unconfirmed = bookingRepository.findDeviceReservationsToRecover(
                DeviceReservationStatus.UNCONFIRMED, BookingStatus.ACTIVE_STATES,
                now, now.minusMinutes(recoveryThresholdMinutes));
        if (unconfirmed.isEmpty()) return;
        log.info("Device recovery: found {} unconfirmed reservation(s)", unconfirmed.size());
        for (HourlyBooking booking : unconfirmed) {
            try {
                DeviceReservationStatus outcome = orchestrator.reserveDevice(booking);
                log.info("Device recovery: room booking {} -> {}", booking.getId(), outcome);
            } catch (Exception e) {
                log.error("Device recovery failed for room booking {}", booking.getId(), e);
            }
        }
    }
}
