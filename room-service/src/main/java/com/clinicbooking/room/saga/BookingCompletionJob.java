package com.clinicbooking.room.saga;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.exception.ConcurrencyConflictException;
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
 * Marks approved and confirmed bookings whose end time has passed as completed.
 * A booking changed concurrently is skipped and picked up again on the next run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCompletionJob {

    private final HourlyBookingRepository bookingRepository;
    private final RoomBookingOrchestrator orchestrator;
    private final Clock clock;

    @Value("${room.completion-job.enabled:true}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${room.completion-job.interval-ms:600000}")
    public void completeFinishedBookings() {
        if (!enabled) return;
        List<HourlyBooking> finished = bookingRepository.findByStatusInAndEndTimeLessThanEqualOrderByEndTimeAsc(
                BookingStatus.APPROVED_STATES, LocalDateTime.now(clock));
        if (finished.isEmpty()) return;
        int completed = 0;
        for (HourlyBooking booking : finished) {
            try {
                orchestrator.updateStatus(booking.getId(),
                        new StatusUpdateRequest(booking.getVersion(), BookingStatus.COMPLETED, null));
                completed++;
            } catch (ConcurrencyConflictException e) {
                log.debug("Completion of booking {} skipped: {}", booking.getId(), e.getMessage());
            } catch (Exception e) {
                log.error("Completion failed for booking {}", booking.getId(), e);
            }
        }
        log.info("Completed {} of {} finished booking(s)", completed, finished.size());
    }
}
