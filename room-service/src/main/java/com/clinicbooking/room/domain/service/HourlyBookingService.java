package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.booking.BookingStateMachine;
import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.common.exception.ActiveLimitReachedException;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ConcurrencyConflictException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.InvalidTransitionException;
import com.clinicbooking.common.exception.NotAvailableException;
import com.clinicbooking.common.exception.PastDateException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.common.exception.SlotMisalignedException;
import com.clinicbooking.common.exception.TooFarInFutureException;
import com.clinicbooking.common.interval.TimeRange;
import com.clinicbooking.room.api.dto.ChangeDeviceRequest;
import com.clinicbooking.room.api.dto.CreateRoomBookingRequest;
import com.clinicbooking.room.api.dto.RescheduleBookingRequest;
import com.clinicbooking.room.api.dto.RoomBookingResponse;
import com.clinicbooking.room.domain.model.DeviceReservationStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.model.Room;
import com.clinicbooking.room.domain.repository.HourlyBookingRepository;
import com.clinicbooking.room.domain.repository.RoomRepository;
import com.clinicbooking.room.domain.schedule.EffectiveSchedule;
import com.clinicbooking.room.domain.schedule.ScheduleResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Booking store for rooms. Every method is its own transaction; the device side of a
 * composite booking is handled afterwards by {@code RoomBookingOrchestrator}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HourlyBookingService {

    private static final long NO_EXCLUDED_BOOKING = 0L;

    private final RoomRepository roomRepository;
    private final HourlyBookingRepository bookingRepository;
    private final ScheduleResolver scheduleResolver;
    private final Clock clock;

    @Value("${room.booking.min-advance-minutes:60}")
    private int minAdvanceMinutes;

    @Value("${room.booking.max-advance-days:30}")
    private int maxAdvanceDays;

    /** 0 disables the limit. */
    @Value("${room.booking.max-active-per-user:3}")
    private int maxActivePerUser;

    /**
     * Validates the window, the slot grid and the per-user limit, then inserts under the room lock
     * if no approved booking overlaps. Pending requests for the same slot may coexist.
     * A known {@code externalBookingId} returns the original booking unchanged.
     */
    @Transactional
    public CreatedBooking createBooking(CreateRoomBookingRequest request) {
        TimeRange extent = toExtent(request.startTime(), request.endTime());
        String externalId = normalize(request.externalBookingId());
        Optional<CreatedBooking> replay = findReplay(externalId);
        if (replay.isPresent()) {
            return replay.get();
        }

        validateBookingWindow(extent.start());
        if (!request.createdByManager() && maxActivePerUser > 0
                && bookingRepository.countByUserIdAndStatusIn(request.userId(), BookingStatus.ACTIVE_STATES) >= maxActivePerUser) {
            throw new ActiveLimitReachedException(request.userId(), maxActivePerUser);
        }

        Room room = roomRepository.findByIdForUpdate(request.roomId())
                .orElseThrow(() -> new ResourceNotFoundException("Room", request.roomId()));
        // again under the lock: a concurrent request with the same key may have committed meanwhile
        replay = findReplay(externalId);
        if (replay.isPresent()) {
            return replay.get();
        }

        if (!room.isActive()) {
            throw new NotAvailableException("Room " + room.getName() + " is not in service");
        }
        EffectiveSchedule schedule = scheduleResolver.resolve(room.getId(), extent.start().toLocalDate());
        requireAligned(extent, schedule);
        requireFree(room, extent, NO_EXCLUDED_BOOKING);

        BookingStatus initial = request.createdByManager() ? BookingStatus.APPROVED : BookingStatus.PENDING;
        HourlyBooking booking = bookingRepository.save(HourlyBooking.builder()
                .roomId(room.getId())
                .roomName(room.getName())
                .userId(request.userId())
                .startTime(extent.start())
                .endTime(extent.end())
                .deviceId(request.deviceId())
                .deviceName(normalize(request.deviceName()))
                .clientName(request.clientName())
                .clientPhone(request.clientPhone())
                .comment(request.comment())
                .externalBookingId(externalId)
                .status(initial)
                // UNCONFIRMED until device-service answers, so a crash in between is picked up by recovery
                .deviceReservationStatus(wantsDevice(request)
                        ? DeviceReservationStatus.UNCONFIRMED
                        : DeviceReservationStatus.NOT_REQUESTED)
                .version(1L)
                .build());

        log.info("Room booking {} created for user {}: room={}, {}..{}, status={}, device={}",
                booking.getId(), request.userId(), room.getId(), extent.start(), extent.end(),
                initial.value(), booking.getDeviceReservationStatus());
        return new CreatedBooking(booking, false);
    }

    /**
     * Checks version and transition without writing. Used before side effects that must
     * not run for a request that would be refused anyway.
     */
    @Transactional(readOnly = true)
    public HourlyBooking checkStatusChange(Long bookingId, StatusUpdateRequest request) {
        HourlyBooking booking = getEntity(bookingId);
        if (!booking.getVersion().equals(request.expectedVersion())) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }
        BookingStateMachine.requireTransition(booking.getStatus(), request.status());
        return booking;
    }

    /**
     * Compare-and-swap status change. Approving re-checks that the room is free under the room lock.
     */
    @Transactional
    public StatusUpdateResponse updateStatus(Long bookingId, StatusUpdateRequest request) {
        HourlyBooking booking = checkStatusChange(bookingId, request);

        if (request.status().isApproved() && !booking.getStatus().isApproved()) {
            Room room = roomRepository.findByIdForUpdate(booking.getRoomId())
                    .orElseThrow(() -> new ResourceNotFoundException("Room", booking.getRoomId()));
            requireFree(room, booking.extent(), booking.getId());
        }

        int updated = bookingRepository.updateStatusIfVersionMatches(
                bookingId, request.expectedVersion(), request.status(), request.comment(), now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }
        long newVersion = request.expectedVersion() + 1;
        log.info("Room booking {} {} -> {} (version {})",
                bookingId, booking.getStatus().value(), request.status().value(), newVersion);
        return new StatusUpdateResponse(bookingId, request.status(), newVersion);
    }

    /**
     * Moves an active booking to a new interval. The new interval goes through the same window,
     * grid and availability checks as a new booking, ignoring the booking itself.
     */
    @Transactional
    public ChangedBooking reschedule(Long bookingId, RescheduleBookingRequest request) {
        HourlyBooking booking = getChangeableBooking(bookingId, request.expectedVersion());
        TimeRange extent = toExtent(request.startTime(), request.endTime());
        validateBookingWindow(extent.start());

        Room room = roomRepository.findByIdForUpdate(booking.getRoomId())
                .orElseThrow(() -> new ResourceNotFoundException("Room", booking.getRoomId()));
        if (!room.isActive()) {
            throw new NotAvailableException("Room " + room.getName() + " is not in service");
        }
        EffectiveSchedule schedule = scheduleResolver.resolve(room.getId(), extent.start().toLocalDate());
        requireAligned(extent, schedule);
        requireFree(room, extent, booking.getId());

        boolean deviceHeld = holdsDevice(booking);
        DeviceReservationStatus deviceStatus = hasDevice(booking)
                ? DeviceReservationStatus.UNCONFIRMED
                : booking.getDeviceReservationStatus();
        int updated = bookingRepository.updateScheduleIfVersionMatches(
                bookingId, request.expectedVersion(), extent.start(), extent.end(), deviceStatus, now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }

        log.info("Room booking {} moved from {}..{} to {}..{} (version {})", bookingId,
                booking.getStartTime(), booking.getEndTime(), extent.start(), extent.end(), request.expectedVersion() + 1);
        booking.setStartTime(extent.start());
        booking.setEndTime(extent.end());
        booking.setDeviceReservationStatus(deviceStatus);
        booking.setVersion(request.expectedVersion() + 1);
        return new ChangedBooking(booking, deviceHeld);
    }

    /**
     * Replaces the device of an active booking. The new device is left UNCONFIRMED until
     * device-service answers.
     */
    @Transactional
    public ChangedBooking changeDevice(Long bookingId, ChangeDeviceRequest request) {
        String deviceName = normalize(request.deviceName());
        if (request.deviceId() == null && deviceName == null) {
            throw new BusinessException("device_id or device_name is required", ErrorCodes.VALIDATION_ERROR);
        }
        HourlyBooking booking = getChangeableBooking(bookingId, request.expectedVersion());

        boolean deviceHeld = holdsDevice(booking);
        int updated = bookingRepository.updateDeviceIfVersionMatches(bookingId, request.expectedVersion(),
                request.deviceId(), deviceName, DeviceReservationStatus.UNCONFIRMED, now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }

        log.info("Room booking {} device changed from {} to {} (version {})", bookingId,
                booking.getDeviceName() != null ? booking.getDeviceName() : booking.getDeviceId(),
                deviceName != null ? deviceName : request.deviceId(), request.expectedVersion() + 1);
        booking.setDeviceId(request.deviceId());
        booking.setDeviceName(deviceName);
        booking.setDeviceReservationStatus(DeviceReservationStatus.UNCONFIRMED);
        booking.setVersion(request.expectedVersion() + 1);
        return new ChangedBooking(booking, deviceHeld);
    }

    @Transactional
    public void recordDeviceReservation(Long bookingId, DeviceReservationStatus status, String externalDeviceBookingId) {
        if (bookingRepository.updateDeviceReservation(bookingId, status, externalDeviceBookingId, now()) == 0) {
            throw new ResourceNotFoundException("Room booking", bookingId);
        }
    }

    @Transactional(readOnly = true)
    public HourlyBooking getEntity(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Room booking", bookingId));
    }

    @Transactional(readOnly = true)
    public Optional<HourlyBooking> findByExternalBookingId(String externalBookingId) {
        String externalId = normalize(externalBookingId);
        return externalId == null ? Optional.empty() : bookingRepository.findByExternalBookingId(externalId);
    }

    @Transactional(readOnly = true)
    public RoomBookingResponse getBooking(Long bookingId) {
        return RoomBookingResponse.from(getEntity(bookingId));
    }

    @Transactional(readOnly = true)
    public List<RoomBookingResponse> getBookingsForUser(Long userId) {
        return bookingRepository.findByUserIdOrderByStartTimeDesc(userId).stream()
                .map(RoomBookingResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RoomBookingResponse> getPendingBookings() {
        return bookingRepository.findByStatusOrderByStartTimeAsc(BookingStatus.PENDING).stream()
                .map(RoomBookingResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RoomBookingResponse> getRoomBookings(Long roomId, LocalDate date) {
        return bookingRepository.findOverlapping(roomId, date.atStartOfDay(), date.plusDays(1).atStartOfDay(),
                        BookingStatus.BLOCKING_STATES).stream()
                .map(RoomBookingResponse::from)
                .toList();
    }

    private Optional<CreatedBooking> findReplay(String externalId) {
        if (externalId == null) {
            return Optional.empty();
        }
        return bookingRepository.findByExternalBookingId(externalId).map(existing -> {
            log.info("Replay of room booking {} -> booking {}", externalId, existing.getId());
            return new CreatedBooking(existing, true);
        });
    }

    private HourlyBooking getChangeableBooking(Long bookingId, Long expectedVersion) {
        HourlyBooking booking = getEntity(bookingId);
        if (!booking.getVersion().equals(expectedVersion)) {
            throw new ConcurrencyConflictException(bookingId, expectedVersion);
        }
        if (!BookingStatus.ACTIVE_STATES.contains(booking.getStatus())) {
            throw new InvalidTransitionException("Cannot change a " + booking.getStatus().value() + " booking");
        }
        return booking;
    }

    private static boolean hasDevice(HourlyBooking booking) {
        return booking.getDeviceId() != null || booking.getDeviceName() != null;
    }

    private static boolean holdsDevice(HourlyBooking booking) {
        DeviceReservationStatus device = booking.getDeviceReservationStatus();
        return device == DeviceReservationStatus.CONFIRMED || device == DeviceReservationStatus.UNCONFIRMED;
    }

    private void requireFree(Room room, TimeRange extent, long excludeBookingId) {
        long approved = bookingRepository.countOverlapping(
                room.getId(), extent.start(), extent.end(), BookingStatus.APPROVED_STATES, excludeBookingId);
        if (approved > 0) {
            log.info("Room {} already taken for {}..{}", room.getId(), extent.start(), extent.end());
            throw new NotAvailableException("room not available for the selected time");
        }
    }

    /**
     * The interval must sit on the slot grid of the day's effective hours and stay clear of lunch.
     */
    static void requireAligned(TimeRange extent, EffectiveSchedule schedule) {
        LocalDate date = extent.start().toLocalDate();
        if (!schedule.open()) {
            throw new NotAvailableException("Room is closed on " + date + ": " + schedule.closedReason());
        }
        TimeRange hours = schedule.hoursOn(date);
        if (extent.start().isBefore(hours.start()) || extent.end().isAfter(hours.end())) {
            throw new SlotMisalignedException("Booking must lie within opening hours "
                    + schedule.start() + "-" + schedule.end());
        }
        long duration = schedule.slotDurationMinutes();
        long offset = Duration.between(hours.start(), extent.start()).toMinutes();
        long length = extent.duration().toMinutes();
        if (offset % duration != 0 || length % duration != 0
                || extent.duration().toSecondsPart() != 0 || extent.start().getSecond() != 0) {
            throw new SlotMisalignedException("Booking must start on the " + duration
                    + "-minute slot grid and last a multiple of " + duration + " minutes");
        }
        if (schedule.lunchOn(date).map(lunch -> lunch.overlaps(extent)).orElse(false)) {
            throw new SlotMisalignedException("Booking overlaps the lunch break "
                    + schedule.lunchStart() + "-" + schedule.lunchEnd());
        }
    }

    private void validateBookingWindow(LocalDateTime start) {
        LocalDateTime now = now();
        if (start.isBefore(now.plusMinutes(minAdvanceMinutes))) {
            throw new PastDateException("Bookings must start at least " + minAdvanceMinutes + " minutes from now");
        }
        if (start.isAfter(now.plusDays(maxAdvanceDays))) {
            throw new TooFarInFutureException(maxAdvanceDays);
        }
    }

    private static TimeRange toExtent(LocalDateTime start, LocalDateTime end) {
        if (!end.isAfter(start)) {
            throw new BusinessException("End time must be after start time", ErrorCodes.VALIDATION_ERROR);
        }
        return new TimeRange(start, end);
    }

    private static boolean wantsDevice(CreateRoomBookingRequest request) {
        return request.deviceId() != null || normalize(request.deviceName()) != null;
    }

    private static String normalize(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
