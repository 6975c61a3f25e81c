package com.clinicbooking.device.domain.service;

import com.clinicbooking.common.booking.BookingStateMachine;
import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.common.exception.ActiveLimitReachedException;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ConcurrencyConflictException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.NotAvailableException;
import com.clinicbooking.common.exception.PastDateException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.common.exception.TooFarInFutureException;
import com.clinicbooking.common.interval.DateRange;
import com.clinicbooking.device.api.dto.BookDeviceRequest;
import com.clinicbooking.device.api.dto.BookDeviceResponse;
import com.clinicbooking.device.api.dto.CreateDeviceBookingRequest;
import com.clinicbooking.device.api.dto.DeviceBookingResponse;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.model.DeviceBooking;
import com.clinicbooking.device.domain.repository.DeviceBookingRepository;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import com.clinicbooking.device.domain.strategy.BookingLockStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Booking store for devices.
 *
 * Creation runs in one transaction: lock the device (strategy from
 * {@code device.booking.lock-strategy}), replay an existing external id, count approved
 * occupancy against {@code totalQuantity}, insert with version 1.
 * Status changes are compare-and-swap on the version column.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceBookingService {

    private static final String REDIS_IDEMPOTENCY_PREFIX = "idempotency:device-booking:";
    private static final Duration REDIS_IDEMPOTENCY_TTL = Duration.ofHours(24);
    private static final long EXTERNAL_USER_ID = 0L;
    private static final long NO_EXCLUDED_BOOKING = 0L;

    private final Map<String, BookingLockStrategy> lockStrategies;
    private final DeviceRepository deviceRepository;
    private final DeviceBookingRepository bookingRepository;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${device.booking.lock-strategy:pessimistic}")
    private String lockStrategyType;

    @Value("${device.booking.max-advance-days:30}")
    private int maxAdvanceDays;

    /** 0 disables the limit. */
    @Value("${device.booking.max-active-per-user:0}")
    private int maxActivePerUser;

    @Value("${device.booking.idempotency-redis-cache:true}")
    private boolean idempotencyRedisCacheEnabled;

    @PostConstruct
    public void init() {
        log.info("Device bookings serialized with strategy: {}", getLockStrategy().getStrategyType());
    }

    /**
     * Creates an approved booking on behalf of room-service. Replaying the same external id
     * returns the original booking instead of creating a second one, even once its date has passed.
     * A key whose booking was canceled or rejected is reopened for the requested date, so a
     * room booking can release and re-reserve its device under the same key.
     */
    @Transactional
    public BookDeviceResponse bookForExternalSystem(BookDeviceRequest request) {
        String externalId = request.externalBookingId().trim();
        Optional<BookDeviceResponse> cached = findReplayInCache(externalId);
        if (cached.isPresent()) {
            return cached.get();
        }

        Device device = getLockStrategy().lockDevice(resolveDevice(request).getId());

        Optional<DeviceBooking> existing = bookingRepository.findByExternalBookingId(externalId);
        if (existing.isPresent() && !isReleased(existing.get())) {
            log.info("Replay of external booking {} -> booking {}", externalId, existing.get().getId());
            warmRedisCache(externalId, existing.get().getId());
            return toBookResponse(existing.get(), true);
        }

        if (request.date().isBefore(today())) {
            throw new PastDateException("Date " + request.date() + " is in the past");
        }
        requireBookable(device);
        requireCapacity(device, DateRange.singleDay(request.date()), NO_EXCLUDED_BOOKING);

        if (existing.isPresent()) {
            return reopen(existing.get(), device, request.date());
        }

        DeviceBooking booking = bookingRepository.save(DeviceBooking.builder()
                .deviceId(device.getId())
                .deviceName(device.getName())
                .userId(EXTERNAL_USER_ID)
                .userName(request.clientName())
                .phone(request.clientPhone())
                .startDate(request.date())
                .status(BookingStatus.APPROVED)
                .externalBookingId(externalId)
                .version(1L)
                .build());
        warmRedisCache(externalId, booking.getId());

        log.info("External booking created: id={}, device={}, date={}, externalId={}",
                booking.getId(), device.getId(), request.date(), externalId);
        return toBookResponse(booking, false);
    }

    /**
     * Cancels a booking created through the external API. Only non-terminal bookings can be canceled.
     */
    @Transactional
    public void cancelExternalBooking(String externalBookingId) {
        int updated = bookingRepository.cancelByExternalBookingId(
                externalBookingId, BookingStatus.CANCELED, BookingStateMachine.cancellableStates(), now());
        if (updated == 0) {
            throw new ResourceNotFoundException(
                    "Booking " + externalBookingId + " not found or already canceled");
        }
        log.info("External booking canceled: externalId={}", externalBookingId);
    }

    /**
     * Creates a user booking. Pending requests may coexist for the same day; the request is refused
     * only when approved bookings already use every unit.
     */
    @Transactional
    public DeviceBookingResponse createBooking(CreateDeviceBookingRequest request) {
        validateBookingWindow(request.startDate());
        if (request.endDate() != null && request.endDate().isBefore(request.startDate())) {
            throw new BusinessException("End date cannot be before start date", ErrorCodes.VALIDATION_ERROR);
        }

        Device device = getLockStrategy().lockDevice(request.deviceId());
        // under the device lock so two creates for the same user and device cannot both pass
        if (maxActivePerUser > 0
                && bookingRepository.countByUserIdAndStatusIn(request.userId(), BookingStatus.ACTIVE_STATES) >= maxActivePerUser) {
            throw new ActiveLimitReachedException(request.userId(), maxActivePerUser);
        }
        requireBookable(device);
        DateRange extent = DateRange.of(request.startDate(), request.endDate());
        requireCapacity(device, extent, NO_EXCLUDED_BOOKING);

        BookingStatus initial = request.createdByManager() ? BookingStatus.APPROVED : BookingStatus.PENDING;
        DeviceBooking booking = bookingRepository.save(DeviceBooking.builder()
                .deviceId(device.getId())
                .deviceName(device.getName())
                .userId(request.userId())
                .userName(request.userName())
                .phone(request.phone())
                .startDate(extent.start())
                .endDate(extent.isMultiDay() ? extent.end() : null)
                .comment(request.comment())
                .status(initial)
                .version(1L)
                .build());

        log.info("Device booking {} created for user {}: device={}, {}..{}, status={}",
                booking.getId(), request.userId(), device.getId(), extent.start(), extent.end(), initial.value());
        return DeviceBookingResponse.from(booking);
    }

    /**
     * Moves a booking to {@code request.status()} if its version still equals {@code request.expectedVersion()}.
     * Approving re-checks capacity under the device lock.
     */
    @Transactional
    public StatusUpdateResponse updateStatus(Long bookingId, StatusUpdateRequest request) {
        DeviceBooking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Device booking", bookingId));
        if (!booking.getVersion().equals(request.expectedVersion())) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }
        BookingStateMachine.requireTransition(booking.getStatus(), request.status());

        if (request.status().isApproved() && !booking.getStatus().isApproved()) {
            Device device = getLockStrategy().lockDevice(booking.getDeviceId());
            requireCapacity(device, booking.extent(), booking.getId());
        }

        int updated = bookingRepository.updateStatusIfVersionMatches(
                bookingId, request.expectedVersion(), request.status(), request.comment(), now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(bookingId, request.expectedVersion());
        }
        long newVersion = request.expectedVersion() + 1;
        log.info("Device booking {} {} -> {} (version {})",
                bookingId, booking.getStatus().value(), request.status().value(), newVersion);
        return new StatusUpdateResponse(bookingId, request.status(), newVersion);
    }

    @Transactional(readOnly = true)
    public DeviceBookingResponse getBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .map(DeviceBookingResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Device booking", bookingId));
    }

    @Transactional(readOnly = true)
    public List<DeviceBookingResponse> getBookingsForUser(Long userId) {
        return bookingRepository.findByUserIdOrderByStartDateDesc(userId).stream()
                .map(DeviceBookingResponse::from)
                .toList();
    }

    private BookDeviceResponse reopen(DeviceBooking released, Device device, LocalDate date) {
        int updated = bookingRepository.reopenIfVersionMatches(released.getId(), released.getVersion(),
                device.getId(), device.getName(), date, BookingStatus.APPROVED, now());
        if (updated == 0) {
            throw new ConcurrencyConflictException(released.getId(), released.getVersion());
        }
        released.setDeviceId(device.getId());
        released.setDeviceName(device.getName());
        released.setStartDate(date);
        released.setEndDate(null);
        released.setStatus(BookingStatus.APPROVED);
        released.setVersion(released.getVersion() + 1);
        warmRedisCache(released.getExternalBookingId(), released.getId());

        log.info("External booking reopened: id={}, device={}, date={}, externalId={}",
                released.getId(), device.getId(), date, released.getExternalBookingId());
        return toBookResponse(released, false);
    }

    private Device resolveDevice(BookDeviceRequest request) {
        if (request.deviceId() != null && request.deviceId() > 0) {
            return deviceRepository.findById(request.deviceId())
                    .orElseThrow(() -> new ResourceNotFoundException("device not found"));
        }
        if (request.deviceName() != null && !request.deviceName().isBlank()) {
            return deviceRepository.findByNameIgnoreCase(request.deviceName().trim())
                    .orElseThrow(() -> new ResourceNotFoundException("device not found"));
        }
        throw new BusinessException("device_id or device_name is required", ErrorCodes.VALIDATION_ERROR);
    }

    private void requireBookable(Device device) {
        if (!device.isActive()) {
            throw new NotAvailableException("Device " + device.getName() + " is not in service");
        }
        if (device.isPermanentReserved()) {
            throw new NotAvailableException("Device " + device.getName() + " is permanently reserved");
        }
    }

    private void requireCapacity(Device device, DateRange extent, long excludeBookingId) {
        long approved = bookingRepository.countOverlapping(
                device.getId(), extent.start(), extent.end(), BookingStatus.APPROVED_STATES, excludeBookingId);
        if (approved >= device.getTotalQuantity()) {
            log.info("Device {} fully booked for {}..{} ({} of {})",
                    device.getId(), extent.start(), extent.end(), approved, device.getTotalQuantity());
            throw new NotAvailableException("device not available for the selected date");
        }
    }

    private void validateBookingWindow(LocalDate startDate) {
        LocalDate today = today();
        if (startDate.isBefore(today)) {
            throw new PastDateException("Date " + startDate + " is in the past");
        }
        if (startDate.isAfter(today.plusDays(maxAdvanceDays))) {
            throw new TooFarInFutureException(maxAdvanceDays);
        }
    }

    /**
     * Redis first (fast) if enabled. The id found there is re-read from the DB, so a value written by
     * a rolled-back transaction is ignored.
     */
    private Optional<BookDeviceResponse> findReplayInCache(String externalId) {
        if (!idempotencyRedisCacheEnabled || stringRedisTemplate == null) {
            return Optional.empty();
        }
        try {
            String cachedId = stringRedisTemplate.opsForValue().get(REDIS_IDEMPOTENCY_PREFIX + externalId);
            if (cachedId == null) {
                return Optional.empty();
            }
            return bookingRepository.findById(Long.valueOf(cachedId))
                    .filter(b -> externalId.equals(b.getExternalBookingId()))
                    .filter(b -> !isReleased(b))
                    .map(b -> {
                        log.debug("Idempotency hit from Redis for external id: {}", externalId);
                        return toBookResponse(b, true);
                    });
        } catch (RuntimeException e) {
            log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void warmRedisCache(String externalId, Long bookingId) {
        if (!idempotencyRedisCacheEnabled || stringRedisTemplate == null) return;
        try {
            stringRedisTemplate.opsForValue().set(
                    REDIS_IDEMPOTENCY_PREFIX + externalId, String.valueOf(bookingId), REDIS_IDEMPOTENCY_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to warm Redis idempotency cache for external id: {} (non-fatal)", externalId, e);
        }
    }

    private static boolean isReleased(DeviceBooking booking) {
        return booking.getStatus() == BookingStatus.CANCELED || booking.getStatus() == BookingStatus.REJECTED;
    }

    private BookingLockStrategy getLockStrategy() {
        BookingLockStrategy strategy = lockStrategies.get(lockStrategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available: {}. Defaulting to pessimistic",
                    lockStrategyType, lockStrategies.keySet());
            strategy = lockStrategies.get("pessimistic");
            if (strategy == null) {
                throw new IllegalStateException(
                        "pessimistic strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }

    private static BookDeviceResponse toBookResponse(DeviceBooking booking, boolean replayed) {
        return new BookDeviceResponse(
                booking.getId(),
                booking.getExternalBookingId(),
                booking.getDeviceId(),
                booking.getDeviceName(),
                booking.getStatus(),
                replayed);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
