package com.clinicbooking.device.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.common.exception.ActiveLimitReachedException;
import com.clinicbooking.common.exception.ConcurrencyConflictException;
import com.clinicbooking.common.exception.InvalidTransitionException;
import com.clinicbooking.common.exception.NotAvailableException;
import com.clinicbooking.common.exception.PastDateException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.common.exception.TooFarInFutureException;
import com.clinicbooking.device.api.dto.BookDeviceRequest;
import com.clinicbooking.device.api.dto.BookDeviceResponse;
import com.clinicbooking.device.api.dto.CreateDeviceBookingRequest;
import com.clinicbooking.device.api.dto.DeviceBookingResponse;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.model.DeviceBooking;
import com.clinicbooking.device.domain.repository.DeviceBookingRepository;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import com.clinicbooking.device.domain.strategy.BookingLockStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class DeviceBookingServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T08:00:00Z"), ZoneOffset.UTC);
    private static final String EXTERNAL_ID = "crm-42";

    @Mock
    private BookingLockStrategy lockStrategy;
    @Mock
    private DeviceRepository deviceRepository;
    @Mock
    private DeviceBookingRepository bookingRepository;
    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    private DeviceBookingService service;
    private Device ultrasound;

    @BeforeEach
    void setUp() {
        service = newService(CLOCK);
        ultrasound = Device.builder().id(1L).name("Ultrasound").totalQuantity(1).build();
    }

    private DeviceBookingService newService(Clock clock) {
        DeviceBookingService created = new DeviceBookingService(
                Map.of("pessimistic", lockStrategy),
                deviceRepository,
                bookingRepository,
                clock);
        ReflectionTestUtils.setField(created, "lockStrategyType", "pessimistic");
        ReflectionTestUtils.setField(created, "maxAdvanceDays", 30);
        ReflectionTestUtils.setField(created, "maxActivePerUser", 0);
        ReflectionTestUtils.setField(created, "idempotencyRedisCacheEnabled", false);
        return created;
    }

    private void givenSaveAssignsId(long id) {
        given(bookingRepository.save(any(DeviceBooking.class))).willAnswer(inv -> {
            DeviceBooking booking = inv.getArgument(0);
            booking.setId(id);
            return booking;
        });
    }

    private static DeviceBooking booking(long id, BookingStatus status, long version) {
        return DeviceBooking.builder()
                .id(id)
                .deviceId(1L)
                .deviceName("Ultrasound")
                .userId(7L)
                .startDate(TODAY.plusDays(2))
                .status(status)
                .version(version)
                .build();
    }

    @Test
    @DisplayName("external booking on a free day is created approved for the external user")
    void bookForExternalSystem_freeDay_createsApprovedBooking() {
        LocalDate date = TODAY.plusDays(3);
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.empty());
        given(bookingRepository.countOverlapping(1L, date, date, BookingStatus.APPROVED_STATES, 0L)).willReturn(0L);
        givenSaveAssignsId(5L);

        BookDeviceResponse response = service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, date, EXTERNAL_ID, "Alex", "+100"));

        assertThat(response.bookingId()).isEqualTo(5L);
        assertThat(response.status()).isEqualTo(BookingStatus.APPROVED);
        assertThat(response.replayed()).isFalse();

        ArgumentCaptor<DeviceBooking> saved = ArgumentCaptor.forClass(DeviceBooking.class);
        verify(bookingRepository).save(saved.capture());
        assertThat(saved.getValue().getUserId()).isZero();
        assertThat(saved.getValue().getVersion()).isEqualTo(1L);
        assertThat(saved.getValue().getExternalBookingId()).isEqualTo(EXTERNAL_ID);
    }

    @Test
    @DisplayName("replaying an external id returns the original booking and writes nothing")
    void bookForExternalSystem_replay_returnsOriginal() {
        LocalDate date = TODAY.plusDays(3);
        DeviceBooking existing = booking(5L, BookingStatus.APPROVED, 1L);
        existing.setExternalBookingId(EXTERNAL_ID);
        given(deviceRepository.findByNameIgnoreCase("Ultrasound")).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.of(existing));

        BookDeviceResponse response = service.bookForExternalSystem(
                new BookDeviceRequest(null, " Ultrasound ", date, EXTERNAL_ID, null, null));

        assertThat(response.bookingId()).isEqualTo(5L);
        assertThat(response.replayed()).isTrue();
        verify(bookingRepository, never()).save(any());
        verify(bookingRepository, never()).countOverlapping(any(), any(), any(), any(), anyLong());
    }

    @Test
    @DisplayName("external booking is refused with NotAvailable when every unit is approved for the day")
    void bookForExternalSystem_fullyBooked_throwsNotAvailable() {
        LocalDate date = TODAY.plusDays(3);
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.empty());
        given(bookingRepository.countOverlapping(1L, date, date, BookingStatus.APPROVED_STATES, 0L)).willReturn(1L);

        assertThatThrownBy(() -> service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, date, EXTERNAL_ID, null, null)))
                .isInstanceOf(NotAvailableException.class)
                .hasMessage("device not available for the selected date");

        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("permanently reserved device cannot be booked externally")
    void bookForExternalSystem_permanentReserved_throwsNotAvailable() {
        Device reserved = Device.builder().id(1L).name("Ultrasound").permanentReserved(true).build();
        given(deviceRepository.findById(1L)).willReturn(Optional.of(reserved));
        given(lockStrategy.lockDevice(1L)).willReturn(reserved);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, TODAY, EXTERNAL_ID, null, null)))
                .isInstanceOf(NotAvailableException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("new external booking in the past is rejected and nothing is saved")
    void bookForExternalSystem_pastDate_throwsPastDate() {
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, TODAY.minusDays(1), EXTERNAL_ID, null, null)))
                .isInstanceOf(PastDateException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("replay after midnight still returns the original booking for yesterday")
    void bookForExternalSystem_replayAfterDateHasPassed_returnsOriginal() {
        service = newService(Clock.fixed(Instant.parse("2026-03-11T00:30:00Z"), ZoneOffset.UTC));
        DeviceBooking existing = booking(9L, BookingStatus.APPROVED, 1L);
        existing.setExternalBookingId(EXTERNAL_ID);
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.of(existing));

        BookDeviceResponse response = service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, LocalDate.of(2026, 3, 10), EXTERNAL_ID, null, null));

        assertThat(response.bookingId()).isEqualTo(9L);
        assertThat(response.replayed()).isTrue();
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("a canceled external booking is reopened on the requested day under the same key")
    void bookForExternalSystem_canceledKey_reopensBooking() {
        LocalDate date = TODAY.plusDays(4);
        DeviceBooking canceled = booking(9L, BookingStatus.CANCELED, 2L);
        canceled.setExternalBookingId(EXTERNAL_ID);
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.of(canceled));
        given(bookingRepository.countOverlapping(1L, date, date, BookingStatus.APPROVED_STATES, 0L)).willReturn(0L);
        given(bookingRepository.reopenIfVersionMatches(eq(9L), eq(2L), eq(1L), eq("Ultrasound"), eq(date),
                eq(BookingStatus.APPROVED), any())).willReturn(1);

        BookDeviceResponse response = service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, date, EXTERNAL_ID, null, null));

        assertThat(response.bookingId()).isEqualTo(9L);
        assertThat(response.status()).isEqualTo(BookingStatus.APPROVED);
        assertThat(response.replayed()).isFalse();
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("reopening a canceled key is refused when the new day is fully booked")
    void bookForExternalSystem_canceledKeyOnFullDay_throwsNotAvailable() {
        LocalDate date = TODAY.plusDays(4);
        DeviceBooking canceled = booking(9L, BookingStatus.CANCELED, 2L);
        canceled.setExternalBookingId(EXTERNAL_ID);
        given(deviceRepository.findById(1L)).willReturn(Optional.of(ultrasound));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.findByExternalBookingId(EXTERNAL_ID)).willReturn(Optional.of(canceled));
        given(bookingRepository.countOverlapping(1L, date, date, BookingStatus.APPROVED_STATES, 0L)).willReturn(1L);

        assertThatThrownBy(() -> service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, date, EXTERNAL_ID, null, null)))
                .isInstanceOf(NotAvailableException.class);
        verify(bookingRepository, never()).reopenIfVersionMatches(any(), anyLong(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("unknown device name gives 404 device not found")
    void bookForExternalSystem_unknownDevice_throwsNotFound() {
        given(deviceRepository.findByNameIgnoreCase("X-Ray")).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.bookForExternalSystem(
                new BookDeviceRequest(null, "X-Ray", TODAY, EXTERNAL_ID, null, null)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("device not found");
    }

    @Test
    @DisplayName("Redis hit is re-verified against the database and returned as a replay")
    void bookForExternalSystem_redisHit_returnsReplayWithoutLocking() {
        given(stringRedisTemplate.opsForValue()).willReturn(valueOps);
        given(valueOps.get("idempotency:device-booking:" + EXTERNAL_ID)).willReturn("5");
        DeviceBooking existing = booking(5L, BookingStatus.APPROVED, 1L);
        existing.setExternalBookingId(EXTERNAL_ID);
        given(bookingRepository.findById(5L)).willReturn(Optional.of(existing));
        ReflectionTestUtils.setField(service, "idempotencyRedisCacheEnabled", true);
        ReflectionTestUtils.setField(service, "stringRedisTemplate", stringRedisTemplate);

        BookDeviceResponse response = service.bookForExternalSystem(
                new BookDeviceRequest(1L, null, TODAY.plusDays(1), EXTERNAL_ID, null, null));

        assertThat(response.replayed()).isTrue();
        assertThat(response.bookingId()).isEqualTo(5L);
        verifyNoInteractions(lockStrategy, deviceRepository);
    }

    @Test
    @DisplayName("cancelling an unknown or finished external booking gives 404")
    void cancelExternalBooking_noRow_throwsNotFound() {
        given(bookingRepository.cancelByExternalBookingId(eq(EXTERNAL_ID), eq(BookingStatus.CANCELED), any(), any()))
                .willReturn(0);

        assertThatThrownBy(() -> service.cancelExternalBooking(EXTERNAL_ID))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("not found or already canceled");
    }

    @Test
    @DisplayName("user booking is created pending even when other pending requests exist")
    void createBooking_freeDevice_createsPending() {
        LocalDate start = TODAY.plusDays(1);
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countOverlapping(1L, start, start, BookingStatus.APPROVED_STATES, 0L)).willReturn(0L);
        givenSaveAssignsId(9L);

        DeviceBookingResponse response = service.createBooking(
                new CreateDeviceBookingRequest(7L, "Sam", null, 1L, start, null, null, false));

        assertThat(response.id()).isEqualTo(9L);
        assertThat(response.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(response.version()).isEqualTo(1L);
        assertThat(response.endDate()).isEqualTo(start);
    }

    @Test
    @DisplayName("manager booking is created approved")
    void createBooking_byManager_createsApproved() {
        LocalDate start = TODAY.plusDays(1);
        LocalDate end = TODAY.plusDays(3);
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countOverlapping(1L, start, end, BookingStatus.APPROVED_STATES, 0L)).willReturn(0L);
        givenSaveAssignsId(10L);

        DeviceBookingResponse response = service.createBooking(
                new CreateDeviceBookingRequest(7L, "Sam", null, 1L, start, end, null, true));

        assertThat(response.status()).isEqualTo(BookingStatus.APPROVED);
        assertThat(response.endDate()).isEqualTo(end);
    }

    @Test
    @DisplayName("start date past the advance window gives TooFarInFuture")
    void createBooking_tooFar_throws() {
        assertThatThrownBy(() -> service.createBooking(
                new CreateDeviceBookingRequest(7L, null, null, 1L, TODAY.plusDays(31), null, null, false)))
                .isInstanceOf(TooFarInFutureException.class);
        verifyNoInteractions(lockStrategy);
    }

    @Test
    @DisplayName("user at the active booking limit gets ActiveLimitReached")
    void createBooking_activeLimit_throws() {
        ReflectionTestUtils.setField(service, "maxActivePerUser", 2);
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countByUserIdAndStatusIn(7L, BookingStatus.ACTIVE_STATES)).willReturn(2L);

        assertThatThrownBy(() -> service.createBooking(
                new CreateDeviceBookingRequest(7L, null, null, 1L, TODAY, null, null, false)))
                .isInstanceOf(ActiveLimitReachedException.class);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("active booking count is read only after the device lock is held")
    void createBooking_activeLimit_countedUnderLock() {
        ReflectionTestUtils.setField(service, "maxActivePerUser", 2);
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countByUserIdAndStatusIn(7L, BookingStatus.ACTIVE_STATES)).willReturn(2L);

        assertThatThrownBy(() -> service.createBooking(
                new CreateDeviceBookingRequest(7L, null, null, 1L, TODAY, null, null, false)))
                .isInstanceOf(ActiveLimitReachedException.class);

        InOrder order = inOrder(lockStrategy, bookingRepository);
        order.verify(lockStrategy).lockDevice(1L);
        order.verify(bookingRepository).countByUserIdAndStatusIn(7L, BookingStatus.ACTIVE_STATES);
    }

    @Test
    @DisplayName("status update with a stale version is a conflict and writes nothing")
    void updateStatus_staleVersion_throwsConflict() {
        given(bookingRepository.findById(3L)).willReturn(Optional.of(booking(3L, BookingStatus.PENDING, 2L)));

        assertThatThrownBy(() -> service.updateStatus(3L, new StatusUpdateRequest(1L, BookingStatus.REJECTED, null)))
                .isInstanceOf(ConcurrencyConflictException.class);
        verify(bookingRepository, never()).updateStatusIfVersionMatches(anyLong(), anyLong(), any(), any(), any());
    }

    @Test
    @DisplayName("conditional update touching zero rows is a conflict")
    void updateStatus_lostRace_throwsConflict() {
        given(bookingRepository.findById(3L)).willReturn(Optional.of(booking(3L, BookingStatus.PENDING, 1L)));
        given(bookingRepository.updateStatusIfVersionMatches(eq(3L), eq(1L), eq(BookingStatus.REJECTED), any(), any()))
                .willReturn(0);

        assertThatThrownBy(() -> service.updateStatus(3L, new StatusUpdateRequest(1L, BookingStatus.REJECTED, "no")))
                .isInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    @DisplayName("approval re-checks capacity excluding the booking itself")
    void updateStatus_approveWhenFull_throwsNotAvailable() {
        DeviceBooking pending = booking(3L, BookingStatus.PENDING, 1L);
        given(bookingRepository.findById(3L)).willReturn(Optional.of(pending));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countOverlapping(1L, pending.getStartDate(), pending.getStartDate(),
                BookingStatus.APPROVED_STATES, 3L)).willReturn(1L);

        assertThatThrownBy(() -> service.updateStatus(3L, new StatusUpdateRequest(1L, BookingStatus.APPROVED, null)))
                .isInstanceOf(NotAvailableException.class);
        verify(bookingRepository, never()).updateStatusIfVersionMatches(anyLong(), anyLong(), any(), any(), any());
    }

    @Test
    @DisplayName("successful approval returns the incremented version")
    void updateStatus_approve_returnsNewVersion() {
        DeviceBooking pending = booking(3L, BookingStatus.PENDING, 1L);
        given(bookingRepository.findById(3L)).willReturn(Optional.of(pending));
        given(lockStrategy.lockDevice(1L)).willReturn(ultrasound);
        given(bookingRepository.countOverlapping(1L, pending.getStartDate(), pending.getStartDate(),
                BookingStatus.APPROVED_STATES, 3L)).willReturn(0L);
        given(bookingRepository.updateStatusIfVersionMatches(eq(3L), eq(1L), eq(BookingStatus.APPROVED), any(), any()))
                .willReturn(1);

        StatusUpdateResponse response = service.updateStatus(3L, new StatusUpdateRequest(1L, BookingStatus.APPROVED, null));

        assertThat(response.status()).isEqualTo(BookingStatus.APPROVED);
        assertThat(response.version()).isEqualTo(2L);
    }

    @Test
    @DisplayName("moving a canceled booking is an invalid transition")
    void updateStatus_fromTerminal_throwsInvalidTransition() {
        given(bookingRepository.findById(3L)).willReturn(Optional.of(booking(3L, BookingStatus.CANCELED, 4L)));

        assertThatThrownBy(() -> service.updateStatus(3L, new StatusUpdateRequest(4L, BookingStatus.APPROVED, null)))
                .isInstanceOf(InvalidTransitionException.class)
                .hasMessage("Cannot change booking status from canceled to approved");
        verifyNoInteractions(lockStrategy);
    }
}
