package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.api.dto.DayOffResponse;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.model.RoomSchedule;
import com.clinicbooking.room.domain.model.ScheduleOverride;
import com.clinicbooking.room.domain.repository.HourlyBookingRepository;
import com.clinicbooking.room.domain.repository.RoomRepository;
import com.clinicbooking.room.domain.repository.RoomScheduleRepository;
import com.clinicbooking.room.domain.repository.ScheduleOverrideRepository;
import com.clinicbooking.room.domain.schedule.ScheduleResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 12);

    @Mock
    private RoomRepository roomRepository;
    @Mock
    private RoomScheduleRepository scheduleRepository;
    @Mock
    private ScheduleOverrideRepository overrideRepository;
    @Mock
    private HourlyBookingRepository bookingRepository;
    @Mock
    private ScheduleResolver scheduleResolver;

    @InjectMocks
    private ScheduleService service;

    private static LocalTime t(int hour, int minute) {
        return LocalTime.of(hour, minute);
    }

    @Test
    @DisplayName("hours and lunch validation")
    void validate_rules() {
        assertThatCode(() -> ScheduleService.validate(t(9, 0), t(18, 0), t(13, 0), t(14, 0))).doesNotThrowAnyException();
        assertThatCode(() -> ScheduleService.validate(t(9, 0), t(18, 0), null, null)).doesNotThrowAnyException();

        assertThatThrownBy(() -> ScheduleService.validate(t(18, 0), t(9, 0), null, null))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCodes.INVALID_SCHEDULE);
        assertThatThrownBy(() -> ScheduleService.validate(t(9, 0), t(18, 0), t(13, 0), null))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> ScheduleService.validate(t(9, 0), t(18, 0), t(14, 0), t(13, 0)))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> ScheduleService.validate(t(9, 0), t(18, 0), t(17, 30), t(18, 30)))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("must lie within");
    }

    @Test
    @DisplayName("defaults fill only the missing days with 10:00-22:00")
    void ensureDefaultSchedules_fillsMissingDays() {
        given(roomRepository.existsById(3L)).willReturn(true);
        given(scheduleRepository.findByRoomIdAndDayOfWeek(any(), anyInt())).willReturn(Optional.empty());
        given(scheduleRepository.findByRoomIdAndDayOfWeek(3L, 1))
                .willReturn(Optional.of(RoomSchedule.builder().roomId(3L).dayOfWeek(1).build()));
        given(scheduleRepository.findByRoomIdOrderByDayOfWeekAsc(3L)).willReturn(List.of());

        service.ensureDefaultSchedules(3L);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RoomSchedule>> saved = ArgumentCaptor.forClass(List.class);
        verify(scheduleRepository).saveAll(saved.capture());
        assertThat(saved.getValue()).hasSize(6)
                .allSatisfy(s -> {
                    assertThat(s.getStartTime()).isEqualTo(t(10, 0));
                    assertThat(s.getEndTime()).isEqualTo(t(22, 0));
                    assertThat(s.getSlotDurationMinutes()).isEqualTo(30);
                });
    }

    @Test
    @DisplayName("day off keeps existing bookings and reports them")
    void setDayOff_reportsAffectedBookings() {
        given(roomRepository.existsById(3L)).willReturn(true);
        given(overrideRepository.findByRoomIdAndDate(3L, DAY)).willReturn(Optional.empty());
        given(overrideRepository.save(any(ScheduleOverride.class))).willAnswer(inv -> inv.getArgument(0));
        HourlyBooking affected = HourlyBooking.builder()
                .id(9L).roomId(3L).roomName("Room A").userId(7L)
                .startTime(DAY.atTime(10, 0)).endTime(DAY.atTime(11, 0))
                .status(BookingStatus.APPROVED).version(2L)
                .build();
        given(bookingRepository.findOverlapping(3L, DAY.atStartOfDay(), DAY.plusDays(1).atStartOfDay(),
                BookingStatus.BLOCKING_STATES)).willReturn(List.of(affected));

        DayOffResponse response = service.setDayOff(3L, DAY, "maintenance");

        assertThat(response.override().closed()).isTrue();
        assertThat(response.override().reason()).isEqualTo("maintenance");
        assertThat(response.affectedBookings()).singleElement()
                .satisfies(b -> assertThat(b.id()).isEqualTo(9L));
    }

    @Test
    @DisplayName("active bookings are looked up over the whole day")
    void hasActiveBookingsOnDate_countsWholeDay() {
        given(bookingRepository.countOverlapping(3L, DAY.atStartOfDay(), DAY.plusDays(1).atStartOfDay(),
                BookingStatus.BLOCKING_STATES, 0L)).willReturn(2L);

        assertThat(service.hasActiveBookingsOnDate(3L, DAY)).isTrue();
    }

    @Test
    @DisplayName("removing a missing override is not found")
    void removeOverride_missing() {
        given(overrideRepository.deleteByRoomIdAndDate(3L, DAY)).willReturn(0L);

        assertThatThrownBy(() -> service.removeOverride(3L, DAY)).isInstanceOf(ResourceNotFoundException.class);
    }
}
