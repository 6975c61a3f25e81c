package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.api.dto.DayOffResponse;
import com.clinicbooking.room.api.dto.RoomBookingResponse;
import com.clinicbooking.room.api.dto.RoomScheduleResponse;
import com.clinicbooking.room.api.dto.ScheduleOverrideResponse;
import com.clinicbooking.room.api.dto.SpecialHoursRequest;
import com.clinicbooking.room.api.dto.UpdateHoursRequest;
import com.clinicbooking.room.api.dto.UpdateLunchRequest;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.model.RoomSchedule;
import com.clinicbooking.room.domain.model.ScheduleOverride;
import com.clinicbooking.room.domain.repository.HourlyBookingRepository;
import com.clinicbooking.room.domain.repository.RoomRepository;
import com.clinicbooking.room.domain.repository.RoomScheduleRepository;
import com.clinicbooking.room.domain.repository.ScheduleOverrideRepository;
import com.clinicbooking.room.domain.schedule.EffectiveSchedule;
import com.clinicbooking.room.domain.schedule.ScheduleResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Weekly hours, lunch breaks and date overrides of rooms.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    static final LocalTime DEFAULT_START = LocalTime.of(10, 0);
    static final LocalTime DEFAULT_END = LocalTime.of(22, 0);

    private final RoomRepository roomRepository;
    private final RoomScheduleRepository scheduleRepository;
    private final ScheduleOverrideRepository overrideRepository;
    private final HourlyBookingRepository bookingRepository;
    private final ScheduleResolver scheduleResolver;

    /**
     * Creates the missing day-of-week rows with 10:00-22:00, 30-minute slots and no lunch.
     * Existing rows are left as they are.
     */
    @Transactional
    public List<RoomScheduleResponse> ensureDefaultSchedules(Long roomId) {
        requireRoom(roomId);
        List<RoomSchedule> created = new ArrayList<>();
        for (int day = 1; day <= 7; day++) {
            if (scheduleRepository.findByRoomIdAndDayOfWeek(roomId, day).isEmpty()) {
                created.add(RoomSchedule.builder()
                        .roomId(roomId)
                        .dayOfWeek(day)
                        .startTime(DEFAULT_START)
                        .endTime(DEFAULT_END)
                        .slotDurationMinutes(EffectiveSchedule.DEFAULT_SLOT_DURATION_MINUTES)
                        .build());
            }
        }
        if (!created.isEmpty()) {
            scheduleRepository.saveAll(created);
            log.info("Created {} default schedule row(s) for room {}", created.size(), roomId);
        }
        return getWeeklySchedule(roomId);
    }

    @Transactional(readOnly = true)
    public List<RoomScheduleResponse> getWeeklySchedule(Long roomId) {
        return scheduleRepository.findByRoomIdOrderByDayOfWeekAsc(roomId).stream()
                .map(RoomScheduleResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public EffectiveSchedule getEffectiveSchedule(Long roomId, LocalDate date) {
        requireRoom(roomId);
        return scheduleResolver.resolve(roomId, date);
    }

    @Transactional
    public RoomScheduleResponse updateHours(Long roomId, int dayOfWeek, UpdateHoursRequest request) {
        RoomSchedule schedule = getOrCreateDay(roomId, dayOfWeek);
        int duration = request.slotDurationMinutes() != null
                ? request.slotDurationMinutes()
                : schedule.getSlotDurationMinutes();
        validate(request.startTime(), request.endTime(), schedule.getLunchStart(), schedule.getLunchEnd());
        schedule.setStartTime(request.startTime());
        schedule.setEndTime(request.endTime());
        schedule.setSlotDurationMinutes(duration);
        schedule.setActive(true);
        log.info("Room {} day {} hours set to {}-{} ({} min slots)",
                roomId, dayOfWeek, request.startTime(), request.endTime(), duration);
        return RoomScheduleResponse.from(scheduleRepository.save(schedule));
    }

    @Transactional
    public RoomScheduleResponse updateLunch(Long roomId, int dayOfWeek, UpdateLunchRequest request) {
        RoomSchedule schedule = getOrCreateDay(roomId, dayOfWeek);
        validate(schedule.getStartTime(), schedule.getEndTime(), request.lunchStart(), request.lunchEnd());
        schedule.setLunchStart(request.lunchStart());
        schedule.setLunchEnd(request.lunchEnd());
        log.info("Room {} day {} lunch set to {}-{}", roomId, dayOfWeek, request.lunchStart(), request.lunchEnd());
        return RoomScheduleResponse.from(scheduleRepository.save(schedule));
    }

    /**
     * Closes the room for {@code date}. Bookings already made for that date are returned so
     * the operator can contact the clients; they are not canceled here.
     */
    @Transactional
    public DayOffResponse setDayOff(Long roomId, LocalDate date, String reason) {
        requireRoom(roomId);
        ScheduleOverride override = overrideRepository.findByRoomIdAndDate(roomId, date)
                .orElseGet(() -> ScheduleOverride.builder().roomId(roomId).date(date).build());
        override.setClosed(true);
        override.setStartTime(null);
        override.setEndTime(null);
        override.setLunchStart(null);
        override.setLunchEnd(null);
        override.setReason(reason);
        override = overrideRepository.save(override);

        List<RoomBookingResponse> affected = findActiveBookingsOnDate(roomId, date);
        if (!affected.isEmpty()) {
            log.warn("Room {} closed on {} with {} active booking(s)", roomId, date, affected.size());
        } else {
            log.info("Room {} closed on {}", roomId, date);
        }
        return new DayOffResponse(ScheduleOverrideResponse.from(override), affected);
    }

    @Transactional
    public ScheduleOverrideResponse setSpecialHours(Long roomId, SpecialHoursRequest request) {
        requireRoom(roomId);
        boolean hasHours = request.startTime() != null || request.endTime() != null;
        if (hasHours) {
            if (request.startTime() == null || request.endTime() == null) {
                throw invalid("startTime and endTime must be given together");
            }
            validate(request.startTime(), request.endTime(), request.lunchStart(), request.lunchEnd());
        } else if (request.lunchStart() != null || request.lunchEnd() != null) {
            throw invalid("a lunch break needs special startTime and endTime");
        }
        ScheduleOverride override = overrideRepository.findByRoomIdAndDate(roomId, request.date())
                .orElseGet(() -> ScheduleOverride.builder().roomId(roomId).date(request.date()).build());
        override.setClosed(false);
        override.setStartTime(request.startTime());
        override.setEndTime(request.endTime());
        override.setLunchStart(request.lunchStart());
        override.setLunchEnd(request.lunchEnd());
        override.setReason(request.reason());
        log.info("Room {} special hours on {}: {}-{}", roomId, request.date(), request.startTime(), request.endTime());
        return ScheduleOverrideResponse.from(overrideRepository.save(override));
    }

    @Transactional
    public void removeOverride(Long roomId, LocalDate date) {
        if (overrideRepository.deleteByRoomIdAndDate(roomId, date) == 0) {
            throw new ResourceNotFoundException("Schedule override for room " + roomId + " on " + date + " not found");
        }
        log.info("Room {} override on {} removed", roomId, date);
    }

    @Transactional(readOnly = true)
    public List<ScheduleOverrideResponse> listOverrides(Long roomId, LocalDate from, LocalDate to) {
        return overrideRepository.findByRoomIdAndDateBetweenOrderByDateAsc(roomId, from, to).stream()
                .map(ScheduleOverrideResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasActiveBookingsOnDate(Long roomId, LocalDate date) {
        return bookingRepository.countOverlapping(roomId, date.atStartOfDay(), date.plusDays(1).atStartOfDay(),
                BookingStatus.BLOCKING_STATES, 0L) > 0;
    }

    @Transactional(readOnly = true)
    public List<RoomBookingResponse> findActiveBookingsOnDate(Long roomId, LocalDate date) {
        List<HourlyBooking> bookings = bookingRepository.findOverlapping(roomId, date.atStartOfDay(),
                date.plusDays(1).atStartOfDay(), BookingStatus.BLOCKING_STATES);
        return bookings.stream().map(RoomBookingResponse::from).toList();
    }

    private RoomSchedule getOrCreateDay(Long roomId, int dayOfWeek) {
        requireRoom(roomId);
        if (dayOfWeek < 1 || dayOfWeek > 7) {
            throw invalid("dayOfWeek must be between 1 (Monday) and 7 (Sunday)");
        }
        return scheduleRepository.findByRoomIdAndDayOfWeek(roomId, dayOfWeek)
                .orElseGet(() -> RoomSchedule.builder()
                        .roomId(roomId)
                        .dayOfWeek(dayOfWeek)
                        .startTime(DEFAULT_START)
                        .endTime(DEFAULT_END)
                        .build());
    }

    /**
     * end after start; a lunch break, if any, is non-empty and inside the opening hours.
     */
    static void validate(LocalTime start, LocalTime end, LocalTime lunchStart, LocalTime lunchEnd) {
        if (!end.isAfter(start)) {
            throw invalid("end time " + end + " must be after start time " + start);
        }
        if (lunchStart == null && lunchEnd == null) {
            return;
        }
        if (lunchStart == null || lunchEnd == null) {
            throw invalid("lunchStart and lunchEnd must be given together");
        }
        if (!lunchStart.isBefore(lunchEnd)) {
            throw invalid("lunch start " + lunchStart + " must be before lunch end " + lunchEnd);
        }
        if (lunchStart.isBefore(start) || !lunchStart.isBefore(end) || lunchEnd.isAfter(end)) {
            throw invalid("lunch break " + lunchStart + "-" + lunchEnd + " must lie within " + start + "-" + end);
        }
    }

    private static BusinessException invalid(String message) {
        return new BusinessException(message, ErrorCodes.INVALID_SCHEDULE);
    }

    private void requireRoom(Long roomId) {
        if (!roomRepository.existsById(roomId)) {
            throw new ResourceNotFoundException("Room", roomId);
        }
    }
}
