package com.clinicbooking.room.domain.schedule;

import com.clinicbooking.room.domain.model.Holiday;
import com.clinicbooking.room.domain.model.RoomSchedule;
import com.clinicbooking.room.domain.model.ScheduleOverride;
import com.clinicbooking.room.domain.repository.HolidayRepository;
import com.clinicbooking.room.domain.repository.RoomScheduleRepository;
import com.clinicbooking.room.domain.repository.ScheduleOverrideRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves the schedule of a room for a date. Precedence:
 * <ol>
 *     <li>an override for that exact date (a closed override closes the day)</li>
 *     <li>a holiday, which closes every room without its own override</li>
 *     <li>the active weekly schedule for the day of week</li>
 *     <li>otherwise closed</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class ScheduleResolver {

    static final String NO_SCHEDULE = "no schedule";
    static final String DAY_OFF = "day off";

    private final RoomScheduleRepository scheduleRepository;
    private final ScheduleOverrideRepository overrideRepository;
    private final HolidayRepository holidayRepository;

    @Transactional(readOnly = true)
    public EffectiveSchedule resolve(Long roomId, LocalDate date) {
        Optional<RoomSchedule> weekly = scheduleRepository
                .findByRoomIdAndDayOfWeek(roomId, date.getDayOfWeek().getValue())
                .filter(RoomSchedule::isActive);

        Optional<ScheduleOverride> override = overrideRepository.findByRoomIdAndDate(roomId, date);
        if (override.isPresent()) {
            return fromOverride(override.get(), weekly);
        }

        Optional<Holiday> holiday = holidayRepository.findByDate(date);
        if (holiday.isPresent()) {
            return EffectiveSchedule.closed("holiday: " + holiday.get().getName());
        }

        return weekly.map(ScheduleResolver::fromWeekly)
                .orElseGet(() -> EffectiveSchedule.closed(NO_SCHEDULE));
    }

    private static EffectiveSchedule fromOverride(ScheduleOverride override, Optional<RoomSchedule> weekly) {
        if (override.isClosed()) {
            return EffectiveSchedule.closed(override.getReason() != null ? override.getReason() : DAY_OFF);
        }
        if (override.hasOwnHours()) {
            return EffectiveSchedule.open(
                    override.getStartTime(),
                    override.getEndTime(),
                    override.getLunchStart(),
                    override.getLunchEnd(),
                    weekly.map(RoomSchedule::getSlotDurationMinutes).orElse(null));
        }
        return weekly.map(ScheduleResolver::fromWeekly)
                .orElseGet(() -> EffectiveSchedule.closed(NO_SCHEDULE));
    }

    private static EffectiveSchedule fromWeekly(RoomSchedule schedule) {
        return EffectiveSchedule.open(
                schedule.getStartTime(),
                schedule.getEndTime(),
                schedule.getLunchStart(),
                schedule.getLunchEnd(),
                schedule.getSlotDurationMinutes());
    }
}
