package com.clinicbooking.room.domain.slot;

import com.clinicbooking.common.interval.ConflictDetector;
import com.clinicbooking.common.interval.TimeRange;
import com.clinicbooking.room.domain.schedule.EffectiveSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Cuts a day's opening hours into slots of the schedule's duration.
 * Slots overlapping the lunch break are not emitted at all; a trailing fragment
 * shorter than one slot is dropped.
 */
@Component
@RequiredArgsConstructor
public class SlotGenerator {

    private final Clock clock;

    /**
     * @param occupied extents of bookings that block the room (not canceled or rejected)
     * @return every slot of the day in order, available or not; empty when closed
     */
    public List<TimeSlot> generate(LocalDate date, EffectiveSchedule schedule, Collection<TimeRange> occupied) {
        if (!schedule.open()) {
            return List.of();
        }
        int duration = schedule.slotDurationMinutes() > 0
                ? schedule.slotDurationMinutes()
                : EffectiveSchedule.DEFAULT_SLOT_DURATION_MINUTES;
        LocalDateTime dayEnd = date.atTime(schedule.end());
        Optional<TimeRange> lunch = schedule.lunchOn(date);
        LocalDateTime now = LocalDateTime.now(clock);

        List<TimeSlot> slots = new ArrayList<>();
        for (LocalDateTime cursor = date.atTime(schedule.start());
             !cursor.plusMinutes(duration).isAfter(dayEnd);
             cursor = cursor.plusMinutes(duration)) {
            TimeRange candidate = new TimeRange(cursor, cursor.plusMinutes(duration));
            if (lunch.isPresent() && lunch.get().overlaps(candidate)) {
                continue;
            }
            boolean booked = ConflictDetector.hasConflict(candidate, occupied, Function.identity());
            boolean past = cursor.isBefore(now);
            slots.add(TimeSlot.of(candidate.start(), candidate.end(), booked, past));
        }
        return slots;
    }
}
