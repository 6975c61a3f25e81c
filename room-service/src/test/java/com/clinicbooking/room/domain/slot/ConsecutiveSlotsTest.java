package com.clinicbooking.room.domain.slot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsecutiveSlotsTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 12);

    private static TimeSlot slot(int hour, int minute, boolean booked) {
        LocalDateTime start = DAY.atTime(hour, minute);
        return TimeSlot.of(start, start.plusMinutes(30), booked, false);
    }

    // 12:00 and 12:30 free, 13:00-14:00 lunch gap, 14:00 free, 14:30 booked, 15:00 free
    private final List<TimeSlot> slots = List.of(
            slot(12, 0, false),
            slot(12, 30, false),
            slot(14, 0, false),
            slot(14, 30, true),
            slot(15, 0, false));

    @Test
    @DisplayName("runs break at gaps and at taken slots")
    void findRuns_splitsOnGapsAndBookings() {
        List<List<TimeSlot>> runs = ConsecutiveSlots.findRuns(slots);

        assertThat(runs).hasSize(3);
        assertThat(runs.get(0)).extracting(TimeSlot::label).containsExactly("12:00-12:30", "12:30-13:00");
        assertThat(runs.get(1)).extracting(TimeSlot::label).containsExactly("14:00-14:30");
        assertThat(runs.get(2)).extracting(TimeSlot::label).containsExactly("15:00-15:30");
    }

    @Test
    @DisplayName("duration options grow by one slot until the run ends")
    void durationOptions_followRun() {
        assertThat(ConsecutiveSlots.durationOptions(slots, DAY.atTime(12, 0), 30)).containsExactly(30, 60);
        assertThat(ConsecutiveSlots.durationOptions(slots, DAY.atTime(12, 30), 30)).containsExactly(30);
        assertThat(ConsecutiveSlots.durationOptions(slots, DAY.atTime(14, 30), 30)).isEmpty();
        assertThat(ConsecutiveSlots.durationOptions(slots, DAY.atTime(9, 0), 30)).isEmpty();
    }

    @Test
    @DisplayName("consecutive booking fits only inside one run")
    void canBookConsecutive() {
        assertThat(ConsecutiveSlots.canBookConsecutive(slots, DAY.atTime(12, 0), 2)).isTrue();
        assertThat(ConsecutiveSlots.canBookConsecutive(slots, DAY.atTime(12, 30), 2)).isFalse();
        assertThat(ConsecutiveSlots.canBookConsecutive(slots, DAY.atTime(14, 0), 2)).isFalse();
        assertThat(ConsecutiveSlots.canBookConsecutive(slots, DAY.atTime(12, 0), 0)).isFalse();
    }
}
