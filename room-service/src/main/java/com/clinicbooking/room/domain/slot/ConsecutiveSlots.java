package com.clinicbooking.room.domain.slot;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over an ordered slot list for multi-slot bookings.
 */
public final class ConsecutiveSlots {

    private ConsecutiveSlots() {
    }

    public static List<TimeSlot> availableOnly(List<TimeSlot> slots) {
        return slots.stream().filter(TimeSlot::available).toList();
    }

    /**
     * Maximal runs of available slots where each slot ends exactly when the next one starts.
     */
    public static List<List<TimeSlot>> findRuns(List<TimeSlot> slots) {
        List<List<TimeSlot>> runs = new ArrayList<>();
        List<TimeSlot> current = new ArrayList<>();
        for (TimeSlot slot : availableOnly(slots)) {
            if (!current.isEmpty() && !current.get(current.size() - 1).end().equals(slot.start())) {
                runs.add(List.copyOf(current));
                current.clear();
            }
            current.add(slot);
        }
        if (!current.isEmpty()) {
            runs.add(List.copyOf(current));
        }
        return runs;
    }

    /**
     * Bookable lengths in minutes starting at {@code start}: one entry per slot of the run
     * beginning there (d, 2d, ...). Empty when {@code start} is not an available slot.
     */
    public static List<Integer> durationOptions(List<TimeSlot> slots, LocalDateTime start, int slotDurationMinutes) {
        int count = runLengthFrom(slots, start);
        List<Integer> options = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            options.add(i * slotDurationMinutes);
        }
        return options;
    }

    public static boolean canBookConsecutive(List<TimeSlot> slots, LocalDateTime start, int count) {
        return count > 0 && runLengthFrom(slots, start) >= count;
    }

    private static int runLengthFrom(List<TimeSlot> slots, LocalDateTime start) {
        int index = -1;
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).start().equals(start)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return 0;
        }
        int length = 0;
        for (int i = index; i < slots.size(); i++) {
            TimeSlot slot = slots.get(i);
            if (!slot.available()) {
                break;
            }
            if (i > index && !slots.get(i - 1).end().equals(slot.start())) {
                break;
            }
            length++;
        }
        return length;
    }
}
