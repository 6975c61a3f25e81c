package com.clinicbooking.room.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.common.interval.TimeRange;
import com.clinicbooking.room.api.dto.DurationOptionsResponse;
import com.clinicbooking.room.api.dto.RoomSlotsResponse;
import com.clinicbooking.room.api.dto.SlotResponse;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.repository.HourlyBookingRepository;
import com.clinicbooking.room.domain.repository.RoomRepository;
import com.clinicbooking.room.domain.schedule.EffectiveSchedule;
import com.clinicbooking.room.domain.schedule.ScheduleResolver;
import com.clinicbooking.room.domain.slot.ConsecutiveSlots;
import com.clinicbooking.room.domain.slot.SlotGenerator;
import com.clinicbooking.room.domain.slot.TimeSlot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Service
@RequiredArgsConstructor
public class SlotService {

    private final RoomRepository roomRepository;
    private final HourlyBookingRepository bookingRepository;
    private final ScheduleResolver scheduleResolver;
    private final SlotGenerator slotGenerator;

    @Transactional(readOnly = true)
    public RoomSlotsResponse getSlots(Long roomId, LocalDate date) {
        requireRoom(roomId);
        EffectiveSchedule schedule = scheduleResolver.resolve(roomId, date);
        List<SlotResponse> slots = generate(roomId, date, schedule).stream()
                .map(SlotResponse::from)
                .toList();
        return new RoomSlotsResponse(roomId, date, schedule.open(), schedule.closedReason(),
                schedule.slotDurationMinutes(), slots);
    }

    /**
     * Lengths that can be booked from {@code start} without crossing a booked slot, lunch or closing time.
     */
    @Transactional(readOnly = true)
    public DurationOptionsResponse getDurationOptions(Long roomId, LocalDate date, LocalTime start) {
        requireRoom(roomId);
        EffectiveSchedule schedule = scheduleResolver.resolve(roomId, date);
        List<Integer> options = ConsecutiveSlots.durationOptions(
                generate(roomId, date, schedule), date.atTime(start), schedule.slotDurationMinutes());
        return new DurationOptionsResponse(roomId, date, start, options);
    }

    private List<TimeSlot> generate(Long roomId, LocalDate date, EffectiveSchedule schedule) {
        if (!schedule.open()) {
            return List.of();
        }
        List<TimeRange> occupied = bookingRepository.findOverlapping(roomId, date.atStartOfDay(),
                        date.plusDays(1).atStartOfDay(), BookingStatus.BLOCKING_STATES).stream()
                .map(HourlyBooking::extent)
                .toList();
        return slotGenerator.generate(date, schedule, occupied);
    }

    private void requireRoom(Long roomId) {
        if (!roomRepository.existsById(roomId)) {
            throw new ResourceNotFoundException("Room", roomId);
        }
    }
}
