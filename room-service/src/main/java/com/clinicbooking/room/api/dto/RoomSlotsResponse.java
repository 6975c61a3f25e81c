package com.clinicbooking.room.api.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * @param closedReason set only when the room is closed that day
 */
public record RoomSlotsResponse(
        Long roomId,
        LocalDate date,
        boolean open,
        String closedReason,
        int slotDurationMinutes,
        List<SlotResponse> slots
) {
}
