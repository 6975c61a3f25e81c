package com.clinicbooking.room.api.dto;

import com.clinicbooking.room.domain.model.Room;

public record RoomResponse(
        Long id,
        String name,
        String description,
        boolean active
) {
    public static RoomResponse from(Room room) {
        return new RoomResponse(room.getId(), room.getName(), room.getDescription(), room.isActive());
    }
}
