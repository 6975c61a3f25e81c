package com.clinicbooking.room.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateRoomRequest(
        @NotBlank(message = "Room name is required")
        @Size(max = 255, message = "Room name is too long")
        String name,

        String description
) {
}
