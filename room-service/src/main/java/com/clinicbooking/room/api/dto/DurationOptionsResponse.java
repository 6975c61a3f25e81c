package com.clinicbooking.room.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

public record DurationOptionsResponse(
        Long roomId,
        LocalDate date,
        @JsonFormat(pattern = "HH:mm") LocalTime start,
        List<Integer> durationsMinutes
) {
}
