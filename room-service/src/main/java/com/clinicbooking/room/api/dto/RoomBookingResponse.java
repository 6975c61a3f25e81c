package com.clinicbooking.room.api.dto;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.room.domain.model.DeviceReservationStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;

import java.time.LocalDateTime;

public record RoomBookingResponse(
        Long id,
        Long roomId,
        String roomName,
        Long userId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        BookingStatus status,
        long version,
        Long deviceId,
        String deviceName,
        DeviceReservationStatus deviceReservationStatus,
        String externalDeviceBookingId,
        String clientName,
        String clientPhone,
        String comment,
        String managerComment,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static RoomBookingResponse from(HourlyBooking booking) {
        return new RoomBookingResponse(
                booking.getId(),
                booking.getRoomId(),
                booking.getRoomName(),
                booking.getUserId(),
                booking.getStartTime(),
                booking.getEndTime(),
                booking.getStatus(),
                booking.getVersion(),
                booking.getDeviceId(),
                booking.getDeviceName(),
                booking.getDeviceReservationStatus(),
                booking.getExternalDeviceBookingId(),
                booking.getClientName(),
                booking.getClientPhone(),
                booking.getComment(),
                booking.getManagerComment(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
