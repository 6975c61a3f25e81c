package com.clinicbooking.device.api.dto;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.device.domain.model.DeviceBooking;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record DeviceBookingResponse(
        Long id,
        Long deviceId,
        String deviceName,
        Long userId,
        String userName,
        LocalDate startDate,
        LocalDate endDate,
        BookingStatus status,
        long version,
        String externalBookingId,
        String comment,
        String managerComment,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static DeviceBookingResponse from(DeviceBooking booking) {
        return new DeviceBookingResponse(
                booking.getId(),
                booking.getDeviceId(),
                booking.getDeviceName(),
                booking.getUserId(),
                booking.getUserName(),
                booking.getStartDate(),
                booking.getEffectiveEndDate(),
                booking.getStatus(),
                booking.getVersion(),
                booking.getExternalBookingId(),
                booking.getComment(),
                booking.getManagerComment(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
