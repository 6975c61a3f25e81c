package com.clinicbooking.common.dto;

import com.clinicbooking.common.booking.BookingStatus;

public record StatusUpdateResponse(
        Long bookingId,
        BookingStatus status,
        long version
) {
}
