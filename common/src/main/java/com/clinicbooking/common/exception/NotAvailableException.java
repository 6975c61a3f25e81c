package com.clinicbooking.common.exception;

/**
 * Capacity for the requested extent is already taken by approved bookings,
 * or the resource is closed / permanently reserved.
 */
public class NotAvailableException extends ConflictException {

    public NotAvailableException(String message) {
        super(message, ErrorCodes.NOT_AVAILABLE);
    }
}
