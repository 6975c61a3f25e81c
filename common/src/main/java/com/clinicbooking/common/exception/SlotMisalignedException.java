package com.clinicbooking.common.exception;

/**
 * Requested interval does not fit the resource's slot grid for that day.
 */
public class SlotMisalignedException extends BusinessException {

    public SlotMisalignedException(String message) {
        super(message, ErrorCodes.SLOT_MISALIGNED);
    }
}
