package com.clinicbooking.common.exception;

/**
 * Machine-readable error codes placed in {@code BaseResponse.errorCode}.
 */
public final class ErrorCodes {
    private ErrorCodes() {
        // Utility class
    }

    public static final String BUSINESS_ERROR = "BUSINESS_ERROR";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";

    public static final String NOT_AVAILABLE = "NOT_AVAILABLE";
    public static final String PAST_DATE = "PAST_DATE";
    public static final String TOO_FAR_IN_FUTURE = "TOO_FAR_IN_FUTURE";
    public static final String ACTIVE_LIMIT_REACHED = "ACTIVE_LIMIT_REACHED";
    public static final String CONCURRENCY_CONFLICT = "CONCURRENCY_CONFLICT";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String SLOT_MISALIGNED = "SLOT_MISALIGNED";
    public static final String INVALID_SCHEDULE = "INVALID_SCHEDULE";
    public static final String DOWNSTREAM_UNAVAILABLE = "DOWNSTREAM_UNAVAILABLE";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
}
