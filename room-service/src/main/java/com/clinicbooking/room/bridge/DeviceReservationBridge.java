package com.clinicbooking.room.bridge;

import com.clinicbooking.common.dto.BaseResponse;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.DownstreamUnavailableException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.NotAvailableException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.client.DeviceServiceClient;
import com.clinicbooking.room.client.dto.DeviceBookingRequest;
import com.clinicbooking.room.client.dto.DeviceBookingResult;
import com.clinicbooking.room.client.dto.DeviceCatalog;
import com.clinicbooking.room.domain.model.HourlyBooking;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Calls into device-service.
 *
 * Definite answers become {@link BusinessException}s (409 {@link NotAvailableException},
 * 404 {@link ResourceNotFoundException}, other 4xx validation errors); they are neither retried
 * nor counted by the circuit breaker. Everything else (timeouts, 5xx, open circuit) ends as
 * {@link DownstreamUnavailableException} after the retries. Every call carries the same
 * idempotency key, so a retry after a lost response replays instead of double-booking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeviceReservationBridge {

    public static final String DEVICE_SERVICE = "device-service";

    private final DeviceServiceClient deviceServiceClient;

    @CircuitBreaker(name = DEVICE_SERVICE, fallbackMethod = "reserveFallback")
    @Retry(name = DEVICE_SERVICE)
    public DeviceBookingResult reserve(HourlyBooking booking) {
        DeviceBookingRequest request = new DeviceBookingRequest(
                booking.getDeviceId(),
                booking.getDeviceName(),
                booking.getStartTime().toLocalDate(),
                booking.deviceBookingKey(),
                booking.getClientName(),
                booking.getClientPhone());
        log.debug("Reserving device for room booking {} with key {}", booking.getId(), request.externalBookingId());
        try {
            BaseResponse<DeviceBookingResult> response = deviceServiceClient.bookDevice(request);
            if (response == null || response.getData() == null) {
                throw new IllegalStateException("device-service returned an empty booking response");
            }
            return response.getData();
        } catch (FeignException e) {
            throw translate(e, "device booking " + request.externalBookingId());
        }
    }

    @CircuitBreaker(name = DEVICE_SERVICE, fallbackMethod = "cancelFallback")
    @Retry(name = DEVICE_SERVICE)
    public void cancel(String externalBookingId) {
        try {
            deviceServiceClient.cancelBooking(externalBookingId);
            log.info("Device booking {} canceled", externalBookingId);
        } catch (FeignException e) {
            throw translate(e, "device booking " + externalBookingId);
        }
    }

    @CircuitBreaker(name = DEVICE_SERVICE, fallbackMethod = "listDevicesFallback")
    @Retry(name = DEVICE_SERVICE)
    public DeviceCatalog listDevices(LocalDate date) {
        try {
            BaseResponse<DeviceCatalog> response = deviceServiceClient.listDevices(date.toString(), false);
            if (response == null || response.getData() == null) {
                throw new IllegalStateException("device-service returned an empty device list");
            }
            return response.getData();
        } catch (FeignException e) {
            throw translate(e, "device list for " + date);
        }
    }

    static RuntimeException translate(FeignException e, String subject) {
        int status = e.status();
        if (status == 409) {
            return new NotAvailableException("device not available for the selected date");
        }
        if (status == 404) {
            return new ResourceNotFoundException(subject + " not found in device-service");
        }
        if (status == 400 || status == 422) {
            return new BusinessException("device-service rejected " + subject, e, ErrorCodes.VALIDATION_ERROR);
        }
        return e;
    }

    private DeviceBookingResult reserveFallback(HourlyBooking booking, Throwable t) {
        throw unavailable("reserve device for room booking " + booking.getId(), t);
    }

    private void cancelFallback(String externalBookingId, Throwable t) {
        throw unavailable("cancel device booking " + externalBookingId, t);
    }

    private DeviceCatalog listDevicesFallback(LocalDate date, Throwable t) {
        throw unavailable("list devices for " + date, t);
    }

    private static RuntimeException unavailable(String action, Throwable t) {
        if (t instanceof BusinessException business) {
            return business;
        }
        if (t instanceof DownstreamUnavailableException downstream) {
            return downstream;
        }
        log.warn("device-service call failed: {} ({})", action, t.toString());
        return new DownstreamUnavailableException("device-service unavailable: could not " + action, t);
    }
}
