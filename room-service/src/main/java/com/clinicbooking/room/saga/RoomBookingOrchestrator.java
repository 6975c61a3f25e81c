package com.clinicbooking.room.saga;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.dto.StatusUpdateRequest;
import com.clinicbooking.common.dto.StatusUpdateResponse;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.room.api.dto.ChangeDeviceRequest;
import com.clinicbooking.room.api.dto.CreateRoomBookingRequest;
import com.clinicbooking.room.api.dto.RescheduleBookingRequest;
import com.clinicbooking.room.api.dto.RoomBookingResponse;
import com.clinicbooking.room.bridge.DeviceReservationBridge;
import com.clinicbooking.room.client.dto.DeviceBookingResult;
import com.clinicbooking.room.domain.model.DeviceReservationStatus;
import com.clinicbooking.room.domain.model.HourlyBooking;
import com.clinicbooking.room.domain.service.ChangedBooking;
import com.clinicbooking.room.domain.service.CreatedBooking;
import com.clinicbooking.room.domain.service.HourlyBookingService;
import com.clinicbooking.room.events.RoomBookingEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Coordinates a room booking with its device reservation in device-service.
 *
 * Flow:
 * 1. Create the room booking (committed in its own transaction)
 * 2. Reserve the device under the key {@code crm-{bookingId}}
 * 3. Record the outcome: CONFIRMED, REJECTED (definite refusal) or UNCONFIRMED (no answer)
 *
 * The room booking is never rolled back because of the device. If the outcome cannot be stored
 * after a successful reservation, the device booking is canceled (compensation).
 *
 * Status changes, reschedules and device changes are written first; device-service is only
 * called for changes that were actually stored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomBookingOrchestrator {

    private final HourlyBookingService bookingService;
    private final DeviceReservationBridge deviceBridge;
    private final RoomBookingEventPublisher eventPublisher;

    public RoomBookingResponse createBooking(CreateRoomBookingRequest request) {
        CreatedBooking created;
        try {
            created = bookingService.createBooking(request);
        } catch (DataIntegrityViolationException e) {
            // same external id committed by a concurrent request for another room
            created = bookingService.findByExternalBookingId(request.externalBookingId())
                    .map(existing -> new CreatedBooking(existing, true))
                    .orElseThrow(() -> e);
            log.info("Room booking key {} taken concurrently; replaying booking {}",
                    request.externalBookingId(), created.booking().getId());
        }
        HourlyBooking booking = created.booking();
        if (created.replayed()) {
            return RoomBookingResponse.from(booking);
        }
        if (booking.getDeviceReservationStatus() == DeviceReservationStatus.UNCONFIRMED) {
            reserveDevice(booking);
        }
        eventPublisher.publishCreated(booking);
        return RoomBookingResponse.from(booking);
    }

    /**
     * Reserves the booking's device and records the outcome on the booking (also updates the passed instance).
     * Safe to call again for the same booking: device-service replays the key.
     */
    public DeviceReservationStatus reserveDevice(HourlyBooking booking) {
        DeviceBookingResult result;
        try {
            result = deviceBridge.reserve(booking);
        } catch (BusinessException e) {
            log.info("Device refused for room booking {}: {}", booking.getId(), e.getMessage());
            return record(booking, DeviceReservationStatus.REJECTED, null);
        } catch (RuntimeException e) {
            log.warn("Device reservation for room booking {} unconfirmed, pending manual follow-up (key {}): {}",
                    booking.getId(), booking.deviceBookingKey(), e.getMessage());
            booking.setDeviceReservationStatus(DeviceReservationStatus.UNCONFIRMED);
            return DeviceReservationStatus.UNCONFIRMED;
        }

        if (result.status() != null && !result.status().isApproved()) {
            log.info("Device booking {} for room booking {} is {}, not reusable",
                    result.externalBookingId(), booking.getId(), result.status().value());
            return record(booking, DeviceReservationStatus.REJECTED, null);
        }

        try {
            bookingService.recordDeviceReservation(
                    booking.getId(), DeviceReservationStatus.CONFIRMED, result.externalBookingId());
        } catch (RuntimeException e) {
            log.error("Could not store device confirmation for room booking {}; canceling device booking {}",
                    booking.getId(), result.externalBookingId(), e);
            compensate(result.externalBookingId());
            booking.setDeviceReservationStatus(DeviceReservationStatus.UNCONFIRMED);
            return DeviceReservationStatus.UNCONFIRMED;
        }
        booking.setDeviceReservationStatus(DeviceReservationStatus.CONFIRMED);
        booking.setExternalDeviceBookingId(result.externalBookingId());
        log.info("Device {} reserved for room booking {} (device booking {}, replayed={})",
                result.deviceName(), booking.getId(), result.bookingId(), result.replayed());
        return DeviceReservationStatus.CONFIRMED;
    }

    /**
     * Versioned status change. Canceling or rejecting a booking with a device releases the device once
     * the new status is stored (best-effort); a failed release is logged with the device booking key
     * for reconciliation.
     */
    public StatusUpdateResponse updateStatus(Long bookingId, StatusUpdateRequest request) {
        HourlyBooking booking = bookingService.checkStatusChange(bookingId, request);
        StatusUpdateResponse response = bookingService.updateStatus(bookingId, request);
        if (releasesDevice(booking, request.status())) {
            releaseDevice(booking);
        }
        eventPublisher.publishStatusChanged(booking, response.status(), response.version());
        return response;
    }

    /**
     * Moves the booking to a new interval, then moves its device booking to the new day
     * under the same key.
     */
    public RoomBookingResponse reschedule(Long bookingId, RescheduleBookingRequest request) {
        ChangedBooking changed = bookingService.reschedule(bookingId, request);
        rebookDevice(changed);
        eventPublisher.publishUpdated(changed.booking());
        return RoomBookingResponse.from(changed.booking());
    }

    /**
     * Replaces the booking's device: the old device booking is released and the new device is
     * reserved under the same key.
     */
    public RoomBookingResponse changeDevice(Long bookingId, ChangeDeviceRequest request) {
        ChangedBooking changed = bookingService.changeDevice(bookingId, request);
        rebookDevice(changed);
        eventPublisher.publishUpdated(changed.booking());
        return RoomBookingResponse.from(changed.booking());
    }

    private void rebookDevice(ChangedBooking changed) {
        HourlyBooking booking = changed.booking();
        if (booking.getDeviceReservationStatus() != DeviceReservationStatus.UNCONFIRMED) {
            return;
        }
        if (changed.deviceHeld() && !releaseDevice(booking)) {
            // reserving now would replay the old device booking
            log.error("Device booking {} for room booking {} could not be released; not re-reserved, reconcile manually",
                    booking.deviceBookingKey(), booking.getId());
            record(booking, DeviceReservationStatus.REJECTED, null);
            return;
        }
        reserveDevice(booking);
    }

    private static boolean releasesDevice(HourlyBooking booking, BookingStatus target) {
        boolean ending = target == BookingStatus.CANCELED || target == BookingStatus.REJECTED;
        DeviceReservationStatus device = booking.getDeviceReservationStatus();
        // UNCONFIRMED too: the device call may have succeeded without us seeing the answer
        return ending && (device == DeviceReservationStatus.CONFIRMED || device == DeviceReservationStatus.UNCONFIRMED);
    }

    /** Returns false when device-service may still hold the booking. */
    private boolean releaseDevice(HourlyBooking booking) {
        String key = booking.getExternalDeviceBookingId() != null
                ? booking.getExternalDeviceBookingId()
                : booking.deviceBookingKey();
        try {
            deviceBridge.cancel(key);
            return true;
        } catch (ResourceNotFoundException e) {
            log.info("Device booking {} for room booking {} already gone", key, booking.getId());
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to cancel device booking {} for room booking {}; reconcile manually: {}",
                    key, booking.getId(), e.getMessage());
            return false;
        }
    }

    private void compensate(String externalDeviceBookingId) {
        try {
            deviceBridge.cancel(externalDeviceBookingId);
        } catch (RuntimeException e) {
            log.error("Compensation failed: device booking {} left active; reconcile manually",
                    externalDeviceBookingId, e);
        }
    }

    private DeviceReservationStatus record(HourlyBooking booking, DeviceReservationStatus status, String externalId) {
        try {
            bookingService.recordDeviceReservation(booking.getId(), status, externalId);
            booking.setDeviceReservationStatus(status);
        } catch (RuntimeException e) {
            log.error("Could not store device status {} for room booking {}", status, booking.getId(), e);
        }
        return status;
    }
}
