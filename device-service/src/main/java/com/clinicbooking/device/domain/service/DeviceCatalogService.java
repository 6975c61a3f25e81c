package com.clinicbooking.device.domain.service;

import com.clinicbooking.common.booking.BookingStatus;
import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ErrorCodes;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.common.interval.ConflictDetector;
import com.clinicbooking.common.interval.DateRange;
import com.clinicbooking.device.api.dto.AvailabilityRangeRequest;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse.DateAvailability;
import com.clinicbooking.device.api.dto.AvailabilityRangeResponse.ItemAvailability;
import com.clinicbooking.device.api.dto.DeviceAvailabilityResponse;
import com.clinicbooking.device.api.dto.DeviceListResponse;
import com.clinicbooking.device.api.dto.DeviceResponse;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.model.DeviceBooking;
import com.clinicbooking.device.domain.repository.DeviceBookingRepository;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read side of the device catalog: per-day availability for listings and the sibling API,
 * plus the permanent-reservation switch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceCatalogService {

    public static final int MAX_AVAILABILITY_DAYS_RANGE = 90;

    static final String REASON_RESERVED = "reserved";
    static final String REASON_BOOKED = "booked";

    private final DeviceRepository deviceRepository;
    private final DeviceBookingRepository bookingRepository;
    private final Clock clock;

    /**
     * Active devices with availability for {@code date} (today when null).
     * Permanently reserved devices are listed only when {@code includeReserved} is set.
     */
    @Transactional(readOnly = true)
    public DeviceListResponse listDevices(LocalDate date, boolean includeReserved) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        List<DeviceResponse> devices = new ArrayList<>();
        for (Device device : deviceRepository.findByActiveTrueOrderBySortOrderAscNameAsc()) {
            if (device.isPermanentReserved() && !includeReserved) {
                continue;
            }
            devices.add(new DeviceResponse(
                    device.getId(),
                    device.getName(),
                    device.getDescription(),
                    isAvailable(device, approvedCount(device, day)),
                    device.isPermanentReserved()));
        }
        return new DeviceListResponse(day, devices);
    }

    @Transactional(readOnly = true)
    public DeviceAvailabilityResponse getAvailability(Long deviceId, LocalDate date) {
        Device device = deviceRepository.findById(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
        long booked = approvedCount(device, date);
        return new DeviceAvailabilityResponse(
                device.getId(),
                device.getName(),
                date,
                device.getTotalQuantity(),
                booked,
                device.isPermanentReserved(),
                isAvailable(device, booked));
    }

    /**
     * Availability per device and per day for an inclusive range of at most 90 days.
     */
    @Transactional(readOnly = true)
    public AvailabilityRangeResponse getAvailability(AvailabilityRangeRequest request) {
        if (request.startDate().isAfter(request.endDate())) {
            throw new BusinessException("start_date must be before or equal to end_date", ErrorCodes.VALIDATION_ERROR);
        }
        if (ChronoUnit.DAYS.between(request.startDate(), request.endDate()) > MAX_AVAILABILITY_DAYS_RANGE) {
            throw new BusinessException("date range exceeds maximum of " + MAX_AVAILABILITY_DAYS_RANGE + " days",
                    ErrorCodes.VALIDATION_ERROR);
        }
        Set<Long> filter = request.itemIds() == null ? Set.of() : new HashSet<>(request.itemIds());

        List<ItemAvailability> items = new ArrayList<>();
        for (Device device : deviceRepository.findByActiveTrueOrderBySortOrderAscNameAsc()) {
            if (!filter.isEmpty() && !filter.contains(device.getId())) {
                continue;
            }
            List<DeviceBooking> approved = bookingRepository.findOverlapping(
                    device.getId(), request.startDate(), request.endDate(), BookingStatus.APPROVED_STATES);
            List<DateAvailability> days = new ArrayList<>();
            for (LocalDate day = request.startDate(); !day.isAfter(request.endDate()); day = day.plusDays(1)) {
                days.add(dayAvailability(device, approved, day));
            }
            items.add(new ItemAvailability(device.getId(), device.getName(), days));
        }
        return new AvailabilityRangeResponse(request.startDate(), request.endDate(), items);
    }

    @Transactional
    public void setPermanentReserved(Long deviceId, boolean reserved) {
        int updated = deviceRepository.setPermanentReserved(deviceId, reserved);
        if (updated == 0) {
            throw new ResourceNotFoundException("Device", deviceId);
        }
        log.info("Device {} permanent reservation set to {}", deviceId, reserved);
    }

    @Transactional(readOnly = true)
    public List<DeviceResponse> listPermanentReserved() {
        return deviceRepository.findByPermanentReservedTrueOrderByNameAsc().stream()
                .map(d -> new DeviceResponse(d.getId(), d.getName(), d.getDescription(), false, true))
                .toList();
    }

    private DateAvailability dayAvailability(Device device, List<DeviceBooking> approved, LocalDate day) {
        if (device.isPermanentReserved()) {
            return new DateAvailability(day, false, REASON_RESERVED);
        }
        long booked = ConflictDetector.countOverlapping(DateRange.singleDay(day), approved, DeviceBooking::extent);
        if (booked >= device.getTotalQuantity()) {
            return new DateAvailability(day, false, REASON_BOOKED);
        }
        return new DateAvailability(day, true, null);
    }

    private long approvedCount(Device device, LocalDate day) {
        return bookingRepository.countOverlapping(device.getId(), day, day, BookingStatus.APPROVED_STATES, 0L);
    }

    private static boolean isAvailable(Device device, long approvedCount) {
        return device.isActive() && !device.isPermanentReserved() && approvedCount < device.getTotalQuantity();
    }
}
