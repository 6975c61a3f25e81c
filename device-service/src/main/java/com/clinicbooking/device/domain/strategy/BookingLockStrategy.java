package com.clinicbooking.device.domain.strategy;

import com.clinicbooking.device.domain.model.Device;

/**
 * Serializes "count approved occupancy, then write" for one device.
 *
 * Implementations (bean names, selected by {@code device.booking.lock-strategy}):
 * - pessimistic: SELECT ... FOR UPDATE on the device row
 * - distributed: Redisson lock per device, held until the surrounding transaction completes
 *
 * Must be called inside an active transaction; the lock is released when it ends.
 */
public interface BookingLockStrategy {

    /**
     * Acquires the device lock and returns the current device row.
     *
     * @throws com.clinicbooking.common.exception.ResourceNotFoundException if the device does not exist
     */
    Device lockDevice(Long deviceId);

    String getStrategyType();
}
