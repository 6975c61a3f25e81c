package com.clinicbooking.device.domain.strategy;

import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Row lock on the device for the rest of the caller's transaction.
 * Concurrent creations for the same device queue on the lock; other devices are unaffected.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockStrategy implements BookingLockStrategy {

    private final DeviceRepository deviceRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public Device lockDevice(Long deviceId) {
        Device device = deviceRepository.findByIdForUpdate(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
        log.debug("Locked device row {}", deviceId);
        return device;
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
