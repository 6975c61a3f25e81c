package com.clinicbooking.device.domain.strategy;

import com.clinicbooking.common.exception.BusinessException;
import com.clinicbooking.common.exception.ResourceNotFoundException;
import com.clinicbooking.device.domain.model.Device;
import com.clinicbooking.device.domain.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.TimeUnit;

/**
 * Redisson lock per device on top of the row lock, for deployments where several services
 * write the same device. The unlock is registered as a transaction synchronization
 * so the lock is held until the insert is committed or rolled back, not just until this method returns.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockStrategy implements BookingLockStrategy {

    static final String LOCK_PREFIX = "lock:device:";

    private final DeviceRepository deviceRepository;
    private final RedissonClient redissonClient;

    @Value("${device.booking.lock-wait-seconds:5}")
    private long waitSeconds = 5;

    @Value("${device.booking.lock-lease-seconds:30}")
    private long leaseSeconds = 30;

    @Override
    public Device lockDevice(Long deviceId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("Device lock requires an active transaction");
        }
        String lockKey = LOCK_PREFIX + deviceId;
        RLock lock = redissonClient.getLock(lockKey);
        try {
            if (!lock.tryLock(waitSeconds, leaseSeconds, TimeUnit.SECONDS)) {
                throw new BusinessException("Device is busy, please try again", "LOCK_TIMEOUT");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Booking interrupted", e, "BOOKING_INTERRUPTED");
        }
        log.debug("Acquired distributed lock: {}", lockKey);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                    log.debug("Released distributed lock: {}", lockKey);
                }
            }
        });
        return deviceRepository.findByIdForUpdate(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Device", deviceId));
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
