package com.clinicbooking.room.bridge;

import com.clinicbooking.room.client.dto.DeviceCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;

/**
 * Device list shown next to room slots, read through an optional Redis cache.
 * The cache is only for display; device availability is decided by device-service at booking time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceCatalogService {

    static final String CACHE_PREFIX = "devices:";

    private final DeviceReservationBridge bridge;
    private final ObjectMapper objectMapper;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    /** 0 disables the cache. */
    @Value("${room.device-api.cache-ttl-seconds:60}")
    private long cacheTtlSeconds;

    public DeviceCatalog listDevices(LocalDate date) {
        String key = CACHE_PREFIX + date;
        DeviceCatalog cached = readCache(key);
        if (cached != null) {
            return cached;
        }
        DeviceCatalog catalog = bridge.listDevices(date);
        writeCache(key, catalog);
        return catalog;
    }

    private DeviceCatalog readCache(String key) {
        if (stringRedisTemplate == null || cacheTtlSeconds <= 0) {
            return null;
        }
        try {
            String json = stringRedisTemplate.opsForValue().get(key);
            return json == null ? null : objectMapper.readValue(json, DeviceCatalog.class);
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("Device cache read failed for {}: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, DeviceCatalog catalog) {
        if (stringRedisTemplate == null || cacheTtlSeconds <= 0) {
            return;
        }
        try {
            stringRedisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(catalog),
                    Duration.ofSeconds(cacheTtlSeconds));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to cache device list {} (non-fatal): {}", key, e.getMessage());
        }
    }
}
