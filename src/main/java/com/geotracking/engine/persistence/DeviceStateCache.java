package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.DeviceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache of the last persisted device state.
 *
 * Best effort only: every failure is logged and reported as a miss, the
 * database behind {@link JpaDeviceStore} stays the source of truth.
 *
 * Redis Storage Format:
 * - Key: "device:state:{deviceId}"
 * - Value: DeviceSnapshot as JSON
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeviceStateCache {

    private static final String DEVICE_KEY_PREFIX = "device:state:";

    // last known state is only useful for about a day without pings
    private static final long CACHE_TTL_HOURS = 24;

    private final RedisTemplate<String, DeviceSnapshot> deviceStateRedisTemplate;

    public Optional<DeviceSnapshot> get(String deviceId) {
        try {
            return Optional.ofNullable(deviceStateRedisTemplate.opsForValue().get(DEVICE_KEY_PREFIX + deviceId));
        } catch (RuntimeException e) {
            log.warn("Device state cache read failed for {}, falling back to database: {}", deviceId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Stores the snapshot unless the cached copy is newer.
     */
    public void put(DeviceSnapshot snapshot) {
        String key = DEVICE_KEY_PREFIX + snapshot.deviceId();
        try {
            DeviceSnapshot cached = deviceStateRedisTemplate.opsForValue().get(key);
            if (cached != null && cached.stateVersion() > snapshot.stateVersion()) {
                log.debug("Skipping cache write for {}: cached v{} newer than v{}",
                    snapshot.deviceId(), cached.stateVersion(), snapshot.stateVersion());
                return;
            }
            deviceStateRedisTemplate.opsForValue().set(key, snapshot, CACHE_TTL_HOURS, TimeUnit.HOURS);
        } catch (RuntimeException e) {
            log.warn("Device state cache write failed for {}: {}", snapshot.deviceId(), e.getMessage());
        }
    }
}
