package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.entity.DeviceEntity;
import com.geotracking.engine.exception.PersistenceFailureException;
import com.geotracking.engine.repository.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Device storage with a cache-aside Redis copy.
 *
 * Reads try {@link DeviceStateCache} first and fall back to the database;
 * writes go to the database and then refresh the cache.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaDeviceStore implements DeviceStore {

    private final DeviceRepository deviceRepository;
    private final DeviceStateCache deviceStateCache;

    @Override
    @Transactional(readOnly = true)
    public Optional<DeviceSnapshot> load(String deviceId) {
        Optional<DeviceSnapshot> cached = deviceStateCache.get(deviceId);
        if (cached.isPresent()) {
            log.debug("Cache hit: device {}", deviceId);
            return cached;
        }

        try {
            Optional<DeviceSnapshot> stored = deviceRepository.findById(deviceId).map(DeviceEntity::toSnapshot);
            stored.ifPresent(deviceStateCache::put);
            return stored;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("LoadDevice", e);
        }
    }

    @Override
    @Transactional
    public void upsert(DeviceSnapshot snapshot) {
        try {
            DeviceEntity entity = deviceRepository.findForUpdate(snapshot.deviceId())
                .orElseGet(() -> DeviceEntity.builder().deviceId(snapshot.deviceId()).build());

            if (entity.getStateVersion() != null && entity.getStateVersion() > snapshot.stateVersion()) {
                log.debug("Ignoring out-of-order state write for {}: stored v{} > v{}",
                    snapshot.deviceId(), entity.getStateVersion(), snapshot.stateVersion());
                return;
            }

            entity.applySnapshot(snapshot);
            deviceRepository.save(entity);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("UpsertDeviceState", e);
        }
        deviceStateCache.put(snapshot);
    }
}
