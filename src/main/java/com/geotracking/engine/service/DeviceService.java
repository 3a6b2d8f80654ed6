package com.geotracking.engine.service;

import com.geotracking.engine.dto.DeviceRegistrationRecord;
import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.exception.UnknownResourceException;
import com.geotracking.engine.persistence.DeviceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Device registration and live-state queries.
 *
 * Registration only records ownership and descriptive fields; position
 * and the online flag stay owned by ingest and the staleness sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceService {

    private final DeviceStateStore deviceStateStore;
    private final ContainmentTracker containmentTracker;
    private final FanoutHub fanoutHub;
    private final DeviceStore deviceStore;
    private final PersistenceRetrier persistenceRetrier;

    public DeviceStateDelta register(DeviceRegistrationRecord registration) {
        if (registration == null || registration.deviceId() == null || registration.deviceId().isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be blank");
        }
        String deviceId = registration.deviceId().trim();

        return deviceStateStore.withDevice(deviceId, state -> {
            state.register(registration.ownerId(), registration.deviceType(), registration.phoneNumber());
            DeviceSnapshot snapshot = state.toSnapshot();
            DeviceStateDelta delta = DeviceStateDelta.of(snapshot, containmentTracker.insideGeofenceIds(deviceId));
            fanoutHub.publish(delta);
            persistenceRetrier.submit("UpsertDeviceState " + deviceId + " v" + snapshot.stateVersion(),
                () -> deviceStore.upsert(snapshot));
            log.info("Device registered: {} (owner={}, type={})", deviceId, snapshot.ownerId(), snapshot.deviceType());
            return delta;
        });
    }

    public DeviceStateDelta getDevice(String deviceId) {
        return deviceStateStore.find(deviceId)
            .map(snapshot -> DeviceStateDelta.of(snapshot, containmentTracker.insideGeofenceIds(deviceId)))
            .orElseThrow(() -> new UnknownResourceException("Device", deviceId));
    }

    public int trackedDeviceCount() {
        return deviceStateStore.size();
    }

    public List<DeviceStateDelta> listDevices() {
        return deviceStateStore.snapshot().stream()
            .sorted(Comparator.comparing(DeviceSnapshot::deviceId))
            .map(snapshot -> DeviceStateDelta.of(snapshot, containmentTracker.insideGeofenceIds(snapshot.deviceId())))
            .toList();
    }
}
