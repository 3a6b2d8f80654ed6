package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.DeviceSnapshot;

import java.util.Optional;

/**
 * Durable device state storage. Every method may throw
 * {@link com.geotracking.engine.exception.PersistenceFailureException}.
 */
public interface DeviceStore {

    Optional<DeviceSnapshot> load(String deviceId);

    /**
     * Writes the snapshot unless storage already holds a higher
     * {@link DeviceSnapshot#stateVersion()} for the device.
     */
    void upsert(DeviceSnapshot snapshot);
}
