package com.geotracking.engine.dto;

import java.time.Instant;
import java.util.List;

/**
 * Live state of one device as pushed to map views.
 *
 * Carries the full current state rather than a field diff so that a newer
 * delta can always replace an older one in a congested subscriber queue.
 *
 * @param insideGeofenceIds active geofences the device is currently inside
 */
public record DeviceStateDelta(
    String deviceId,
    String ownerId,
    String deviceType,
    Double latitude,
    Double longitude,
    Double accuracy,
    Instant positionTimestamp,
    Integer batteryLevel,
    boolean online,
    Instant lastSeen,
    List<String> insideGeofenceIds,
    long stateVersion
) implements TrackingEvent {

    public DeviceStateDelta {
        insideGeofenceIds = insideGeofenceIds == null ? List.of() : List.copyOf(insideGeofenceIds);
    }

    public static DeviceStateDelta of(DeviceSnapshot snapshot, List<String> insideGeofenceIds) {
        return new DeviceStateDelta(
            snapshot.deviceId(),
            snapshot.ownerId(),
            snapshot.deviceType(),
            snapshot.latitude(),
            snapshot.longitude(),
            snapshot.accuracy(),
            snapshot.positionTimestamp(),
            snapshot.batteryLevel(),
            snapshot.online(),
            snapshot.lastSeen(),
            insideGeofenceIds,
            snapshot.stateVersion()
        );
    }
}
