package com.geotracking.engine.dto;

import java.time.Instant;

/**
 * Point-in-time copy of a device's live record.
 *
 * @param stateVersion monotonically increasing per device; higher wins in storage
 */
public record DeviceSnapshot(
    String deviceId,
    String ownerId,
    String deviceType,
    String phoneNumber,
    Double latitude,
    Double longitude,
    Double accuracy,
    Instant positionTimestamp,
    Integer batteryLevel,
    boolean online,
    Instant lastSeen,
    long stateVersion
) {
}
