package com.geotracking.engine.dto;

import com.geotracking.engine.model.AlertKind;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable alert as created by the dispatcher.
 *
 * The core never changes an alert after creation; the read flag is owned by
 * storage and flipped by external consumers.
 *
 * @param geofenceId null for device-level alerts (offline, low battery)
 */
public record AlertRecord(
    String id,
    String deviceId,
    String geofenceId,
    AlertKind kind,
    String message,
    Instant createdAt,
    boolean read
) implements TrackingEvent {

    public static AlertRecord create(AlertRequest request, Instant createdAt) {
        return new AlertRecord(
            UUID.randomUUID().toString(),
            request.deviceId(),
            request.geofenceId(),
            request.kind(),
            request.message(),
            createdAt,
            false
        );
    }

    public String toLogString() {
        return String.format("Alert[id=%s, device=%s, geofence=%s, kind=%s]",
            id, deviceId, geofenceId, kind.tag());
    }
}
