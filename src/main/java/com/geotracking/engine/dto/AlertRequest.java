package com.geotracking.engine.dto;

import com.geotracking.engine.model.AlertKind;

import java.util.Objects;

/**
 * Request to raise an alert; the dispatcher decides whether it becomes one.
 */
public record AlertRequest(
    String deviceId,
    String geofenceId,
    AlertKind kind,
    String message
) {

    public AlertRequest {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(kind, "kind");
        if (kind.isGeofenceScoped() && geofenceId == null) {
            throw new IllegalArgumentException(kind.tag() + " alert requires a geofence");
        }
    }

    public static AlertRequest forTransition(String deviceId, ContainmentTransition transition) {
        GeofenceRecord geofence = transition.geofence();
        AlertKind kind = transition.entered() ? AlertKind.GEOFENCE_ENTER : AlertKind.GEOFENCE_EXIT;
        String message = String.format("Device %s %s %s zone '%s' (%.0fm from center, radius %.0fm)",
            deviceId,
            transition.entered() ? "entered" : "left",
            geofence.kind().tag(),
            geofence.name(),
            transition.distanceMeters(),
            geofence.radiusMeters());
        return new AlertRequest(deviceId, geofence.id(), kind, message);
    }

    public static AlertRequest deviceOffline(String deviceId, long silentSeconds) {
        return new AlertRequest(deviceId, null, AlertKind.DEVICE_OFFLINE,
            String.format("Device %s has not reported for %ds and is now offline", deviceId, silentSeconds));
    }

    public static AlertRequest lowBattery(String deviceId, int batteryLevel) {
        return new AlertRequest(deviceId, null, AlertKind.LOW_BATTERY,
            String.format("Device %s battery is low (%d%%)", deviceId, batteryLevel));
    }
}
