package com.geotracking.engine.exception;

/**
 * Evaluating one device against one geofence failed.
 *
 * Scoped to a single geofence: the tracker logs it and carries on with the others.
 */
public class GeofenceEvaluationException extends RuntimeException {

    private final String deviceId;
    private final String geofenceId;

    public GeofenceEvaluationException(String deviceId, String geofenceId, String message) {
        super(String.format("[device=%s, geofence=%s] %s", deviceId, geofenceId, message));
        this.deviceId = deviceId;
        this.geofenceId = geofenceId;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getGeofenceId() {
        return geofenceId;
    }
}
