package com.geotracking.engine.dto;

import jakarta.validation.constraints.*;

import java.time.Instant;

/**
 * Immutable location report from a tracked device.
 *
 * Pings are transient: the engine consumes them to update live state and
 * never stores them itself. The constraint annotations are the validation
 * rules the ingest pipeline applies before anything is mutated.
 *
 * @param deviceId     Stable external identifier of the device
 * @param latitude     WGS84 latitude in decimal degrees
 * @param longitude    WGS84 longitude in decimal degrees
 * @param accuracy     Reported horizontal accuracy in meters (must be positive)
 * @param batteryLevel Battery percentage 0-100
 * @param timestamp    When the device captured the fix
 */
public record LocationPingRecord(
    @NotBlank(message = "Device ID cannot be blank")
    String deviceId,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @NotNull(message = "Accuracy is required")
    @Positive(message = "Accuracy must be > 0")
    Double accuracy,

    @NotNull(message = "Battery level is required")
    @Min(value = 0, message = "Battery level must be >= 0")
    @Max(value = 100, message = "Battery level must be <= 100")
    Integer batteryLevel,

    @NotNull(message = "Timestamp is required")
    Instant timestamp
) {

    /**
     * Returns a compact string representation for logging.
     */
    public String toLogString() {
        return String.format(
            "Ping[device=%s, lat=%s, lon=%s, acc=%s, batt=%s, time=%s]",
            deviceId, latitude, longitude, accuracy, batteryLevel, timestamp
        );
    }
}
