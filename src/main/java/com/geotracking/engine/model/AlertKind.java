package com.geotracking.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of alert the engine raises.
 *
 * The wire tag is the lower-case form stored by downstream consumers
 * (e.g. "geofence_enter"); parsing is case-insensitive and rejects unknown tags.
 */
public enum AlertKind {

    GEOFENCE_ENTER("geofence_enter", true),
    GEOFENCE_EXIT("geofence_exit", true),
    DEVICE_OFFLINE("device_offline", false),
    LOW_BATTERY("low_battery", false);

    private final String tag;
    private final boolean geofenceScoped;

    AlertKind(String tag, boolean geofenceScoped) {
        this.tag = tag;
        this.geofenceScoped = geofenceScoped;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    /**
     * Whether alerts of this kind always reference a geofence.
     */
    public boolean isGeofenceScoped() {
        return geofenceScoped;
    }

    @JsonCreator
    public static AlertKind fromTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert kind is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown alert kind: " + value));
    }
}
