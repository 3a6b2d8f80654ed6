package com.geotracking.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Classification tag of a geofence.
 *
 * Tags only drive presentation and alert wording; containment is evaluated
 * the same way for every kind. Unknown tags are rejected at the boundary
 * instead of being carried around as free-form strings.
 */
public enum GeofenceKind {

    GARAGE("garage"),
    HOT_ZONE("hot_zone"),
    SAFE_ZONE("safe_zone"),
    RESTRICTED("restricted"),
    CUSTOM("custom");

    private final String tag;

    GeofenceKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static GeofenceKind fromTag(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        String normalized = value.trim().replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown geofence kind: " + value));
    }
}
