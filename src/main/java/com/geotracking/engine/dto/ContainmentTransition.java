package com.geotracking.engine.dto;

import java.time.Instant;

/**
 * A change of containment of one device relative to one geofence.
 */
public record ContainmentTransition(
    GeofenceRecord geofence,
    boolean entered,
    double distanceMeters,
    Instant at
) {
}
