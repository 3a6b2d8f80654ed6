package com.geotracking.engine.dto;

import java.util.List;

/**
 * Outcome of one evaluation pass of a device against the active geofences.
 *
 * @param transitions        true containment changes (each becomes one alert request)
 * @param insideGeofenceIds  geofences the device is inside after the pass
 * @param failedGeofenceIds  geofences whose evaluation failed; their state is unchanged
 */
public record ContainmentResult(
    List<ContainmentTransition> transitions,
    List<String> insideGeofenceIds,
    List<String> failedGeofenceIds
) {
}
