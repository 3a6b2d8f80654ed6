package com.geotracking.engine.dto;

import com.geotracking.engine.model.GeoDistance;
import com.geotracking.engine.model.GeofenceKind;
import jakarta.validation.constraints.*;

/**
 * Immutable circular geofence as held by the registry.
 *
 * Instances are shared by concurrent evaluation passes, so they are never
 * modified; an update replaces the whole record.
 *
 * @param id             Stable identifier
 * @param name           Human-readable name
 * @param kind           Classification tag
 * @param centerLatitude  Center latitude (WGS84)
 * @param centerLongitude Center longitude (WGS84)
 * @param radiusMeters   Radius in meters, strictly positive
 * @param active         Inactive geofences are skipped during evaluation; defaults to true
 */
public record GeofenceRecord(
    String id,

    @NotBlank(message = "Geofence name cannot be blank")
    String name,

    GeofenceKind kind,

    @NotNull(message = "Center latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double centerLatitude,

    @NotNull(message = "Center longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double centerLongitude,

    @NotNull(message = "Radius is required")
    @Positive(message = "Radius must be > 0")
    Double radiusMeters,

    Boolean active
) {

    public GeofenceRecord {
        if (kind == null) {
            kind = GeofenceKind.CUSTOM;
        }
        if (active == null) {
            active = Boolean.TRUE;
        }
    }

    public GeofenceRecord withId(String newId) {
        return new GeofenceRecord(newId, name, kind, centerLatitude, centerLongitude, radiusMeters, active);
    }

    public GeofenceRecord withActive(Boolean newActive) {
        return new GeofenceRecord(id, name, kind, centerLatitude, centerLongitude, radiusMeters, newActive);
    }

    public double distanceMeters(double latitude, double longitude) {
        return GeoDistance.haversineMeters(latitude, longitude, centerLatitude, centerLongitude);
    }

    public String toLogString() {
        return String.format("Geofence[id=%s, name=%s, kind=%s, r=%.1fm, active=%s]",
            id, name, kind.tag(), radiusMeters, active);
    }
}
