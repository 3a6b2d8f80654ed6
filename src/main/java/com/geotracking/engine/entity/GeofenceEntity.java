package com.geotracking.engine.entity;

import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.model.GeofenceKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Entity representing a circular geofence.
 *
 * 'active' lets a geofence be switched off without deleting it; inactive
 * geofences stay in the live registry but are skipped during evaluation.
 */
@Entity
@Table(name = "geofences", indexes = {
    @Index(name = "idx_geofence_active", columnList = "is_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceEntity {

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private GeofenceKind kind;

    @Column(name = "center_latitude", nullable = false)
    private Double centerLatitude;

    @Column(name = "center_longitude", nullable = false)
    private Double centerLongitude;

    @Column(name = "radius_meters", nullable = false)
    private Double radiusMeters;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static GeofenceEntity fromRecord(GeofenceRecord geofence) {
        return GeofenceEntity.builder()
            .id(geofence.id())
            .name(geofence.name())
            .kind(geofence.kind())
            .centerLatitude(geofence.centerLatitude())
            .centerLongitude(geofence.centerLongitude())
            .radiusMeters(geofence.radiusMeters())
            .active(geofence.active())
            .build();
    }

    /**
     * Copies the mutable fields of an update; id and creation time stay.
     */
    public GeofenceEntity applyRecord(GeofenceRecord geofence) {
        this.name = geofence.name();
        this.kind = geofence.kind();
        this.centerLatitude = geofence.centerLatitude();
        this.centerLongitude = geofence.centerLongitude();
        this.radiusMeters = geofence.radiusMeters();
        this.active = geofence.active();
        return this;
    }

    public GeofenceRecord toRecord() {
        return new GeofenceRecord(id, name, kind, centerLatitude, centerLongitude, radiusMeters,
            Boolean.TRUE.equals(active));
    }
}
