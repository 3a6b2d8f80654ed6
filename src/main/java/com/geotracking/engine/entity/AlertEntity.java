package com.geotracking.engine.entity;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.model.AlertKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted alert.
 *
 * Storage is the source of truth for alert history; the in-memory
 * {@link AlertRecord} is what live subscribers receive.
 */
@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alert_device", columnList = "device_id"),
        @Index(name = "idx_alert_created_at", columnList = "created_at"),
        @Index(name = "idx_alert_device_read", columnList = "device_id, is_read")
    }
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "device_id", nullable = false, length = 100)
    private String deviceId;

    /**
     * Null for device-level alerts (offline, low battery)
     */
    @Column(name = "geofence_id", length = 100)
    private String geofenceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private AlertKind kind;

    @Column(nullable = false, length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private Boolean read = false;

    public static AlertEntity fromRecord(AlertRecord alert) {
        return AlertEntity.builder()
            .id(alert.id())
            .deviceId(alert.deviceId())
            .geofenceId(alert.geofenceId())
            .kind(alert.kind())
            .message(alert.message())
            .createdAt(alert.createdAt())
            .read(alert.read())
            .build();
    }

    public AlertRecord toRecord() {
        return new AlertRecord(id, deviceId, geofenceId, kind, message, createdAt, Boolean.TRUE.equals(read));
    }
}
