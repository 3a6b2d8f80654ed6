package com.geotracking.engine.entity;

import com.geotracking.engine.dto.DeviceSnapshot;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Durable copy of a device's registration and last known live state.
 */
@Entity
@Table(name = "devices", indexes = {
    @Index(name = "idx_device_owner", columnList = "owner_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceEntity {

    @Id
    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Column(name = "owner_id", length = 100)
    private String ownerId;

    @Column(name = "device_type", length = 100)
    private String deviceType;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    private Double latitude;

    private Double longitude;

    private Double accuracy;

    @Column(name = "position_timestamp")
    private Instant positionTimestamp;

    @Column(name = "battery_level")
    private Integer batteryLevel;

    @Column(name = "is_online", nullable = false)
    @Builder.Default
    private Boolean online = false;

    @Column(name = "last_seen")
    private Instant lastSeen;

    /**
     * Version of the in-memory state this row was written from.
     * Writes carrying a lower version are ignored.
     */
    @Column(name = "state_version", nullable = false)
    @Builder.Default
    private Long stateVersion = 0L;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void applySnapshot(DeviceSnapshot snapshot) {
        this.ownerId = snapshot.ownerId();
        this.deviceType = snapshot.deviceType();
        this.phoneNumber = snapshot.phoneNumber();
        this.latitude = snapshot.latitude();
        this.longitude = snapshot.longitude();
        this.accuracy = snapshot.accuracy();
        this.positionTimestamp = snapshot.positionTimestamp();
        this.batteryLevel = snapshot.batteryLevel();
        this.online = snapshot.online();
        this.lastSeen = snapshot.lastSeen();
        this.stateVersion = snapshot.stateVersion();
    }

    public DeviceSnapshot toSnapshot() {
        return new DeviceSnapshot(
            deviceId,
            ownerId,
            deviceType,
            phoneNumber,
            latitude,
            longitude,
            accuracy,
            positionTimestamp,
            batteryLevel,
            Boolean.TRUE.equals(online),
            lastSeen,
            stateVersion != null ? stateVersion : 0L
        );
    }
}
