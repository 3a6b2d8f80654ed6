package com.geotracking.engine.model;

import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.LocationPingRecord;
import lombok.Data;

import java.time.Instant;

/**
 * Mutable live record of one device.
 *
 * Instances are only touched while holding the device's lock in
 * {@link com.geotracking.engine.service.DeviceStateStore}; everything that
 * leaves the lock is an immutable {@link DeviceSnapshot}.
 */
@Data
public class DeviceState {

    private final String deviceId;
    private String ownerId;
    private String deviceType;
    private String phoneNumber;

    private Double latitude;
    private Double longitude;
    private Double accuracy;
    private Instant positionTimestamp;

    private Integer batteryLevel;
    private boolean online;
    private Instant lastSeen;

    /** Bumped on every mutation; lets storage discard out-of-order writes. */
    private long stateVersion;

    public static DeviceState fromSnapshot(DeviceSnapshot snapshot) {
        DeviceState state = new DeviceState(snapshot.deviceId());
        state.ownerId = snapshot.ownerId();
        state.deviceType = snapshot.deviceType();
        state.phoneNumber = snapshot.phoneNumber();
        state.latitude = snapshot.latitude();
        state.longitude = snapshot.longitude();
        state.accuracy = snapshot.accuracy();
        state.positionTimestamp = snapshot.positionTimestamp();
        state.batteryLevel = snapshot.batteryLevel();
        state.online = snapshot.online();
        state.lastSeen = snapshot.lastSeen();
        state.stateVersion = snapshot.stateVersion();
        return state;
    }

    /**
     * Applies an accepted ping as one unit: position, battery, last-seen and the online flag.
     */
    public void applyPing(LocationPingRecord ping, Instant receivedAt) {
        this.latitude = ping.latitude();
        this.longitude = ping.longitude();
        this.accuracy = ping.accuracy();
        this.positionTimestamp = ping.timestamp();
        this.batteryLevel = ping.batteryLevel();
        this.lastSeen = receivedAt;
        this.online = true;
        this.stateVersion++;
    }

    public void markOffline() {
        this.online = false;
        this.stateVersion++;
    }

    public void register(String ownerId, String deviceType, String phoneNumber) {
        this.ownerId = ownerId;
        if (deviceType != null) {
            this.deviceType = deviceType;
        }
        if (phoneNumber != null) {
            this.phoneNumber = phoneNumber;
        }
        this.stateVersion++;
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
            online,
            lastSeen,
            stateVersion
        );
    }
}
