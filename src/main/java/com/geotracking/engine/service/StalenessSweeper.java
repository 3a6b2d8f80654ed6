package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.AlertRequest;
import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.model.DeviceState;
import com.geotracking.engine.persistence.DeviceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodically flags silent devices offline.
 *
 * The only actor that flips a device from online to offline. Each flip
 * publishes the new state and routes a device_offline request through the
 * dispatcher, so cool-down also covers overlapping sweeps.
 */
@Service
@Slf4j
public class StalenessSweeper {

    private final DeviceStateStore deviceStateStore;
    private final ContainmentTracker containmentTracker;
    private final AlertDispatcher alertDispatcher;
    private final FanoutHub fanoutHub;
    private final DeviceStore deviceStore;
    private final PersistenceRetrier persistenceRetrier;
    private final Clock clock;
    private final Duration offlineThreshold;

    public StalenessSweeper(DeviceStateStore deviceStateStore,
                            ContainmentTracker containmentTracker,
                            AlertDispatcher alertDispatcher,
                            FanoutHub fanoutHub,
                            DeviceStore deviceStore,
                            PersistenceRetrier persistenceRetrier,
                            TrackingProperties properties,
                            Clock clock) {
        this.deviceStateStore = deviceStateStore;
        this.containmentTracker = containmentTracker;
        this.alertDispatcher = alertDispatcher;
        this.fanoutHub = fanoutHub;
        this.deviceStore = deviceStore;
        this.persistenceRetrier = persistenceRetrier;
        this.clock = clock;
        this.offlineThreshold = properties.getStaleness().getOfflineThreshold();
    }

    @Scheduled(fixedRateString = "${geotracking.staleness.sweep-interval-ms:30000}",
               initialDelayString = "${geotracking.staleness.sweep-interval-ms:30000}")
    public void scheduledSweep() {
        try {
            int flagged = sweep();
            if (flagged > 0) {
                log.info("Staleness sweep flagged {} devices offline", flagged);
            }
        } catch (RuntimeException e) {
            log.error("Staleness sweep failed", e);
        }
    }

    /**
     * @return number of devices flipped to offline
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(offlineThreshold);
        int flagged = 0;

        for (DeviceSnapshot device : deviceStateStore.snapshot()) {
            if (!isStale(device.online(), device.lastSeen(), cutoff)) {
                continue;
            }
            try {
                boolean flipped = deviceStateStore
                    .withKnownDevice(device.deviceId(), state -> markOffline(state, cutoff))
                    .orElse(false);
                if (flipped) {
                    flagged++;
                }
            } catch (RuntimeException e) {
                log.error("Could not flag device {} offline", device.deviceId(), e);
            }
        }

        int pruned = alertDispatcher.pruneExpiredCooldowns();
        if (pruned > 0) {
            log.debug("Pruned {} expired alert cool-downs", pruned);
        }
        return flagged;
    }

    private boolean markOffline(DeviceState state, Instant cutoff) {
        // re-check under the lock: a ping may have arrived since the snapshot
        if (!isStale(state.isOnline(), state.getLastSeen(), cutoff)) {
            return false;
        }

        state.markOffline();
        DeviceSnapshot snapshot = state.toSnapshot();
        long silentSeconds = Duration.between(snapshot.lastSeen(), clock.instant()).getSeconds();
        log.info("Device {} offline after {}s of silence", snapshot.deviceId(), silentSeconds);

        fanoutHub.publish(DeviceStateDelta.of(snapshot, containmentTracker.insideGeofenceIds(snapshot.deviceId())));
        alertDispatcher.dispatch(AlertRequest.deviceOffline(snapshot.deviceId(), silentSeconds));
        persistenceRetrier.submit("UpsertDeviceState " + snapshot.deviceId() + " v" + snapshot.stateVersion(),
            () -> deviceStore.upsert(snapshot));
        return true;
    }

    private static boolean isStale(boolean online, Instant lastSeen, Instant cutoff) {
        return online && lastSeen != null && lastSeen.isBefore(cutoff);
    }
}
