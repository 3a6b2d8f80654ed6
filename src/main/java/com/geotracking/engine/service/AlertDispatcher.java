package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.dto.AlertRequest;
import com.geotracking.engine.model.AlertKind;
import com.geotracking.engine.persistence.AlertStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Turns alert requests into alerts.
 *
 * Flow:
 * 1. Cool-down: a request whose (device, geofence, kind) produced an alert
 *    within the window is suppressed (logged, not stored, not fanned out)
 * 2. Create the alert with read=false
 * 3. Publish it to live subscribers
 * 4. Persist it through the retrier (storage stays the source of truth)
 * 5. Hand it off to notification delivery
 *
 * Fanout does not wait for storage; a storage outage never delays live alerts.
 */
@Service
@Slf4j
public class AlertDispatcher {

    private final AlertStore alertStore;
    private final FanoutHub fanoutHub;
    private final PersistenceRetrier persistenceRetrier;
    private final AlertNotifier alertNotifier;
    private final Clock clock;
    private final Duration cooldown;

    private final ConcurrentMap<CooldownKey, Instant> lastCreated = new ConcurrentHashMap<>();

    public AlertDispatcher(AlertStore alertStore,
                           FanoutHub fanoutHub,
                           PersistenceRetrier persistenceRetrier,
                           AlertNotifier alertNotifier,
                           TrackingProperties properties,
                           Clock clock) {
        this.alertStore = alertStore;
        this.fanoutHub = fanoutHub;
        this.persistenceRetrier = persistenceRetrier;
        this.alertNotifier = alertNotifier;
        this.clock = clock;
        this.cooldown = properties.getAlerts().getCooldown();
    }

    record CooldownKey(String deviceId, String geofenceId, AlertKind kind) {
    }

    /**
     * @return the created alert, or empty if the request was suppressed by cool-down
     */
    public Optional<AlertRecord> dispatch(AlertRequest request) {
        Instant now = clock.instant();
        CooldownKey key = new CooldownKey(request.deviceId(), request.geofenceId(), request.kind());

        boolean[] admitted = {false};
        lastCreated.compute(key, (k, previous) -> {
            if (previous != null && now.isBefore(previous.plus(cooldown))) {
                return previous;
            }
            admitted[0] = true;
            return now;
        });

        if (!admitted[0]) {
            log.warn("Alert suppressed by cool-down: device={}, geofence={}, kind={}",
                request.deviceId(), request.geofenceId(), request.kind().tag());
            return Optional.empty();
        }

        AlertRecord alert = AlertRecord.create(request, now);
        log.info("Alert raised: {} - {}", alert.toLogString(), alert.message());

        fanoutHub.publish(alert);
        persistenceRetrier.submit("SaveAlert " + alert.id(), () -> alertStore.save(alert));

        try {
            alertNotifier.handOff(alert);
        } catch (RuntimeException e) {
            log.error("Notification hand-off failed for {}", alert.toLogString(), e);
        }
        return Optional.of(alert);
    }

    /**
     * Forgets the cool-down of one (device, geofence, kind), e.g. when a
     * device comes back online so its next offline period alerts again.
     */
    public void clearCooldown(String deviceId, String geofenceId, AlertKind kind) {
        if (lastCreated.remove(new CooldownKey(deviceId, geofenceId, kind)) != null) {
            log.debug("Cleared {} cool-down for device {}", kind.tag(), deviceId);
        }
    }

    /**
     * Drops cool-down entries that can no longer suppress anything.
     *
     * @return number of entries removed
     */
    public int pruneExpiredCooldowns() {
        Instant now = clock.instant();
        int before = lastCreated.size();
        lastCreated.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().plus(cooldown)));
        return before - lastCreated.size();
    }

    int cooldownEntries() {
        return lastCreated.size();
    }
}
