package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.dto.AlertRequest;
import com.geotracking.engine.dto.ContainmentResult;
import com.geotracking.engine.dto.ContainmentTransition;
import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.dto.IngestResult;
import com.geotracking.engine.dto.LocationPingRecord;
import com.geotracking.engine.exception.PersistenceFailureException;
import com.geotracking.engine.model.AlertKind;
import com.geotracking.engine.model.DeviceState;
import com.geotracking.engine.model.RejectionReason;
import com.geotracking.engine.persistence.DeviceStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for location pings.
 *
 * Flow:
 * 1. Validate (InvalidPing: nothing changes); a device record that cannot
 *    be loaded from storage rejects the ping as StorageUnavailable
 * 2. Under the device lock: reject pings not strictly newer than the
 *    recorded position (StaleOrDuplicate: nothing changes)
 * 3. Apply position, battery, last-seen and online=true as one unit
 * 4. One containment pass against the active geofence snapshot
 * 5. Publish the new state, then one alert request per transition
 * 6. Low-battery check
 * 7. Queue the durable state write
 */
@Service
@Slf4j
public class LocationIngestService {

    private final DeviceStateStore deviceStateStore;
    private final GeofenceRegistry geofenceRegistry;
    private final ContainmentTracker containmentTracker;
    private final AlertDispatcher alertDispatcher;
    private final FanoutHub fanoutHub;
    private final DeviceStore deviceStore;
    private final PersistenceRetrier persistenceRetrier;
    private final Validator validator;
    private final Clock clock;
    private final int lowBatteryThreshold;

    public LocationIngestService(DeviceStateStore deviceStateStore,
                                 GeofenceRegistry geofenceRegistry,
                                 ContainmentTracker containmentTracker,
                                 AlertDispatcher alertDispatcher,
                                 FanoutHub fanoutHub,
                                 DeviceStore deviceStore,
                                 PersistenceRetrier persistenceRetrier,
                                 Validator validator,
                                 TrackingProperties properties,
                                 Clock clock) {
        this.deviceStateStore = deviceStateStore;
        this.geofenceRegistry = geofenceRegistry;
        this.containmentTracker = containmentTracker;
        this.alertDispatcher = alertDispatcher;
        this.fanoutHub = fanoutHub;
        this.deviceStore = deviceStore;
        this.persistenceRetrier = persistenceRetrier;
        this.validator = validator;
        this.clock = clock;
        this.lowBatteryThreshold = properties.getAlerts().getLowBatteryThreshold();
    }

    public IngestResult ingest(LocationPingRecord ping) {
        if (ping == null) {
            return IngestResult.rejected(null, RejectionReason.INVALID_PING, "Ping is required");
        }

        Optional<String> violation = validate(ping);
        if (violation.isPresent()) {
            log.warn("Invalid ping rejected: {} ({})", ping.toLogString(), violation.get());
            return IngestResult.rejected(ping.deviceId(), RejectionReason.INVALID_PING, violation.get());
        }

        try {
            return deviceStateStore.withDevice(ping.deviceId(), state -> apply(state, ping));
        } catch (PersistenceFailureException e) {
            log.warn("Ping for {} rejected, device record unavailable: {}", ping.deviceId(), e.getMessage());
            return IngestResult.rejected(ping.deviceId(), RejectionReason.STORAGE_UNAVAILABLE,
                "Device record could not be loaded, retry later");
        }
    }

    public List<IngestResult> ingestBatch(List<LocationPingRecord> pings) {
        // oldest first so a batch for one device is not rejected as out of order;
        // null entries sort first and come back as INVALID_PING
        return pings.stream()
            .sorted(Comparator.nullsFirst(Comparator.comparing(LocationPingRecord::timestamp,
                Comparator.nullsFirst(Comparator.naturalOrder()))))
            .map(this::ingest)
            .toList();
    }

    private IngestResult apply(DeviceState state, LocationPingRecord ping) {
        Instant recorded = state.getPositionTimestamp();
        if (recorded != null && !ping.timestamp().isAfter(recorded)) {
            log.debug("Stale or duplicate ping rejected: {} (recorded {})", ping.toLogString(), recorded);
            return IngestResult.rejected(ping.deviceId(), RejectionReason.STALE_OR_DUPLICATE,
                "Timestamp " + ping.timestamp() + " is not after recorded position " + recorded);
        }

        boolean wasOnline = state.isOnline();
        Integer previousBattery = state.getBatteryLevel();
        state.applyPing(ping, clock.instant());

        if (!wasOnline) {
            alertDispatcher.clearCooldown(ping.deviceId(), null, AlertKind.DEVICE_OFFLINE);
            log.info("Device {} is online", ping.deviceId());
        }

        ContainmentResult containment = containmentTracker.evaluate(
            ping.deviceId(),
            ping.latitude(),
            ping.longitude(),
            ping.accuracy(),
            ping.timestamp(),
            geofenceRegistry.activeSnapshot()
        );

        DeviceSnapshot snapshot = state.toSnapshot();
        fanoutHub.publish(DeviceStateDelta.of(snapshot, containment.insideGeofenceIds()));

        List<AlertRecord> alerts = new ArrayList<>();
        for (ContainmentTransition transition : containment.transitions()) {
            alertDispatcher.dispatch(AlertRequest.forTransition(ping.deviceId(), transition))
                .ifPresent(alerts::add);
        }

        if (crossedLowBattery(previousBattery, ping.batteryLevel())) {
            alertDispatcher.dispatch(AlertRequest.lowBattery(ping.deviceId(), ping.batteryLevel()))
                .ifPresent(alerts::add);
        }

        persistenceRetrier.submit("UpsertDeviceState " + snapshot.deviceId() + " v" + snapshot.stateVersion(),
            () -> deviceStore.upsert(snapshot));

        log.debug("Ping accepted: {} ({} transitions, {} alerts)",
            ping.toLogString(), containment.transitions().size(), alerts.size());
        return IngestResult.accepted(ping.deviceId(), alerts);
    }

    private boolean crossedLowBattery(Integer previous, int current) {
        if (current >= lowBatteryThreshold) {
            return false;
        }
        return previous == null || previous >= lowBatteryThreshold;
    }

    private Optional<String> validate(LocationPingRecord ping) {
        List<String> problems = new ArrayList<>();
        for (ConstraintViolation<LocationPingRecord> violation : validator.validate(ping)) {
            problems.add(violation.getMessage());
        }
        // bean validation lets NaN and infinities through range checks
        if (ping.latitude() != null && !Double.isFinite(ping.latitude())) {
            problems.add("Latitude must be a finite number");
        }
        if (ping.longitude() != null && !Double.isFinite(ping.longitude())) {
            problems.add("Longitude must be a finite number");
        }
        if (ping.accuracy() != null && !Double.isFinite(ping.accuracy())) {
            problems.add("Accuracy must be a finite number");
        }
        if (problems.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(problems.stream().distinct().sorted().collect(Collectors.joining("; ")));
    }
}
