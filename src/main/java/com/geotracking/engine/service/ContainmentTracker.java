package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.ContainmentResult;
import com.geotracking.engine.dto.ContainmentTransition;
import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.exception.GeofenceEvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per (device, geofence) containment state machine with hysteresis.
 *
 * For a geofence of radius R and a margin m (the ping's accuracy, capped
 * at {@code geotracking.containment.max-margin-meters}):
 * - outside -> inside only when distance &lt; R - m
 * - inside -> outside only when distance &gt; R + m
 * - anything in between keeps the previous state
 *
 * The first evaluation of a pair only records the state (inside iff
 * distance &lt;= R) and never reports a transition.
 *
 * Callers serialize evaluations per device (device lock), so the inner map
 * of one device is never written concurrently by two passes; the outer map
 * is concurrent because geofence purges come from other threads.
 */
@Component
@Slf4j
public class ContainmentTracker {

    private final double maxMarginMeters;
    private final ConcurrentMap<String, ConcurrentMap<String, ContainmentState>> states = new ConcurrentHashMap<>();

    public ContainmentTracker(TrackingProperties properties) {
        this.maxMarginMeters = properties.getContainment().getMaxMarginMeters();
    }

    /**
     * @param inside           last decided containment
     * @param lastTransitionAt when the last true transition happened; the
     *                         time of the initial decision until then
     */
    public record ContainmentState(boolean inside, Instant lastTransitionAt) {
    }

    /**
     * Evaluates a device position against every geofence in the snapshot.
     *
     * Failures are isolated per geofence: a failing geofence keeps its
     * previous state and is reported in {@link ContainmentResult#failedGeofenceIds()}.
     */
    public ContainmentResult evaluate(String deviceId,
                                      double latitude,
                                      double longitude,
                                      double accuracyMeters,
                                      Instant at,
                                      Collection<GeofenceRecord> activeGeofences) {
        ConcurrentMap<String, ContainmentState> deviceStates =
            states.computeIfAbsent(deviceId, id -> new ConcurrentHashMap<>());

        // lazily drop state of geofences that were removed or deactivated
        Set<String> activeIds = new HashSet<>();
        activeGeofences.forEach(geofence -> activeIds.add(geofence.id()));
        deviceStates.keySet().removeIf(geofenceId -> !activeIds.contains(geofenceId));

        double margin = margin(accuracyMeters);
        List<ContainmentTransition> transitions = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (GeofenceRecord geofence : activeGeofences) {
            try {
                evaluateOne(deviceId, latitude, longitude, margin, at, geofence, deviceStates)
                    .ifPresent(transitions::add);
            } catch (RuntimeException e) {
                failed.add(geofence.id());
                log.error("Geofence evaluation failed for device {} against {}, skipping it",
                    deviceId, geofence.toLogString(), e);
            }
        }

        List<String> inside = deviceStates.entrySet().stream()
            .filter(entry -> entry.getValue().inside())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();

        return new ContainmentResult(List.copyOf(transitions), inside, List.copyOf(failed));
    }

    private Optional<ContainmentTransition> evaluateOne(String deviceId,
                                                        double latitude,
                                                        double longitude,
                                                        double margin,
                                                        Instant at,
                                                        GeofenceRecord geofence,
                                                        Map<String, ContainmentState> deviceStates) {
        Double radius = geofence.radiusMeters();
        if (radius == null || !(radius > 0) || Double.isInfinite(radius)) {
            throw new GeofenceEvaluationException(deviceId, geofence.id(), "invalid radius " + radius);
        }

        double distance = geofence.distanceMeters(latitude, longitude);
        if (!Double.isFinite(distance)) {
            throw new GeofenceEvaluationException(deviceId, geofence.id(), "distance is not finite");
        }

        ContainmentState previous = deviceStates.get(geofence.id());
        if (previous == null) {
            boolean inside = distance <= radius;
            deviceStates.put(geofence.id(), new ContainmentState(inside, at));
            log.debug("Initial containment device={} geofence={} inside={} dist={}m",
                deviceId, geofence.id(), inside, Math.round(distance));
            return Optional.empty();
        }

        boolean next = previous.inside();
        if (!previous.inside() && distance < radius - margin) {
            next = true;
        } else if (previous.inside() && distance > radius + margin) {
            next = false;
        }

        if (next == previous.inside()) {
            return Optional.empty();
        }

        deviceStates.put(geofence.id(), new ContainmentState(next, at));
        log.debug("Containment transition device={} geofence={} {} dist={}m margin={}m",
            deviceId, geofence.id(), next ? "ENTER" : "EXIT", Math.round(distance), Math.round(margin));
        return Optional.of(new ContainmentTransition(geofence, next, distance, at));
    }

    double margin(double accuracyMeters) {
        if (!Double.isFinite(accuracyMeters) || accuracyMeters < 0) {
            return maxMarginMeters;
        }
        return Math.min(accuracyMeters, maxMarginMeters);
    }

    public Optional<ContainmentState> stateOf(String deviceId, String geofenceId) {
        Map<String, ContainmentState> deviceStates = states.get(deviceId);
        return deviceStates == null ? Optional.empty() : Optional.ofNullable(deviceStates.get(geofenceId));
    }

    /**
     * Geofences the device was last decided to be inside.
     */
    public List<String> insideGeofenceIds(String deviceId) {
        Map<String, ContainmentState> deviceStates = states.get(deviceId);
        if (deviceStates == null) {
            return List.of();
        }
        return deviceStates.entrySet().stream()
            .filter(entry -> entry.getValue().inside())
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    /**
     * Drops every device's state for a removed or deactivated geofence.
     */
    public int purgeGeofence(String geofenceId) {
        int removed = 0;
        for (Map<String, ContainmentState> deviceStates : states.values()) {
            if (deviceStates.remove(geofenceId) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged containment state of geofence {} for {} devices", geofenceId, removed);
        }
        return removed;
    }
}
