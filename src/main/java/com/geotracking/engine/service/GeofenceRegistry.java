package com.geotracking.engine.service;

import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.exception.UnknownResourceException;
import com.geotracking.engine.persistence.GeofenceStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Live set of geofences, copy-on-write.
 *
 * Writers are serialized and publish a new immutable {@link Snapshot} with
 * a single volatile write; evaluation passes read one snapshot and never
 * see a half-applied update. Storage is written before the snapshot is
 * swapped, so a failed write leaves the live set untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceRegistry {

    private final GeofenceStore geofenceStore;
    private final ContainmentTracker containmentTracker;

    private final Object writeLock = new Object();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Immutable view of all known geofences plus the active subset.
     */
    record Snapshot(Map<String, GeofenceRecord> all, List<GeofenceRecord> active) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());

        static Snapshot of(Map<String, GeofenceRecord> geofences) {
            List<GeofenceRecord> active = geofences.values().stream()
                .filter(GeofenceRecord::active)
                .sorted(Comparator.comparing(GeofenceRecord::id))
                .toList();
            return new Snapshot(Map.copyOf(geofences), active);
        }
    }

    /**
     * Loads geofences on startup. A failure leaves the registry empty; it
     * can be reloaded later without restarting.
     */
    @PostConstruct
    public void warmUp() {
        log.info("Loading geofences...");
        try {
            int count = reload();
            log.info("Geofence registry ready: {} geofences, {} active", count, snapshot.active().size());
        } catch (RuntimeException e) {
            log.error("Geofence warm-up failed, starting with an empty registry", e);
        }
    }

    /**
     * Replaces the live set with what storage holds.
     *
     * @return number of geofences loaded
     */
    public int reload() {
        List<GeofenceRecord> stored = geofenceStore.loadAll();
        synchronized (writeLock) {
            Map<String, GeofenceRecord> next = new LinkedHashMap<>();
            stored.forEach(geofence -> next.put(geofence.id(), geofence));
            Snapshot previous = snapshot;
            snapshot = Snapshot.of(next);
            previous.all().keySet().stream()
                .filter(id -> !next.containsKey(id) || !next.get(id).active())
                .forEach(containmentTracker::purgeGeofence);
        }
        return stored.size();
    }

    /**
     * Adds or replaces a geofence. Center, radius and kind changes apply to
     * every evaluation that starts after this returns.
     */
    public GeofenceRecord upsert(GeofenceRecord geofence) {
        GeofenceRecord validated = validate(geofence);
        synchronized (writeLock) {
            geofenceStore.save(validated);
            Map<String, GeofenceRecord> next = new LinkedHashMap<>(snapshot.all());
            next.put(validated.id(), validated);
            snapshot = Snapshot.of(next);
        }
        if (!validated.active()) {
            containmentTracker.purgeGeofence(validated.id());
        }
        log.info("Geofence upserted: {}", validated.toLogString());
        return validated;
    }

    public GeofenceRecord setActive(String geofenceId, boolean active) {
        GeofenceRecord current = find(geofenceId)
            .orElseThrow(() -> new UnknownResourceException("Geofence", geofenceId));
        return upsert(current.withActive(active));
    }

    /**
     * @return false if the geofence was unknown
     */
    public boolean remove(String geofenceId) {
        boolean existed;
        synchronized (writeLock) {
            boolean stored = geofenceStore.delete(geofenceId);
            Map<String, GeofenceRecord> next = new LinkedHashMap<>(snapshot.all());
            existed = next.remove(geofenceId) != null || stored;
            snapshot = Snapshot.of(next);
        }
        containmentTracker.purgeGeofence(geofenceId);
        if (existed) {
            log.info("Geofence removed: {}", geofenceId);
        }
        return existed;
    }

    /**
     * Active geofences for one evaluation pass. The list is immutable and
     * stays valid even if the registry changes while it is in use.
     */
    public List<GeofenceRecord> activeSnapshot() {
        return snapshot.active();
    }

    public List<GeofenceRecord> all() {
        return snapshot.all().values().stream()
            .sorted(Comparator.comparing(GeofenceRecord::id))
            .toList();
    }

    public Optional<GeofenceRecord> find(String geofenceId) {
        return Optional.ofNullable(snapshot.all().get(geofenceId));
    }

    private GeofenceRecord validate(GeofenceRecord geofence) {
        if (geofence == null) {
            throw new IllegalArgumentException("Geofence is required");
        }
        if (geofence.name() == null || geofence.name().isBlank()) {
            throw new IllegalArgumentException("Geofence name cannot be blank");
        }
        Double lat = geofence.centerLatitude();
        Double lon = geofence.centerLongitude();
        if (lat == null || !Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Geofence center latitude out of range: " + lat);
        }
        if (lon == null || !Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Geofence center longitude out of range: " + lon);
        }
        Double radius = geofence.radiusMeters();
        if (radius == null || !Double.isFinite(radius) || radius <= 0) {
            throw new IllegalArgumentException("Geofence radius must be > 0: " + radius);
        }
        if (geofence.id() == null || geofence.id().isBlank()) {
            return geofence.withId(UUID.randomUUID().toString());
        }
        return geofence;
    }
}
