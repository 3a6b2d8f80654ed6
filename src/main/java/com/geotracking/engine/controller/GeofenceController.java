package com.geotracking.engine.controller;

import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.exception.UnknownResourceException;
import com.geotracking.engine.service.GeofenceRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofences", description = "Circular geofence definitions used for containment")
public class GeofenceController {

    private final GeofenceRegistry geofenceRegistry;

    @Operation(summary = "List geofences", description = "All geofences, or only active ones with ?active=true.")
    @GetMapping
    public ResponseEntity<List<GeofenceRecord>> list(@RequestParam(required = false) Boolean active) {
        if (Boolean.TRUE.equals(active)) {
            return ResponseEntity.ok(geofenceRegistry.activeSnapshot());
        }
        return ResponseEntity.ok(geofenceRegistry.all());
    }

    @GetMapping("/{id}")
    public ResponseEntity<GeofenceRecord> get(@PathVariable String id) {
        return geofenceRegistry.find(id)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new UnknownResourceException("Geofence", id));
    }

    @Operation(summary = "Create or replace a geofence",
            description = "Center, radius and kind changes apply to every evaluation after the update commits.")
    @PutMapping("/{id}")
    public ResponseEntity<GeofenceRecord> upsert(@PathVariable String id, @Valid @RequestBody GeofenceRecord geofence) {
        return ResponseEntity.ok(geofenceRegistry.upsert(geofence.withId(id)));
    }

    @Operation(summary = "Activate or deactivate a geofence",
            description = "Deactivating drops its containment state; it is re-learned without alerts on reactivation.")
    @PatchMapping("/{id}/active")
    public ResponseEntity<GeofenceRecord> setActive(@PathVariable String id, @RequestParam boolean active) {
        return ResponseEntity.ok(geofenceRegistry.setActive(id, active));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String id) {
        if (!geofenceRegistry.remove(id)) {
            throw new UnknownResourceException("Geofence", id);
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Reload geofences from storage")
    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload() {
        int loaded = geofenceRegistry.reload();
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "geofencesLoaded", loaded,
            "active", geofenceRegistry.activeSnapshot().size()
        ));
    }
}
