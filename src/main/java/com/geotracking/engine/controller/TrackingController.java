package com.geotracking.engine.controller;

import com.geotracking.engine.dto.DeviceRegistrationRecord;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.dto.IngestResult;
import com.geotracking.engine.dto.LocationPingRecord;
import com.geotracking.engine.model.RejectionReason;
import com.geotracking.engine.service.DeviceService;
import com.geotracking.engine.service.FanoutHub;
import com.geotracking.engine.service.GeofenceRegistry;
import com.geotracking.engine.service.LocationIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for location ingest and device state.
 *
 * Pings are not bean-validated here: the ingest pipeline validates them
 * itself and reports {@code INVALID_PING} like any other rejection.
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Tracking", description = "Location ingest and live device state")
public class TrackingController {

    private final LocationIngestService ingestService;
    private final DeviceService deviceService;
    private final GeofenceRegistry geofenceRegistry;
    private final FanoutHub fanoutHub;

    @Operation(
            summary = "Ingest a location ping",
            description = "Validates and orders the ping, updates live state, evaluates geofences and raises alerts. " +
                    "Rejected pings return 422 with the rejection reason, or 503 when storage is unavailable."
    )
    @PostMapping("/pings")
    public ResponseEntity<IngestResult> ingest(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    required = true,
                    content = @Content(examples = @ExampleObject(
                            value = "{\"deviceId\":\"d1\",\"latitude\":40.0,\"longitude\":-74.0,\"accuracy\":5," +
                                    "\"batteryLevel\":90,\"timestamp\":\"2024-01-01T12:00:00Z\"}"
                    ))
            )
            @RequestBody LocationPingRecord ping) {
        IngestResult result = ingestService.ingest(ping);
        if (result.reason() == RejectionReason.STORAGE_UNAVAILABLE) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        if (!result.accepted()) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Ingest a batch of pings", description = "Pings are processed oldest first; one result per ping.")
    @PostMapping("/pings/batch")
    public ResponseEntity<List<IngestResult>> ingestBatch(@RequestBody List<LocationPingRecord> pings) {
        log.info("Received batch of {} pings", pings.size());
        return ResponseEntity.ok(ingestService.ingestBatch(pings));
    }

    @Operation(summary = "Register a device", description = "Records owner and type ahead of the first ping.")
    @PostMapping("/devices")
    public ResponseEntity<DeviceStateDelta> registerDevice(@Valid @RequestBody DeviceRegistrationRecord registration) {
        return ResponseEntity.status(HttpStatus.CREATED).body(deviceService.register(registration));
    }

    @GetMapping("/devices")
    public ResponseEntity<List<DeviceStateDelta>> listDevices() {
        return ResponseEntity.ok(deviceService.listDevices());
    }

    @GetMapping("/devices/{deviceId}")
    public ResponseEntity<DeviceStateDelta> getDevice(@PathVariable String deviceId) {
        return ResponseEntity.ok(deviceService.getDevice(deviceId));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Geofence Tracking & Alert Engine",
            "activeGeofences", geofenceRegistry.activeSnapshot().size(),
            "trackedDevices", deviceService.trackedDeviceCount(),
            "subscribers", fanoutHub.activeCount(),
            "timestamp", Instant.now()
        ));
    }
}
