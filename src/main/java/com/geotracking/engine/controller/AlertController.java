package com.geotracking.engine.controller;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.service.AlertService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert history and read flags.
 *
 * The device filter is supplied by the caller's identity layer (the
 * devices an account may see); it is applied as given.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Alert history and read status")
public class AlertController {

    private final AlertService alertService;

    @Operation(summary = "List alerts", description = "Newest first.")
    @GetMapping
    public ResponseEntity<List<AlertRecord>> list(
        @Parameter(description = "all, unread or read", example = "unread")
        @RequestParam(defaultValue = "all") String status,
        @Parameter(description = "Restrict to these devices")
        @RequestParam(required = false) List<String> deviceId
    ) {
        return ResponseEntity.ok(alertService.findAlerts(status, deviceId));
    }

    @PostMapping("/{alertId}/read")
    public ResponseEntity<Map<String, Object>> markRead(@PathVariable String alertId) {
        alertService.markRead(alertId);
        return ResponseEntity.ok(Map.of("status", "OK", "alertId", alertId));
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Object>> markAllRead(@RequestParam(required = false) List<String> deviceId) {
        int updated = alertService.markAllRead(deviceId);
        return ResponseEntity.ok(Map.of("status", "OK", "updated", updated));
    }
}
