package com.geotracking.engine.service;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.exception.UnknownResourceException;
import com.geotracking.engine.persistence.AlertStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Read side of alerts. Queries and read flags go straight to storage; the
 * containment logic never looks at them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertService {

    private final AlertStore alertStore;

    /**
     * @param status    "all", "unread" or "read"
     * @param deviceIds null for every device
     */
    public List<AlertRecord> findAlerts(String status, Collection<String> deviceIds) {
        return alertStore.find(parseStatus(status), deviceIds);
    }

    public void markRead(String alertId) {
        if (!alertStore.markRead(alertId)) {
            throw new UnknownResourceException("Alert", alertId);
        }
        log.debug("Alert {} marked read", alertId);
    }

    public int markAllRead(Collection<String> deviceIds) {
        int updated = alertStore.markAllRead(deviceIds);
        log.info("Marked {} alerts read{}", updated, deviceIds == null ? "" : " for " + deviceIds.size() + " devices");
        return updated;
    }

    private Boolean parseStatus(String status) {
        if (status == null) {
            return null;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "", "all" -> null;
            case "unread" -> Boolean.FALSE;
            case "read" -> Boolean.TRUE;
            default -> throw new IllegalArgumentException("Unknown alert status filter: " + status);
        };
    }
}
