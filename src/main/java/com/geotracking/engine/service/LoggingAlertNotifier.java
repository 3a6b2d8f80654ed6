package com.geotracking.engine.service;

import com.geotracking.engine.dto.AlertRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default notifier used when no delivery channel is wired in.
 */
@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void handOff(AlertRecord alert) {
        log.info("Notification hand-off: {} - {}", alert.toLogString(), alert.message());
    }
}
