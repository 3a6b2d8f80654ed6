package com.geotracking.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Geofence Tracking & Alert Engine.
 *
 * Flow:
 * 1. Pings arrive via REST or WebSocket
 * 2. Live device state is updated under a per-device lock
 * 3. Containment is evaluated against the in-memory geofence registry
 * 4. Transitions become alerts (with cool-down), stored and fanned out
 * 5. A scheduled sweep flags silent devices offline
 */
@SpringBootApplication
@EnableScheduling
public class GeoTrackingApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeoTrackingApplication.class, args);
    }
}
