package com.geotracking.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the tracking engine, bound from {@code geotracking.*}.
 *
 * Defaults match the values the engine was designed around; every one of
 * them can be overridden per deployment.
 */
@Data
@ConfigurationProperties(prefix = "geotracking")
public class TrackingProperties {

    private Containment containment = new Containment();
    private Alerts alerts = new Alerts();
    private Staleness staleness = new Staleness();
    private Fanout fanout = new Fanout();
    private Persistence persistence = new Persistence();

    @Data
    public static class Containment {
        /**
         * Upper bound of the hysteresis margin. The margin is the ping's
         * reported accuracy, capped at this value.
         */
        private double maxMarginMeters = 50.0;
    }

    @Data
    public static class Alerts {
        /** Window in which a repeated (device, geofence, kind) alert is suppressed. */
        private Duration cooldown = Duration.ofSeconds(60);

        /** Battery percentage below which a low_battery alert is raised. */
        private int lowBatteryThreshold = 20;
    }

    @Data
    public static class Staleness {
        /** Silence after which an online device is flagged offline. */
        private Duration offlineThreshold = Duration.ofMinutes(2);

        /** Interval between sweeps, in milliseconds. */
        private long sweepIntervalMs = 30_000;
    }

    @Data
    public static class Fanout {
        /** Bounded outbound queue size per subscriber. */
        private int queueCapacity = 256;

        private int deliveryThreads = 4;
    }

    @Data
    public static class Persistence {
        /** Total attempts per write, including the first one. */
        private int maxAttempts = 5;

        /**
         * Attempts to load a device record on first use. Loads block the
         * device's first ping, so this stays small.
         */
        private int loadAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(5);
    }
}
