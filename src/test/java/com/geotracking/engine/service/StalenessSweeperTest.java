package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.DeviceRegistrationRecord;
import com.geotracking.engine.dto.IngestResult;
import com.geotracking.engine.model.AlertKind;
import com.geotracking.engine.support.EngineFixture;
import com.geotracking.engine.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.geotracking.engine.support.Positions.ping;
import static org.assertj.core.api.Assertions.assertThat;

class StalenessSweeperTest {

    private EngineFixture engine;
    private RecordingSink sink;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        sink = new RecordingSink();
        engine.fanoutHub.register(deviceId -> true, sink);
        engine.ingestService.ingest(ping("d1", 0, 5, 90, 1));
    }

    @Test
    void silentDeviceGoesOfflineWithExactlyOneAlert() {
        engine.clock.advance(Duration.ofMinutes(3));

        assertThat(engine.stalenessSweeper.sweep()).isEqualTo(1);
        assertThat(engine.stalenessSweeper.sweep()).isZero();
        engine.clock.advance(Duration.ofMinutes(2));
        assertThat(engine.stalenessSweeper.sweep()).isZero();
        engine.fanoutExecutor.runAll();

        assertThat(engine.deviceStateStore.find("d1").orElseThrow().online()).isFalse();
        assertThat(sink.alerts()).singleElement()
            .satisfies(alert -> assertThat(alert.kind()).isEqualTo(AlertKind.DEVICE_OFFLINE));
        assertThat(sink.deltas()).last().satisfies(delta -> assertThat(delta.online()).isFalse());
    }

    @Test
    void deviceWithinThresholdStaysOnline() {
        engine.clock.advance(Duration.ofSeconds(119));

        assertThat(engine.stalenessSweeper.sweep()).isZero();
        assertThat(engine.deviceStateStore.find("d1").orElseThrow().online()).isTrue();
    }

    @Test
    void nextPingRestoresOnlineWithoutAlert() {
        engine.clock.advance(Duration.ofMinutes(3));
        engine.stalenessSweeper.sweep();

        IngestResult back = engine.ingestService.ingest(ping("d1", 0, 5, 90, 400));

        assertThat(back.accepted()).isTrue();
        assertThat(back.alerts()).isEmpty();
        assertThat(engine.deviceStateStore.find("d1").orElseThrow().online()).isTrue();
    }

    @Test
    void secondOfflinePeriodAlertsAgainEvenWithinCooldown() {
        TrackingProperties properties = new TrackingProperties();
        properties.getStaleness().setOfflineThreshold(Duration.ofSeconds(10));
        EngineFixture fast = new EngineFixture(properties);
        RecordingSink fastSink = new RecordingSink();
        fast.fanoutHub.register(deviceId -> true, fastSink);

        fast.ingestService.ingest(ping("d1", 0, 5, 90, 1));
        fast.clock.advance(Duration.ofSeconds(20));
        fast.stalenessSweeper.sweep();
        fast.ingestService.ingest(ping("d1", 0, 5, 90, 30));
        fast.clock.advance(Duration.ofSeconds(20));
        fast.stalenessSweeper.sweep();
        fast.fanoutExecutor.runAll();

        assertThat(fastSink.alerts()).extracting(alert -> alert.kind())
            .containsExactly(AlertKind.DEVICE_OFFLINE, AlertKind.DEVICE_OFFLINE);
    }

    @Test
    void sweepIgnoresRegisteredDevicesThatNeverReported() {
        engine.deviceService.register(new DeviceRegistrationRecord("d2", "owner-1", "car", null));
        engine.clock.advance(Duration.ofMinutes(10));

        assertThat(engine.stalenessSweeper.sweep()).isEqualTo(1);
        assertThat(engine.deviceStateStore.find("d2").orElseThrow().online()).isFalse();
    }
}
