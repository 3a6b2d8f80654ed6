package com.geotracking.engine.service;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.dto.AlertRequest;
import com.geotracking.engine.model.AlertKind;
import com.geotracking.engine.support.EngineFixture;
import com.geotracking.engine.support.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AlertDispatcherTest {

    private EngineFixture engine;
    private AlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture();
        dispatcher = engine.alertDispatcher;
    }

    private AlertRequest enter(String deviceId, String geofenceId) {
        return new AlertRequest(deviceId, geofenceId, AlertKind.GEOFENCE_ENTER, "entered");
    }

    @Test
    void repeatedAlertWithinCooldownIsSuppressed() {
        assertThat(dispatcher.dispatch(enter("d1", "g1"))).isPresent();

        engine.clock.advance(Duration.ofSeconds(59));
        assertThat(dispatcher.dispatch(enter("d1", "g1"))).isEmpty();

        engine.clock.advance(Duration.ofSeconds(1));
        assertThat(dispatcher.dispatch(enter("d1", "g1"))).isPresent();

        verify(engine.persistenceRetrier, times(2)).submit(anyString(), any());
    }

    @Test
    void cooldownIsKeyedByDeviceGeofenceAndKind() {
        assertThat(dispatcher.dispatch(enter("d1", "g1"))).isPresent();
        assertThat(dispatcher.dispatch(enter("d2", "g1"))).isPresent();
        assertThat(dispatcher.dispatch(enter("d1", "g2"))).isPresent();
        assertThat(dispatcher.dispatch(new AlertRequest("d1", "g1", AlertKind.GEOFENCE_EXIT, "left"))).isPresent();
        assertThat(dispatcher.cooldownEntries()).isEqualTo(4);
    }

    @Test
    void suppressedAlertIsNeitherPublishedNorStored() {
        RecordingSink sink = new RecordingSink();
        engine.fanoutHub.register(deviceId -> true, sink);

        dispatcher.dispatch(AlertRequest.lowBattery("d1", 10));
        dispatcher.dispatch(AlertRequest.lowBattery("d1", 9));
        engine.fanoutExecutor.runAll();

        assertThat(sink.alerts()).hasSize(1);
        verify(engine.persistenceRetrier, times(1)).submit(anyString(), any());
        verify(engine.alertNotifier, times(1)).handOff(any());
    }

    @Test
    void createdAlertIsUnreadAndStamped() {
        AlertRecord alert = dispatcher.dispatch(AlertRequest.deviceOffline("d1", 180)).orElseThrow();

        assertThat(alert.id()).isNotBlank();
        assertThat(alert.read()).isFalse();
        assertThat(alert.createdAt()).isEqualTo(engine.clock.instant());
        assertThat(alert.geofenceId()).isNull();
        assertThat(alert.message()).contains("d1").contains("180s");
    }

    @Test
    void clearedCooldownAllowsImmediateRepeat() {
        dispatcher.dispatch(AlertRequest.deviceOffline("d1", 180));
        dispatcher.clearCooldown("d1", null, AlertKind.DEVICE_OFFLINE);

        assertThat(dispatcher.dispatch(AlertRequest.deviceOffline("d1", 200))).isPresent();
    }

    @Test
    void expiredCooldownsArePruned() {
        dispatcher.dispatch(enter("d1", "g1"));
        engine.clock.advance(Duration.ofSeconds(30));
        dispatcher.dispatch(enter("d2", "g1"));

        engine.clock.advance(Duration.ofSeconds(30));
        assertThat(dispatcher.pruneExpiredCooldowns()).isEqualTo(1);
        assertThat(dispatcher.cooldownEntries()).isEqualTo(1);
    }

    @Test
    void notifierFailureDoesNotLoseTheAlert() {
        doThrow(new IllegalStateException("push gateway down")).when(engine.alertNotifier).handOff(any());

        Optional<AlertRecord> alert = dispatcher.dispatch(enter("d1", "g1"));

        assertThat(alert).isPresent();
        verify(engine.persistenceRetrier).submit(anyString(), any());
    }
}
