package com.geotracking.engine.persistence;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.model.AlertKind;
import com.geotracking.engine.model.GeofenceKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Storage adapters against the embedded database.
 */
@DataJpaTest
@Import({JpaAlertStore.class, JpaDeviceStore.class, JpaGeofenceStore.class})
class JpaStoresTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private JpaAlertStore alertStore;

    @Autowired
    private JpaDeviceStore deviceStore;

    @Autowired
    private JpaGeofenceStore geofenceStore;

    @MockBean
    private DeviceStateCache deviceStateCache;

    private static AlertRecord alert(String id, String deviceId, long secondsAfterT0) {
        return new AlertRecord(id, deviceId, null, AlertKind.LOW_BATTERY, "battery low",
            T0.plusSeconds(secondsAfterT0), false);
    }

    private static DeviceSnapshot device(String deviceId, long version, double latitude) {
        return new DeviceSnapshot(deviceId, "acct-1", "car", null, latitude, -74.0, 5.0,
            T0.plusSeconds(version), 80, true, T0.plusSeconds(version), version);
    }

    @Test
    void alertsAreReturnedNewestFirstAndFilterable() {
        alertStore.save(alert("a1", "d1", 1));
        alertStore.save(alert("a2", "d2", 2));
        alertStore.save(alert("a3", "d1", 3));

        assertThat(alertStore.find(null, null)).extracting(AlertRecord::id).containsExactly("a3", "a2", "a1");
        assertThat(alertStore.find(null, List.of("d1"))).extracting(AlertRecord::id).containsExactly("a3", "a1");
        assertThat(alertStore.find(null, List.of())).isEmpty();
    }

    @Test
    void readFlagsAreOwnedByStorage() {
        alertStore.save(alert("a1", "d1", 1));
        alertStore.save(alert("a2", "d2", 2));
        alertStore.save(alert("a3", "d2", 3));

        assertThat(alertStore.markRead("a1")).isTrue();
        assertThat(alertStore.markRead("missing")).isFalse();
        assertThat(alertStore.find(false, null)).extracting(AlertRecord::id).containsExactly("a3", "a2");

        assertThat(alertStore.markAllRead(List.of("d2"))).isEqualTo(2);
        assertThat(alertStore.find(false, null)).isEmpty();
        assertThat(alertStore.find(true, List.of("d1"))).extracting(AlertRecord::id).containsExactly("a1");
    }

    @Test
    void deviceUpsertIgnoresOlderVersions() {
        deviceStore.upsert(device("d1", 5, 40.5));
        deviceStore.upsert(device("d1", 3, 40.3));

        when(deviceStateCache.get("d1")).thenReturn(Optional.empty());
        DeviceSnapshot stored = deviceStore.load("d1").orElseThrow();

        assertThat(stored.stateVersion()).isEqualTo(5);
        assertThat(stored.latitude()).isEqualTo(40.5);
    }

    @Test
    void deviceLoadPrefersCache() {
        DeviceSnapshot cached = device("d1", 9, 41.0);
        when(deviceStateCache.get("d1")).thenReturn(Optional.of(cached));

        assertThat(deviceStore.load("d1")).contains(cached);
        verify(deviceStateCache, never()).put(any());
    }

    @Test
    void unknownDeviceLoadsEmpty() {
        assertThat(deviceStore.load("ghost")).isEmpty();
    }

    @Test
    void geofencesRoundTripIncludingInactive() {
        geofenceStore.save(new GeofenceRecord("g2", "Garage", GeofenceKind.GARAGE, 40.0, -74.0, 30.0, false));
        geofenceStore.save(new GeofenceRecord("g1", "Office", GeofenceKind.SAFE_ZONE, 40.1, -74.1, 200.0, true));
        geofenceStore.save(new GeofenceRecord("g1", "Office HQ", GeofenceKind.SAFE_ZONE, 40.1, -74.1, 250.0, true));

        List<GeofenceRecord> all = geofenceStore.loadAll();

        assertThat(all).extracting(GeofenceRecord::id).containsExactly("g1", "g2");
        assertThat(all.get(0).name()).isEqualTo("Office HQ");
        assertThat(all.get(0).radiusMeters()).isEqualTo(250.0);
        assertThat(all.get(1).active()).isFalse();

        assertThat(geofenceStore.delete("g2")).isTrue();
        assertThat(geofenceStore.delete("g2")).isFalse();
    }
}
