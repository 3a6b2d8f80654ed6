package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.ContainmentResult;
import com.geotracking.engine.dto.ContainmentTransition;
import com.geotracking.engine.dto.GeofenceRecord;
import com.geotracking.engine.model.GeofenceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.geotracking.engine.support.Positions.CENTER_LON;
import static com.geotracking.engine.support.Positions.T0;
import static com.geotracking.engine.support.Positions.circle;
import static com.geotracking.engine.support.Positions.northOfCenter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ContainmentTrackerTest {

    private ContainmentTracker tracker;
    private final GeofenceRecord g1 = circle("g1", 100);

    @BeforeEach
    void setUp() {
        tracker = new ContainmentTracker(new TrackingProperties());
    }

    private ContainmentResult at(double metersNorth, double accuracy, long second, List<GeofenceRecord> geofences) {
        return tracker.evaluate("d1", northOfCenter(metersNorth), CENTER_LON, accuracy,
            T0.plusSeconds(second), geofences);
    }

    @Test
    void firstObservationRecordsStateWithoutTransition() {
        ContainmentResult result = at(0, 5, 1, List.of(g1));

        assertThat(result.transitions()).isEmpty();
        assertThat(result.insideGeofenceIds()).containsExactly("g1");
        assertThat(tracker.stateOf("d1", "g1")).hasValueSatisfying(state -> {
            assertThat(state.inside()).isTrue();
            assertThat(state.lastTransitionAt()).isEqualTo(T0.plusSeconds(1));
        });
    }

    @Test
    void exitThenEnterProducesExactlyOneTransitionEach() {
        at(0, 5, 1, List.of(g1));

        ContainmentResult exit = at(150, 5, 2, List.of(g1));
        assertThat(exit.transitions()).hasSize(1);
        ContainmentTransition exitTransition = exit.transitions().get(0);
        assertThat(exitTransition.entered()).isFalse();
        assertThat(exitTransition.geofence().id()).isEqualTo("g1");
        assertThat(exitTransition.distanceMeters()).isCloseTo(150.0, within(0.5));
        assertThat(exit.insideGeofenceIds()).isEmpty();

        ContainmentResult enter = at(50, 5, 3, List.of(g1));
        assertThat(enter.transitions()).singleElement()
            .satisfies(transition -> assertThat(transition.entered()).isTrue());
        assertThat(tracker.stateOf("d1", "g1").orElseThrow().lastTransitionAt()).isEqualTo(T0.plusSeconds(3));
    }

    @Test
    void oscillationInsideDeadBandNeverTransitions() {
        at(0, 5, 1, List.of(g1));

        // accuracy 20 -> dead band [80m, 120m]
        double[] noisy = {85, 115, 95, 119, 81, 105, 100};
        for (int i = 0; i < noisy.length; i++) {
            assertThat(at(noisy[i], 20, 2 + i, List.of(g1)).transitions()).isEmpty();
        }
        assertThat(tracker.stateOf("d1", "g1").orElseThrow().inside()).isTrue();
    }

    @Test
    void marginIsCappedAtConfiguredMaximum() {
        assertThat(tracker.margin(5)).isEqualTo(5.0);
        assertThat(tracker.margin(500)).isEqualTo(50.0);
        assertThat(tracker.margin(Double.NaN)).isEqualTo(50.0);
    }

    @Test
    void poorAccuracyWidensDeadBand() {
        at(0, 5, 1, List.of(g1));

        // 140m is outside R + 5 but inside R + 50
        assertThat(at(140, 200, 2, List.of(g1)).transitions()).isEmpty();
        assertThat(at(160, 200, 3, List.of(g1)).transitions()).hasSize(1);
    }

    @Test
    void failingGeofenceDoesNotBlockOthers() {
        GeofenceRecord broken = new GeofenceRecord("broken", "Broken", GeofenceKind.CUSTOM,
            40.0, CENTER_LON, Double.NaN, true);
        GeofenceRecord g2 = circle("g2", 300);
        at(0, 5, 1, List.of(g1, g2));

        ContainmentResult result = at(200, 5, 2, List.of(broken, g1, g2));

        assertThat(result.failedGeofenceIds()).containsExactly("broken");
        assertThat(result.transitions()).extracting(t -> t.geofence().id()).containsExactly("g1");
        assertThat(result.insideGeofenceIds()).containsExactly("g2");
        assertThat(tracker.stateOf("d1", "broken")).isEmpty();
    }

    @Test
    void stateOfGeofencesMissingFromSnapshotIsDroppedWithoutPhantomExit() {
        GeofenceRecord g2 = circle("g2", 300);
        at(0, 5, 1, List.of(g1, g2));

        // g1 removed from the active set while the device leaves it
        ContainmentResult result = at(500, 5, 2, List.of(g2));

        assertThat(result.transitions()).extracting(t -> t.geofence().id()).containsExactly("g2");
        assertThat(tracker.stateOf("d1", "g1")).isEmpty();

        // coming back re-learns g1 silently
        assertThat(at(0, 5, 3, List.of(g1, g2)).transitions())
            .extracting(t -> t.geofence().id()).containsExactly("g2");
    }

    @Test
    void purgeGeofenceDropsStateForEveryDevice() {
        tracker.evaluate("d1", 40.0, CENTER_LON, 5, T0, List.of(g1));
        tracker.evaluate("d2", 40.0, CENTER_LON, 5, T0, List.of(g1));

        assertThat(tracker.purgeGeofence("g1")).isEqualTo(2);
        assertThat(tracker.insideGeofenceIds("d1")).isEmpty();
        assertThat(tracker.insideGeofenceIds("d2")).isEmpty();
        assertThat(tracker.purgeGeofence("g1")).isZero();
    }

    @Test
    void resizedGeofenceAppliesToNextEvaluation() {
        at(0, 5, 1, List.of(g1));
        GeofenceRecord shrunk = new GeofenceRecord("g1", g1.name(), g1.kind(), g1.centerLatitude(),
            g1.centerLongitude(), 30.0, true);

        ContainmentResult result = tracker.evaluate("d1", northOfCenter(60), CENTER_LON, 5,
            Instant.parse("2024-01-01T12:00:05Z"), List.of(shrunk));

        assertThat(result.transitions()).singleElement()
            .satisfies(transition -> assertThat(transition.entered()).isFalse());
    }
}
