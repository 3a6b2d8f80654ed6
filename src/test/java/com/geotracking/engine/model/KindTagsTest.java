package com.geotracking.engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KindTagsTest {

    @Test
    void kindTagsParseLeniently() {
        assertThat(GeofenceKind.fromTag("Hot Zone")).isEqualTo(GeofenceKind.HOT_ZONE);
        assertThat(GeofenceKind.fromTag("safe-zone")).isEqualTo(GeofenceKind.SAFE_ZONE);
        assertThat(GeofenceKind.fromTag(null)).isEqualTo(GeofenceKind.CUSTOM);
        assertThatThrownBy(() -> GeofenceKind.fromTag("volcano")).isInstanceOf(IllegalArgumentException.class);
        assertThat(AlertKind.fromTag("GEOFENCE_ENTER")).isEqualTo(AlertKind.GEOFENCE_ENTER);
        assertThat(AlertKind.fromTag("low_battery").isGeofenceScoped()).isFalse();
    }
}
