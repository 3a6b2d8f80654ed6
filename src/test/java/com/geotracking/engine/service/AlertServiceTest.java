package com.geotracking.engine.service;

import com.geotracking.engine.exception.UnknownResourceException;
import com.geotracking.engine.persistence.AlertStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock
    private AlertStore alertStore;

    @InjectMocks
    private AlertService alertService;

    @Test
    void statusFilterMapsToReadFlag() {
        alertService.findAlerts("unread", null);
        alertService.findAlerts("READ", List.of("d1"));
        alertService.findAlerts("all", null);

        verify(alertStore).find(Boolean.FALSE, null);
        verify(alertStore).find(Boolean.TRUE, List.of("d1"));
        verify(alertStore).find(null, null);
    }

    @Test
    void unknownStatusFilterIsRejected() {
        assertThatThrownBy(() -> alertService.findAlerts("archived", null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("archived");
    }

    @Test
    void markingUnknownAlertFails() {
        when(alertStore.markRead("a1")).thenReturn(false);

        assertThatThrownBy(() -> alertService.markRead("a1"))
            .isInstanceOf(UnknownResourceException.class)
            .hasMessage("Alert 'a1' not found");
    }

    @Test
    void markAllReadReturnsUpdatedCount() {
        when(alertStore.markAllRead(List.of("d1", "d2"))).thenReturn(4);

        assertThat(alertService.markAllRead(List.of("d1", "d2"))).isEqualTo(4);
    }
}
