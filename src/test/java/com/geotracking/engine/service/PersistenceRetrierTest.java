package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.geotracking.engine.support.Positions.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PersistenceRetrierTest {

    private TaskScheduler scheduler;
    private PersistenceRetrier retrier;

    @BeforeEach
    void setUp() {
        TrackingProperties properties = new TrackingProperties();
        properties.getPersistence().setMaxAttempts(3);
        properties.getPersistence().setInitialBackoff(Duration.ofMillis(100));
        properties.getPersistence().setMultiplier(2.0);
        properties.getPersistence().setMaxBackoff(Duration.ofSeconds(1));
        scheduler = mock(TaskScheduler.class);
        retrier = new PersistenceRetrier(scheduler, properties, new MutableClock(T0));
    }

    private List<Runnable> scheduled(int expected, List<Instant> times) {
        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(scheduler, times(expected)).schedule(tasks.capture(), at.capture());
        times.addAll(at.getAllValues());
        return tasks.getAllValues();
    }

    @Test
    void writeIsScheduledNotRunInline() {
        AtomicInteger writes = new AtomicInteger();

        retrier.submit("SaveAlert a1", writes::incrementAndGet);

        assertThat(writes).hasValue(0);
        List<Instant> at = new ArrayList<>();
        scheduled(1, at).get(0).run();
        assertThat(writes).hasValue(1);
        assertThat(at).containsExactly(T0);
    }

    @Test
    void failedWriteIsRetriedWithGrowingBackoff() {
        AtomicInteger attempts = new AtomicInteger();
        retrier.submit("SaveAlert a1", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("db down");
            }
        });

        List<Instant> at = new ArrayList<>();
        scheduled(1, at).get(0).run();
        at.clear();
        scheduled(2, at).get(1).run();
        at.clear();
        List<Runnable> tasks = scheduled(3, at);
        tasks.get(2).run();

        assertThat(attempts).hasValue(3);
        assertThat(at).containsExactly(T0, T0.plusMillis(100), T0.plusMillis(200));
    }

    @Test
    void writeIsAbandonedAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();
        retrier.submit("SaveAlert a1", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("db down");
        });

        for (int i = 1; i <= 3; i++) {
            List<Runnable> tasks = scheduled(i, new ArrayList<>());
            tasks.get(i - 1).run();
        }

        assertThat(attempts).hasValue(3);
        verify(scheduler, times(3)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void rejectedSchedulingIsLoggedNotThrown() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class)))
            .thenThrow(new TaskRejectedException("scheduler shut down"));

        assertThatCode(() -> retrier.submit("SaveAlert a1", () -> { }))
            .doesNotThrowAnyException();
    }
}
