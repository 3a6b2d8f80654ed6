package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Clock;

/**
 * Runs storage writes off the ingest path with bounded exponential backoff.
 *
 * Writes are scheduled, never executed inline, so a slow or failing
 * database cannot hold a device lock. After the last attempt the write is
 * logged as lost from durable storage; anything already fanned out to live
 * subscribers stays delivered.
 */
@Component
@Slf4j
public class PersistenceRetrier {

    private final TaskScheduler taskScheduler;
    private final TrackingProperties.Persistence settings;
    private final Clock clock;

    public PersistenceRetrier(TaskScheduler taskScheduler, TrackingProperties properties, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.settings = properties.getPersistence();
        this.clock = clock;
    }

    /**
     * Schedules {@code write} for immediate execution, retrying on any runtime failure.
     *
     * @param operation short description used in log lines, e.g. "SaveAlert 42"
     */
    public void submit(String operation, Runnable write) {
        schedule(new Attempt(operation, write, newBackOff().start()), 0L);
    }

    private ExponentialBackOff newBackOff() {
        ExponentialBackOff backOff = new ExponentialBackOff(
            settings.getInitialBackoff().toMillis(),
            settings.getMultiplier()
        );
        backOff.setMaxInterval(settings.getMaxBackoff().toMillis());
        return backOff;
    }

    private void schedule(Attempt attempt, long delayMillis) {
        try {
            taskScheduler.schedule(attempt, clock.instant().plusMillis(delayMillis));
        } catch (TaskRejectedException e) {
            log.error("{} could not be scheduled (attempt {}); lost from durable storage",
                attempt.operation, attempt.attempts + 1, e);
        }
    }

    private final class Attempt implements Runnable {

        private final String operation;
        private final Runnable write;
        private final BackOffExecution backOff;
        private int attempts;

        private Attempt(String operation, Runnable write, BackOffExecution backOff) {
            this.operation = operation;
            this.write = write;
            this.backOff = backOff;
        }

        @Override
        public void run() {
            attempts++;
            try {
                write.run();
                if (attempts > 1) {
                    log.info("{} succeeded on attempt {}", operation, attempts);
                }
            } catch (RuntimeException e) {
                long delay = backOff.nextBackOff();
                if (attempts >= settings.getMaxAttempts() || delay == BackOffExecution.STOP) {
                    log.error("{} failed after {} attempts; lost from durable storage", operation, attempts, e);
                    return;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempts, settings.getMaxAttempts(), delay, e.getMessage());
                schedule(this, delay);
            }
        }
    }
}
