package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.exception.PersistenceFailureException;
import com.geotracking.engine.model.DeviceState;
import com.geotracking.engine.persistence.DeviceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Authoritative in-memory live record per device.
 *
 * Each device has its own lock: everything done for one ping (state
 * update, containment evaluation, alert emission, publishing) runs inside
 * {@link #withDevice} and never interleaves with another ping or the
 * staleness sweep for the same device. Different devices never contend.
 *
 * Reads outside the lock see the snapshot published when the last
 * locked section finished.
 *
 * A device's record is loaded from storage on first use, retried with
 * bounded backoff. If storage stays unavailable the slot remains unloaded
 * and {@link PersistenceFailureException} is thrown, so the next call tries
 * again instead of starting from an empty record.
 */
@Component
@Slf4j
public class DeviceStateStore {

    private final DeviceStore deviceStore;
    private final TrackingProperties.Persistence settings;
    private final ConcurrentMap<String, DeviceSlot> slots = new ConcurrentHashMap<>();

    public DeviceStateStore(DeviceStore deviceStore, TrackingProperties properties) {
        this.deviceStore = deviceStore;
        this.settings = properties.getPersistence();
    }

    private static final class DeviceSlot {
        private final ReentrantLock lock = new ReentrantLock();
        private DeviceState state;
        private volatile DeviceSnapshot published;
    }

    /**
     * Runs {@code action} with exclusive access to the device's live record,
     * creating it (from storage if known there) on first use.
     *
     * @throws PersistenceFailureException if the record could not be loaded
     */
    public <T> T withDevice(String deviceId, Function<DeviceState, T> action) {
        DeviceSlot slot = slots.computeIfAbsent(deviceId, id -> new DeviceSlot());
        slot.lock.lock();
        try {
            if (slot.state == null) {
                slot.state = loadOrCreate(deviceId);
            }
            try {
                return action.apply(slot.state);
            } finally {
                slot.published = slot.state.toSnapshot();
            }
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Like {@link #withDevice} but only for devices already held in memory.
     */
    public <T> Optional<T> withKnownDevice(String deviceId, Function<DeviceState, T> action) {
        if (!slots.containsKey(deviceId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(withDevice(deviceId, action));
    }

    public Optional<DeviceSnapshot> find(String deviceId) {
        DeviceSlot slot = slots.get(deviceId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.published);
    }

    /**
     * Per-device consistent view of every known device. No consistency
     * across devices is implied.
     */
    public List<DeviceSnapshot> snapshot() {
        List<DeviceSnapshot> result = new ArrayList<>(slots.size());
        for (DeviceSlot slot : slots.values()) {
            DeviceSnapshot published = slot.published;
            if (published != null) {
                result.add(published);
            }
        }
        return result;
    }

    /**
     * Number of devices with a loaded live record.
     */
    public int size() {
        int loaded = 0;
        for (DeviceSlot slot : slots.values()) {
            if (slot.published != null) {
                loaded++;
            }
        }
        return loaded;
    }

    private DeviceState loadOrCreate(String deviceId) {
        Optional<DeviceSnapshot> stored = loadWithRetry(deviceId);
        if (stored.isPresent()) {
            log.debug("Restored device {} from storage (v{})", deviceId, stored.get().stateVersion());
            return DeviceState.fromSnapshot(stored.get());
        }
        log.info("New device observed: {}", deviceId);
        return new DeviceState(deviceId);
    }

    private Optional<DeviceSnapshot> loadWithRetry(String deviceId) {
        ExponentialBackOff backOff = new ExponentialBackOff(
            settings.getInitialBackoff().toMillis(),
            settings.getMultiplier()
        );
        backOff.setMaxInterval(settings.getMaxBackoff().toMillis());
        BackOffExecution execution = backOff.start();

        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return deviceStore.load(deviceId);
            } catch (RuntimeException e) {
                long delay = execution.nextBackOff();
                if (attempts >= settings.getLoadAttempts() || delay == BackOffExecution.STOP) {
                    log.error("LoadDevice {} failed after {} attempts, device left unloaded", deviceId, attempts, e);
                    throw e instanceof PersistenceFailureException failure
                        ? failure
                        : new PersistenceFailureException("LoadDevice", e);
                }
                log.warn("LoadDevice {} failed (attempt {}/{}), retrying in {}ms: {}",
                    deviceId, attempts, settings.getLoadAttempts(), delay, e.getMessage());
                pause(deviceId, delay, e);
            }
        }
    }

    private static void pause(String deviceId, long delayMillis, RuntimeException cause) {
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to reload device {}", deviceId);
            throw new PersistenceFailureException("LoadDevice", cause);
        }
    }
}
