package com.geotracking.engine.service;

import com.geotracking.engine.dto.AlertRecord;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.dto.TrackingEvent;
import com.geotracking.engine.model.CloseReason;
import com.geotracking.engine.model.SubscriptionState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One live subscriber: filter, bounded outbound queue and delivery loop.
 *
 * Offers never block. At most one drain task runs per subscription, so
 * events leave in queue order and per-device order is whatever order the
 * publisher offered them in.
 *
 * Overflow policy:
 * - a state delta supersedes pending deltas of the same device
 * - if still full, pending deltas are compacted to the latest per device
 * - if still full, the subscription goes to DRAINING: queued events are
 *   flushed, then it closes with {@link CloseReason#OVERLOADED}
 * Alerts are never coalesced or dropped while the subscription is connected.
 */
@Slf4j
public class Subscription {

    private final String id;
    private final SubscriberFilter filter;
    private final SubscriberSink sink;
    private final int capacity;
    private final Executor deliveryExecutor;
    private final Consumer<Subscription> onClosed;

    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<TrackingEvent> pending = new ArrayDeque<>();
    private SubscriptionState state = SubscriptionState.CONNECTED;
    private boolean drainScheduled;
    private long coalesced;

    Subscription(String id, SubscriberFilter filter, SubscriberSink sink, int capacity,
                 Executor deliveryExecutor, Consumer<Subscription> onClosed) {
        this.id = id;
        this.filter = filter;
        this.sink = sink;
        this.capacity = Math.max(1, capacity);
        this.deliveryExecutor = deliveryExecutor;
        this.onClosed = onClosed;
    }

    public String getId() {
        return id;
    }

    public SubscriptionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of state deltas superseded by newer ones because of overflow.
     */
    public long coalescedCount() {
        lock.lock();
        try {
            return coalesced;
        } finally {
            lock.unlock();
        }
    }

    boolean matches(TrackingEvent event) {
        return filter.matches(event.deviceId());
    }

    /**
     * Queues an event that already passed the filter.
     *
     * @return false if the event was not queued (not connected, or overload)
     */
    boolean offer(TrackingEvent event) {
        boolean queued;
        boolean scheduled;
        lock.lock();
        try {
            if (state != SubscriptionState.CONNECTED) {
                return false;
            }
            if (pending.size() >= capacity && !makeRoom(event)) {
                state = SubscriptionState.DRAINING;
                log.warn("Subscriber {} overloaded ({} pending), dropping to DRAINING on {} for device {}",
                    id, pending.size(), event instanceof AlertRecord ? "alert" : "state delta", event.deviceId());
                queued = false;
            } else {
                pending.addLast(event);
                queued = true;
            }
            scheduled = scheduleDrainLocked();
        } finally {
            lock.unlock();
        }
        if (!scheduled) {
            close(CloseReason.DELIVERY_FAILED);
            return false;
        }
        return queued;
    }

    /**
     * Queues resynchronization state regardless of capacity; a fresh
     * subscriber must see every device it is allowed to see once.
     */
    void offerInitialState(DeviceStateDelta delta) {
        boolean scheduled;
        lock.lock();
        try {
            if (state != SubscriptionState.CONNECTED) {
                return;
            }
            pending.addLast(delta);
            scheduled = scheduleDrainLocked();
        } finally {
            lock.unlock();
        }
        if (!scheduled) {
            close(CloseReason.DELIVERY_FAILED);
        }
    }

    /**
     * Closes immediately: pending and in-flight events are discarded.
     */
    void close(CloseReason reason) {
        lock.lock();
        try {
            if (state == SubscriptionState.CLOSED) {
                return;
            }
            state = SubscriptionState.CLOSED;
            pending.clear();
        } finally {
            lock.unlock();
        }

        log.info("Subscription {} closed: {} ({} deltas coalesced)", id, reason, coalescedCount());
        onClosed.accept(this);
        try {
            sink.closed(reason);
        } catch (RuntimeException e) {
            log.warn("Subscriber {} close callback failed: {}", id, e.getMessage());
        }
    }

    private boolean makeRoom(TrackingEvent incoming) {
        int before = pending.size();
        if (incoming instanceof DeviceStateDelta delta) {
            pending.removeIf(event -> event instanceof DeviceStateDelta queued
                && queued.deviceId().equals(delta.deviceId()));
        }
        if (pending.size() >= capacity) {
            compactDeltas();
        }
        coalesced += before - pending.size();
        return pending.size() < capacity;
    }

    /**
     * Keeps only the newest pending delta of every device, alerts untouched.
     */
    private void compactDeltas() {
        Set<String> seen = new HashSet<>();
        Iterator<TrackingEvent> newestFirst = pending.descendingIterator();
        while (newestFirst.hasNext()) {
            TrackingEvent event = newestFirst.next();
            if (event instanceof DeviceStateDelta && !seen.add(event.deviceId())) {
                newestFirst.remove();
            }
        }
    }

    /**
     * @return false if the delivery executor refused the drain task
     */
    private boolean scheduleDrainLocked() {
        if (drainScheduled) {
            return true;
        }
        drainScheduled = true;
        try {
            deliveryExecutor.execute(this::drain);
            return true;
        } catch (RejectedExecutionException e) {
            drainScheduled = false;
            log.error("Delivery executor rejected drain for subscriber {}", id, e);
            return false;
        }
    }

    private void drain() {
        while (true) {
            TrackingEvent next;
            lock.lock();
            try {
                if (state == SubscriptionState.CLOSED) {
                    drainScheduled = false;
                    return;
                }
                next = pending.pollFirst();
                if (next == null) {
                    drainScheduled = false;
                    if (state != SubscriptionState.DRAINING) {
                        return;
                    }
                }
            } finally {
                lock.unlock();
            }

            if (next == null) {
                close(CloseReason.OVERLOADED);
                return;
            }

            try {
                sink.deliver(next);
            } catch (Exception e) {
                log.warn("Delivery to subscriber {} failed, closing: {}", id, e.getMessage());
                close(CloseReason.DELIVERY_FAILED);
                return;
            }
        }
    }

    @Override
    public String toString() {
        return "Subscription[" + id + "]";
    }
}
