package com.geotracking.engine.service;

import com.geotracking.engine.config.TrackingProperties;
import com.geotracking.engine.dto.DeviceStateDelta;
import com.geotracking.engine.dto.TrackingEvent;
import com.geotracking.engine.model.CloseReason;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Registry of live subscriptions and the publish side of the event stream.
 *
 * {@link #publish(TrackingEvent)} only offers to bounded per-subscriber
 * queues and returns; delivery happens on the fanout executor. Callers
 * publish while holding the device lock, which is what gives every
 * subscriber per-device ordering.
 */
@Component
@Slf4j
public class FanoutHub {

    private final Executor deliveryExecutor;
    private final int queueCapacity;
    private final ConcurrentMap<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public FanoutHub(@Qualifier("fanoutExecutor") Executor deliveryExecutor, TrackingProperties properties) {
        this.deliveryExecutor = deliveryExecutor;
        this.queueCapacity = properties.getFanout().getQueueCapacity();
    }

    public Subscription register(SubscriberFilter filter, SubscriberSink sink) {
        String id = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(id, filter, sink, queueCapacity, deliveryExecutor,
            closed -> subscriptions.remove(closed.getId(), closed));
        subscriptions.put(id, subscription);
        log.info("Subscription {} connected ({} active)", id, subscriptions.size());
        return subscription;
    }

    /**
     * @return false if no such subscription was open
     */
    public boolean unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            return false;
        }
        subscription.close(CloseReason.UNSUBSCRIBED);
        return true;
    }

    public void publish(TrackingEvent event) {
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.matches(event)) {
                subscription.offer(event);
            }
        }
    }

    /**
     * Queues a resynchronization snapshot for one subscription only.
     */
    void publishInitialState(Subscription subscription, DeviceStateDelta delta) {
        if (subscription.matches(delta)) {
            subscription.offerInitialState(delta);
        }
    }

    public Optional<Subscription> find(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    public int activeCount() {
        return subscriptions.size();
    }

    @PreDestroy
    public void shutdown() {
        List<Subscription> open = List.copyOf(subscriptions.values());
        open.forEach(subscription -> subscription.close(CloseReason.SHUTDOWN));
        if (!open.isEmpty()) {
            log.info("Closed {} subscriptions on shutdown", open.size());
        }
    }
}
