package com.geotracking.engine.service;

import com.geotracking.engine.dto.DeviceSnapshot;
import com.geotracking.engine.dto.DeviceStateDelta;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Opens and closes live subscriptions.
 *
 * A new subscription is registered with the hub first and then primed with
 * the current state of every matching device, each taken under that
 * device's lock. Anything published in between is at worst delivered twice,
 * never out of order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final FanoutHub fanoutHub;
    private final DeviceStateStore deviceStateStore;
    private final ContainmentTracker containmentTracker;

    public Subscription subscribe(SubscriberFilter filter, SubscriberSink sink) {
        Subscription subscription = fanoutHub.register(filter, sink);

        int primed = 0;
        for (DeviceSnapshot device : deviceStateStore.snapshot()) {
            if (!filter.matches(device.deviceId())) {
                continue;
            }
            deviceStateStore.withKnownDevice(device.deviceId(), state -> {
                DeviceStateDelta delta = DeviceStateDelta.of(state.toSnapshot(),
                    containmentTracker.insideGeofenceIds(state.getDeviceId()));
                fanoutHub.publishInitialState(subscription, delta);
                return delta;
            });
            primed++;
        }
        log.debug("Subscription {} primed with {} devices", subscription.getId(), primed);
        return subscription;
    }

    public boolean unsubscribe(String subscriptionId) {
        return fanoutHub.unsubscribe(subscriptionId);
    }
}
