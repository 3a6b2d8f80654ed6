package com.geotracking.engine.service;

import java.util.Collection;
import java.util.Set;

/**
 * Device predicate a subscription is opened with.
 *
 * The engine never decides who may see what; the identity layer hands it a
 * filter (typically the set of devices an account owns) and the hub only
 * applies it.
 */
@FunctionalInterface
public interface SubscriberFilter {

    boolean matches(String deviceId);

    static SubscriberFilter allDevices() {
        return deviceId -> true;
    }

    static SubscriberFilter devices(Collection<String> deviceIds) {
        Set<String> allowed = Set.copyOf(deviceIds);
        return allowed::contains;
    }
}
