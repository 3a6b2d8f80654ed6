package com.geotracking.engine.model;

/**
 * Lifecycle of a live subscription: {@code CONNECTED -> DRAINING -> CLOSED}.
 */
public enum SubscriptionState {
    CONNECTED,
    DRAINING,
    CLOSED
}
