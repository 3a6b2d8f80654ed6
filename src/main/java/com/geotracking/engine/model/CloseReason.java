package com.geotracking.engine.model;

public enum CloseReason {
    UNSUBSCRIBED,
    /** An alert could not be queued; the subscriber has to resynchronize. */
    OVERLOADED,
    DELIVERY_FAILED,
    SHUTDOWN
}
