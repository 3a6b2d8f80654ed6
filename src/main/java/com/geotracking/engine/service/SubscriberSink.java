package com.geotracking.engine.service;

import com.geotracking.engine.dto.TrackingEvent;
import com.geotracking.engine.model.CloseReason;

/**
 * Outbound side of one subscriber connection (a WebSocket session, an SSE stream, a recording sink in tests).
 *
 * Called from a fanout delivery thread, one event at a time per subscription.
 */
public interface SubscriberSink {

    /**
     * Delivers one event. Throwing closes the subscription.
     */
    void deliver(TrackingEvent event) throws Exception;

    /**
     * Called once when the subscription reaches {@code CLOSED}.
     */
    default void closed(CloseReason reason) {
    }
}
