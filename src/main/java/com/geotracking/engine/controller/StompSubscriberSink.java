package com.geotracking.engine.controller;

import com.geotracking.engine.dto.TrackingEvent;
import com.geotracking.engine.model.CloseReason;
import com.geotracking.engine.service.SubscriberSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Delivers fanout events to one STOMP session on {@code /user/queue/events}.
 */
@Slf4j
class StompSubscriberSink implements SubscriberSink {

    static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final String sessionId;
    private final Consumer<String> onClosed;
    private volatile String subscriptionId;

    /**
     * @param onClosed receives the bound subscription id once the hub closes it
     */
    StompSubscriberSink(SimpMessagingTemplate messagingTemplate, String sessionId, Consumer<String> onClosed) {
        this.messagingTemplate = messagingTemplate;
        this.sessionId = sessionId;
        this.onClosed = onClosed;
    }

    void bind(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    @Override
    public void deliver(TrackingEvent event) {
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, event, sessionHeaders());
    }

    @Override
    public void closed(CloseReason reason) {
        String closedId = subscriptionId;
        if (closedId != null) {
            onClosed.accept(closedId);
        }
        if (reason == CloseReason.UNSUBSCRIBED || reason == CloseReason.DELIVERY_FAILED) {
            return;
        }
        log.info("Closing live stream for session {}: {}", sessionId, reason);
        try {
            messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, Map.of(
                "type", "CLOSED",
                "reason", reason.name(),
                "timestamp", Instant.now().toString()
            ), sessionHeaders());
        } catch (RuntimeException e) {
            log.debug("Could not notify session {} of close: {}", sessionId, e.getMessage());
        }
    }

    private MessageHeaders sessionHeaders() {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
