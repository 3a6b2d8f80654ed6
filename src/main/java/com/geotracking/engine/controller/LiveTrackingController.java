package com.geotracking.engine.controller;

import com.geotracking.engine.dto.IngestResult;
import com.geotracking.engine.dto.LocationPingRecord;
import com.geotracking.engine.dto.SubscribeRequest;
import com.geotracking.engine.model.SubscriptionState;
import com.geotracking.engine.service.LocationIngestService;
import com.geotracking.engine.service.SubscriberFilter;
import com.geotracking.engine.service.Subscription;
import com.geotracking.engine.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket controller for live tracking.
 *
 * Message Flow:
 * 1. Devices may send pings to /app/ingest (same pipeline as REST)
 * 2. Viewers send /app/subscribe with a device list (or all=true)
 * 3. Current state of each matching device is sent first, then live
 *    deltas and alerts, all on /user/queue/events
 * 4. /app/unsubscribe or a disconnect ends the stream
 *
 * Usage:
 * - Connect to: ws://localhost:8080/ws/tracking
 * - Subscribe to: /user/queue/events, /user/queue/reply
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class LiveTrackingController {

    private final SubscriptionService subscriptionService;
    private final LocationIngestService ingestService;
    private final SimpMessagingTemplate messagingTemplate;

    // STOMP session id -> subscription id
    private final Map<String, String> sessionSubscriptions = new ConcurrentHashMap<>();

    @MessageMapping("/ingest")
    @SendToUser("/queue/reply")
    public IngestResult handlePing(@Payload LocationPingRecord ping) {
        return ingestService.ingest(ping);
    }

    @MessageMapping("/subscribe")
    @SendToUser("/queue/reply")
    public Map<String, Object> handleSubscribe(@Payload SubscribeRequest request,
                                               @Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        if (request == null || request.isEmpty()) {
            return Map.of("status", "ERROR", "message", "deviceIds or all=true required");
        }

        // one stream per session; a new request replaces the old filter
        String previous = sessionSubscriptions.remove(sessionId);
        if (previous != null) {
            subscriptionService.unsubscribe(previous);
        }

        SubscriberFilter filter = request.all()
            ? SubscriberFilter.allDevices()
            : SubscriberFilter.devices(request.deviceIds());
        StompSubscriberSink sink = new StompSubscriberSink(messagingTemplate, sessionId,
            closedId -> sessionSubscriptions.remove(sessionId, closedId));
        Subscription subscription = subscriptionService.subscribe(filter, sink);
        sessionSubscriptions.put(sessionId, subscription.getId());
        sink.bind(subscription.getId());
        // closed by the hub before it was bound, e.g. while priming
        if (subscription.getState() == SubscriptionState.CLOSED) {
            sessionSubscriptions.remove(sessionId, subscription.getId());
        }

        log.info("Session {} subscribed as {} ({})", sessionId, subscription.getId(),
            request.all() ? "all devices" : request.deviceIds().size() + " devices");
        return Map.of(
            "status", "SUBSCRIBED",
            "subscriptionId", subscription.getId(),
            "timestamp", Instant.now().toString()
        );
    }

    @MessageMapping("/unsubscribe")
    @SendToUser("/queue/reply")
    public Map<String, Object> handleUnsubscribe(@Header(SimpMessageHeaderAccessor.SESSION_ID_HEADER) String sessionId) {
        String subscriptionId = sessionSubscriptions.remove(sessionId);
        boolean removed = subscriptionId != null && subscriptionService.unsubscribe(subscriptionId);
        return Map.of("status", removed ? "UNSUBSCRIBED" : "NOT_SUBSCRIBED");
    }

    @MessageMapping("/ping")
    @SendToUser("/queue/reply")
    public Map<String, Object> handleHeartbeat() {
        return Map.of(
            "type", "PONG",
            "serverTime", Instant.now().toString(),
            "status", "OK"
        );
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        String subscriptionId = sessionSubscriptions.remove(event.getSessionId());
        if (subscriptionId != null) {
            subscriptionService.unsubscribe(subscriptionId);
            log.debug("Session {} disconnected, subscription {} closed", event.getSessionId(), subscriptionId);
        }
    }

    int activeSessions() {
        return sessionSubscriptions.size();
    }
}
