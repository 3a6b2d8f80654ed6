package com.geotracking.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket configuration for live tracking streams.
 *
 * Endpoints:
 * - /ws/tracking: WebSocket connection endpoint
 * - /app/ingest, /app/subscribe, /app/unsubscribe, /app/ping: client messages
 * - /user/queue/events: per-session stream of state deltas and alerts
 * - /user/queue/reply: acknowledgements
 *
 * Per-session delivery goes through the engine's fanout hub, which owns the
 * queueing and backpressure; the simple broker only relays.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${geotracking.websocket.endpoint:/ws/tracking}")
    private String websocketEndpoint;

    @Value("${geotracking.websocket.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins)
                .withSockJS();

        // native WebSocket clients
        registry.addEndpoint(websocketEndpoint)
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
