package com.geotracking.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration.
 *
 * - Swagger UI: /swagger-ui.html
 * - OpenAPI JSON: /api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI geoTrackingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Geofence Tracking & Alert API")
                        .description("Real-time device tracking with geofence containment and alerting.\n\n" +
                                "## Features\n\n" +
                                "- **Location ingest** - ordered, de-duplicated pings per device\n" +
                                "- **Hysteresis containment** - enter/exit alerts without boundary flapping\n" +
                                "- **Alert cool-down** - repeated alerts suppressed within a window\n" +
                                "- **Offline detection** - periodic staleness sweep\n" +
                                "- **Live streams** - per-subscriber queues with coalescing backpressure\n\n" +
                                "## WebSocket Endpoints\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/tracking`\n\n" +
                                "- `/app/ingest` - Send a location ping\n" +
                                "- `/app/subscribe` - Open a live subscription for this session\n" +
                                "- `/app/unsubscribe` - Close it\n" +
                                "- `/app/ping` - Heartbeat\n" +
                                "- `/user/queue/events` - Receive state deltas and alerts")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
