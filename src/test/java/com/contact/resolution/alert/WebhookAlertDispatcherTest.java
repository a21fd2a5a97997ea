package com.contact.resolution.alert;

import com.contact.resolution.health.HealthStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Alert dispatch")
class WebhookAlertDispatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Nested
    @DisplayName("Webhook")
    class WebhookTests {

        private HttpServer server;
        private final AtomicReference<String> received = new AtomicReference<>();
        private final AtomicInteger status = new AtomicInteger(200);

        @BeforeEach
        void setUp() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/hook", exchange -> {
                try (InputStream in = exchange.getRequestBody()) {
                    received.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                }
                exchange.sendResponseHeaders(status.get(), -1);
                exchange.close();
            });
            server.start();
        }

        @AfterEach
        void tearDown() {
            server.stop(0);
        }

        private WebhookAlertDispatcher dispatcher() {
            return new WebhookAlertDispatcher(
                    "http://127.0.0.1:" + server.getAddress().getPort() + "/hook", Duration.ofSeconds(2));
        }

        @Test
        @DisplayName("Posts the summary as a mrkdwn section")
        void postsPayload() throws Exception {
            dispatcher().send(AlertSeverity.CRITICAL, "- source-drift: 7 of 10 out of sync",
                    Map.of("ratio", 0.7));

            JsonNode payload = objectMapper.readTree(received.get());
            assertEquals(":rotating_light: *CRITICAL* contact resolution health", payload.get("text").asText());
            assertEquals("- source-drift: 7 of 10 out of sync",
                    payload.get("blocks").get(0).get("text").get("text").asText());
            assertEquals(0.7, payload.get("details").get("ratio").asDouble(), 1e-9);
        }

        @Test
        @DisplayName("Non-2xx responses raise AlertDispatchException")
        void non2xx() {
            status.set(500);

            AlertDispatchException e = assertThrows(AlertDispatchException.class,
                    () -> dispatcher().send(AlertSeverity.WARNING, "summary", Map.of()));
            assertTrue(e.getMessage().contains("500"));
        }
    }

    @Test
    @DisplayName("Warnings use the warning icon and tolerate null details")
    void warningEncoding() throws Exception {
        WebhookAlertDispatcher dispatcher = new WebhookAlertDispatcher("http://localhost/hook");

        JsonNode payload = objectMapper.readTree(dispatcher.encode(AlertSeverity.WARNING, "summary", null));

        assertTrue(payload.get("text").asText().startsWith(":warning: *WARNING*"));
        assertTrue(payload.get("details").isEmpty());
    }

    @Test
    @DisplayName("Severity maps from degraded health statuses only")
    void severityFromStatus() {
        assertEquals(AlertSeverity.WARNING, AlertSeverity.from(HealthStatus.Status.WARNING));
        assertEquals(AlertSeverity.CRITICAL, AlertSeverity.from(HealthStatus.Status.CRITICAL));
        assertThrows(IllegalArgumentException.class, () -> AlertSeverity.from(HealthStatus.Status.OK));
    }
}
