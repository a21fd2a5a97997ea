package com.contact.resolution.source;

import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.SourceEdit;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpSystemOfRecord")
class HttpSystemOfRecordTest {

    private HttpServer server;
    private HttpSystemOfRecord source;
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/lookups/phone", exchange -> {
            capture(exchange);
            if (exchange.getRequestURI().getQuery().contains("13365185544")) {
                respond(exchange, 200, "{\"canonicalId\":\"entity-123\",\"extra\":true}");
            } else {
                respond(exchange, 404, "");
            }
        });
        server.createContext("/api/lookups/email", exchange -> {
            capture(exchange);
            respond(exchange, 503, "{\"error\":\"down\"}");
        });
        server.createContext("/api/entities", exchange -> {
            capture(exchange);
            String path = exchange.getRequestURI().getPath();
            if (path.endsWith("/recent")) {
                respond(exchange, 200, "{\"results\":["
                        + "{\"canonicalId\":\"entity-1\",\"lastEditedAt\":\"2024-03-01T10:00:00Z\"},"
                        + "{\"canonicalId\":\"entity-2\",\"lastEditedAt\":\"yesterday\"},"
                        + "{\"canonicalId\":null,\"lastEditedAt\":\"2024-03-01T10:00:00Z\"}]}");
            } else if (path.endsWith("/entity-123")) {
                respond(exchange, 200, "{\"entityId\":\"m-77\",\"displayName\":\"Ada Lovelace\"}");
            } else if (path.endsWith("/garbled")) {
                respond(exchange, 200, "{not json");
            } else {
                respond(exchange, 404, "");
            }
        });
        server.start();
        source = HttpSystemOfRecord.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/api/")
                .apiToken("secret-token")
                .timeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void capture(HttpExchange exchange) {
        lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
        lastQuery.set(exchange.getRequestURI().getRawQuery());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Returns the canonical id and sends the bearer token")
        void phoneHit() {
            assertEquals(Optional.of("entity-123"), source.lookupByPhone("+13365185544"));
            assertEquals("Bearer secret-token", lastAuthorization.get());
            assertEquals("value=%2B13365185544", lastQuery.get());
        }

        @Test
        @DisplayName("404 is a miss")
        void notFound() {
            assertTrue(source.lookupByPhone("+15550000000").isEmpty());
        }

        @Test
        @DisplayName("Server errors surface as SystemOfRecordException")
        void serverError() {
            SystemOfRecordException e = assertThrows(SystemOfRecordException.class,
                    () -> source.lookupByEmail("foo@bar.com"));
            assertTrue(e.getMessage().contains("503"));
        }

        @Test
        @DisplayName("Connection failures surface as SystemOfRecordException")
        void connectionRefused() throws IOException {
            int closedPort;
            try (ServerSocket socket = new ServerSocket(0)) {
                closedPort = socket.getLocalPort();
            }
            SystemOfRecord unreachable = HttpSystemOfRecord.builder()
                    .baseUrl("http://127.0.0.1:" + closedPort)
                    .timeout(Duration.ofSeconds(1))
                    .build();

            assertThrows(SystemOfRecordException.class, () -> unreachable.lookupByPhone("+13365185544"));
        }
    }

    @Nested
    @DisplayName("Metadata and recent edits")
    class MetadataTests {

        @Test
        @DisplayName("Reads entity metadata")
        void metadata() {
            assertEquals(new EntityMetadata("m-77", "Ada Lovelace"), source.getEntityMetadata("entity-123"));
        }

        @Test
        @DisplayName("Unknown entity yields empty metadata")
        void unknownEntity() {
            assertEquals(EntityMetadata.empty(), source.getEntityMetadata("entity-404"));
        }

        @Test
        @DisplayName("Unreadable body surfaces as SystemOfRecordException")
        void unreadableBody() {
            assertThrows(SystemOfRecordException.class, () -> source.getEntityMetadata("garbled"));
        }

        @Test
        @DisplayName("Skips recent entries it cannot parse")
        void recentSkipsBadEntries() {
            List<SourceEdit> edits = source.recentlyEdited(10);

            assertEquals(List.of(new SourceEdit("entity-1", Instant.parse("2024-03-01T10:00:00Z"))), edits);
            assertEquals("limit=10", lastQuery.get());
        }
    }

    @Test
    @DisplayName("Name carries the base URL without a trailing slash")
    void name() {
        assertEquals("http:http://127.0.0.1:" + server.getAddress().getPort() + "/api", source.getName());
    }
}
