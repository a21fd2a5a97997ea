package com.contact.resolution.source;

import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.SourceEdit;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SystemOfRecord} client for a JSON REST endpoint.
 *
 * <p>Endpoints, relative to the base URL:</p>
 * <ul>
 *   <li>{@code GET /lookups/phone?value=...} and {@code GET /lookups/email?value=...} answer
 *       {@code {"canonicalId": "..."}}, or 404 when unknown</li>
 *   <li>{@code GET /entities/{canonicalId}} answers {@code {"entityId": "...", "displayName": "..."}}</li>
 *   <li>{@code GET /entities/recent?limit=N} answers
 *       {@code {"results": [{"canonicalId": "...", "lastEditedAt": "2024-01-01T00:00:00Z"}]}}</li>
 * </ul>
 *
 * <pre>
 * SystemOfRecord source = HttpSystemOfRecord.builder()
 *     .baseUrl("https://crm.internal/api")
 *     .apiToken(token)
 *     .timeout(Duration.ofSeconds(5))
 *     .build();
 * </pre>
 */
public class HttpSystemOfRecord implements SystemOfRecord {
    private static final Logger log = LoggerFactory.getLogger(HttpSystemOfRecord.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final String baseUrl;
    private final String apiToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpSystemOfRecord(Builder builder) {
        Objects.requireNonNull(builder.baseUrl, "baseUrl is required");
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.apiToken = builder.apiToken;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Optional<String> lookupByPhone(String normalizedPhone) {
        return lookup("phone", normalizedPhone);
    }

    @Override
    public Optional<String> lookupByEmail(String normalizedEmail) {
        return lookup("email", normalizedEmail);
    }

    private Optional<String> lookup(String type, String value) {
        HttpResponse<String> response = get("/lookups/" + type + "?value=" + encode(value));
        if (response.statusCode() == 404) {
            log.debug("sor.lookup.miss type={} value={}", type, value);
            return Optional.empty();
        }
        LookupResponse body = read(response, LookupResponse.class);
        if (body.canonicalId() == null || body.canonicalId().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(body.canonicalId());
    }

    @Override
    public EntityMetadata getEntityMetadata(String canonicalId) {
        HttpResponse<String> response = get("/entities/" + encode(canonicalId));
        if (response.statusCode() == 404) {
            return EntityMetadata.empty();
        }
        MetadataResponse body = read(response, MetadataResponse.class);
        return new EntityMetadata(body.entityId(), body.displayName());
    }

    @Override
    public List<SourceEdit> recentlyEdited(int limit) {
        HttpResponse<String> response = get("/entities/recent?limit=" + limit);
        RecentResponse body = read(response, RecentResponse.class);
        List<SourceEdit> edits = new ArrayList<>();
        if (body.results() == null) {
            return edits;
        }
        for (RecentEntry entry : body.results()) {
            if (entry.canonicalId() == null || entry.lastEditedAt() == null) {
                log.debug("sor.recent.entry.skipped entry={}", entry);
                continue;
            }
            try {
                edits.add(new SourceEdit(entry.canonicalId(), Instant.parse(entry.lastEditedAt())));
            } catch (DateTimeParseException e) {
                log.warn("sor.recent.entry.unparseable canonicalId={} lastEditedAt={}",
                        entry.canonicalId(), entry.lastEditedAt());
            }
        }
        return edits;
    }

    @Override
    public String getName() {
        return "http:" + baseUrl;
    }

    private HttpResponse<String> get(String path) {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET();
        if (apiToken != null && !apiToken.isBlank()) {
            request.header("Authorization", "Bearer " + apiToken);
        }
        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status != 404 && (status < 200 || status >= 300)) {
                throw new SystemOfRecordException("System of record returned status " + status + " for " + path);
            }
            return response;
        } catch (IOException e) {
            throw new SystemOfRecordException("System of record call failed for " + path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemOfRecordException("Interrupted calling system of record for " + path, e);
        }
    }

    private <T> T read(HttpResponse<String> response, Class<T> type) {
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new SystemOfRecordException("Unreadable system of record response: " + e.getMessage(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String apiToken;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpSystemOfRecord build() {
            return new HttpSystemOfRecord(this);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record LookupResponse(String canonicalId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MetadataResponse(String entityId, String displayName) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RecentEntry(String canonicalId, String lastEditedAt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RecentResponse(List<RecentEntry> results) {}
}
