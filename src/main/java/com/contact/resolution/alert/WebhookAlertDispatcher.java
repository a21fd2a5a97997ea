package com.contact.resolution.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Posts alerts to a chat webhook as Slack-compatible JSON.
 *
 * <pre>
 * {
 *   "text": ":rotating_light: *CRITICAL* contact resolution health",
 *   "blocks": [ { "type": "section", "text": { "type": "mrkdwn", "text": "..." } } ],
 *   "details": { ... }
 * }
 * </pre>
 */
public class WebhookAlertDispatcher implements AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WebhookAlertDispatcher.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI webhookUri;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookAlertDispatcher(String webhookUrl) {
        this(webhookUrl, DEFAULT_TIMEOUT);
    }

    public WebhookAlertDispatcher(String webhookUrl, Duration timeout) {
        Objects.requireNonNull(webhookUrl, "webhookUrl is required");
        this.webhookUri = URI.create(webhookUrl);
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void send(AlertSeverity severity, String summary, Map<String, Object> details) {
        String body = encode(severity, summary, details);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(webhookUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new AlertDispatchException("Webhook returned status " + response.statusCode());
            }
            log.info("alert.sent severity={} host={}", severity, webhookUri.getHost());
        } catch (IOException e) {
            throw new AlertDispatchException("Webhook call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDispatchException("Interrupted sending alert", e);
        }
    }

    String encode(AlertSeverity severity, String summary, Map<String, Object> details) {
        String icon = severity == AlertSeverity.CRITICAL ? ":rotating_light:" : ":warning:";
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", icon + " *" + severity + "* contact resolution health");
        payload.put("blocks", List.of(Map.of(
                "type", "section",
                "text", Map.of("type", "mrkdwn", "text", summary))));
        payload.put("details", details != null ? details : Map.of());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AlertDispatchException("Cannot encode alert payload: " + e.getOriginalMessage(), e);
        }
    }
}
