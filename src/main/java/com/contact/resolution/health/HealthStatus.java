package com.contact.resolution.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a single check or of the system as a whole, with a message and
 * arbitrary detail key-value pairs. Statuses are ordered from best to worst.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { OK, WARNING, CRITICAL }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus ok() {
        return new HealthStatus(Status.OK, "OK", Map.of());
    }

    public static HealthStatus ok(String message) {
        return new HealthStatus(Status.OK, message, Map.of());
    }

    public static HealthStatus warning(String reason) {
        return new HealthStatus(Status.WARNING, reason, Map.of());
    }

    public static HealthStatus critical(String reason) {
        return new HealthStatus(Status.CRITICAL, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isDegraded() {
        return status != Status.OK;
    }

    public boolean isCritical() {
        return status == Status.CRITICAL;
    }

    /**
     * Returns the worse of two statuses.
     */
    public static Status worst(Status a, Status b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
