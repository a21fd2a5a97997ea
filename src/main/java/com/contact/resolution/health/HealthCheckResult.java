package com.contact.resolution.health;

import java.time.Instant;

/**
 * Outcome of one named check within a {@link HealthSnapshot}.
 */
public record HealthCheckResult(String name, HealthStatus status, Instant checkedAt) {
}
