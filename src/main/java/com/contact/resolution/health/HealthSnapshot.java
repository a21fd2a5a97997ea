package com.contact.resolution.health;

import java.time.Instant;
import java.util.List;

/**
 * Result of one monitor run: every check, the aggregate status and performance counters.
 *
 * @param status      worst status among the checks
 * @param checks      individual check results in registration order
 * @param performance counters at the time of the run, null if they could not be collected
 * @param recordedAt  when the run completed
 */
public record HealthSnapshot(
        HealthStatus.Status status,
        List<HealthCheckResult> checks,
        PerformanceSnapshot performance,
        Instant recordedAt
) {

    public HealthSnapshot {
        checks = checks != null ? List.copyOf(checks) : List.of();
    }

    public List<HealthCheckResult> degraded() {
        return checks.stream().filter(result -> result.status().isDegraded()).toList();
    }
}
