package com.contact.resolution.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks that can be run together.
 *
 * <p>Aggregation logic:</p>
 * <ul>
 *   <li>Any CRITICAL check → overall status is CRITICAL</li>
 *   <li>Any WARNING check (and none CRITICAL) → overall status is WARNING</li>
 *   <li>All OK → overall status is OK</li>
 * </ul>
 * A check that throws is reported as WARNING, since its state could not be verified.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public HealthCheckRegistry() {
        this(Clock.systemUTC());
    }

    public HealthCheckRegistry(Clock clock) {
        this.clock = clock;
    }

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    /**
     * Runs every registered check in registration order.
     */
    public List<HealthCheckResult> runAll() {
        List<HealthCheckResult> results = new ArrayList<>(checks.size());
        for (HealthCheck check : checks) {
            HealthStatus status;
            try {
                status = check.check();
            } catch (RuntimeException e) {
                log.warn("health.check.failed name={} error={}", check.getName(), e.getMessage(), e);
                status = HealthStatus.warning("Unable to verify: " + e.getMessage())
                        .withDetail("error", e.getClass().getSimpleName());
            }
            results.add(new HealthCheckResult(check.getName(), status, clock.instant()));
        }
        return results;
    }

    /**
     * Returns the worst status among results; OK when there are none.
     */
    public static HealthStatus.Status aggregate(List<HealthCheckResult> results) {
        HealthStatus.Status worst = HealthStatus.Status.OK;
        for (HealthCheckResult result : results) {
            worst = HealthStatus.worst(worst, result.status().status());
        }
        return worst;
    }

    public int size() {
        return checks.size();
    }
}
