package com.contact.resolution.health;

import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.StoreStatistics;

import java.time.Clock;
import java.util.Locale;

/**
 * Fraction of live records that never got a secondary entity id from the system of record.
 */
public class IdentityCoverageCheck implements HealthCheck {

    private final AuthoritativeStore store;
    private final DriftConfig config;
    private final Clock clock;

    public IdentityCoverageCheck(AuthoritativeStore store, DriftConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "identity-coverage";
    }

    @Override
    public HealthStatus check() {
        StoreStatistics stats = store.statistics(clock.instant());
        double ratio = stats.missingEntityIdRatio();
        HealthStatus status;
        if (stats.missingEntityId() == 0) {
            status = HealthStatus.ok("All records carry an entity id");
        } else {
            String message = String.format(Locale.ROOT, "%d records missing an entity id (%.1f%%)",
                    stats.missingEntityId(), ratio * 100);
            status = ratio >= config.coverageCriticalRatio()
                    ? HealthStatus.critical(message)
                    : HealthStatus.warning(message);
        }
        return status
                .withDetail("active", stats.active())
                .withDetail("missing", stats.missingEntityId())
                .withDetail("ratio", ratio);
    }
}
