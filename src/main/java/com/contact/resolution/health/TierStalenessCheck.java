package com.contact.resolution.health;

import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.StoreStatistics;

import java.time.Clock;
import java.util.Locale;

/**
 * Fraction of live records whose distributed cache mirror is missing, behind or expired.
 */
public class TierStalenessCheck implements HealthCheck {

    private final AuthoritativeStore store;
    private final DriftConfig config;
    private final Clock clock;

    public TierStalenessCheck(AuthoritativeStore store, DriftConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "tier-staleness";
    }

    @Override
    public HealthStatus check() {
        StoreStatistics stats = store.statistics(clock.instant());
        double ratio = stats.staleMirrorRatio();
        String message = String.format(Locale.ROOT, "%d of %d records have a stale distributed mirror (%.1f%%)",
                stats.staleMirror(), stats.active(), ratio * 100);
        HealthStatus status;
        if (ratio > config.stalenessCriticalRatio()) {
            status = HealthStatus.critical(message);
        } else if (ratio > config.stalenessWarningRatio()) {
            status = HealthStatus.warning(message);
        } else {
            status = HealthStatus.ok(message);
        }
        return status
                .withDetail("active", stats.active())
                .withDetail("stale", stats.staleMirror())
                .withDetail("ratio", ratio);
    }
}
