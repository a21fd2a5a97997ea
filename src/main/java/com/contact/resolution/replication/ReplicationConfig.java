package com.contact.resolution.replication;

import java.time.Duration;

/**
 * Configuration for the {@link ReplicationJob}.
 *
 * @param batchSize maximum rows propagated per run
 * @param ttl       TTL applied to distributed cache entries
 * @param interval  delay between runs
 */
public record ReplicationConfig(int batchSize, Duration ttl, Duration interval) {

    public ReplicationConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }

    /**
     * Default configuration: 200 rows, 6h TTL, every 5 minutes.
     */
    public static ReplicationConfig defaults() {
        return new ReplicationConfig(200, Duration.ofHours(6), Duration.ofMinutes(5));
    }
}
