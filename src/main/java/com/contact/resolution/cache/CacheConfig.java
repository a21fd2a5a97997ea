package com.contact.resolution.cache;

import java.time.Duration;

/**
 * Configuration for the node-local edge cache.
 *
 * @param maxSize maximum number of entries
 * @param ttl     time-to-live for each entry
 * @param enabled whether the edge tier is consulted at all
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default edge configuration: 10,000 entries, 1 hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofHours(1), true);
    }

    /**
     * Disabled edge configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
