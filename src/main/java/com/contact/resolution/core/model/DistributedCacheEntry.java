package com.contact.resolution.core.model;

import java.time.Instant;

/**
 * Entry held by the shared distributed cache.
 *
 * @param key       the lookup key
 * @param mapping   the cached mapping, including its authoritative version
 * @param ttlExpiry instant after which the entry is no longer served
 */
public record DistributedCacheEntry(CacheKey key, CachedMapping mapping, Instant ttlExpiry) {

    public boolean isExpired(Instant now) {
        return ttlExpiry != null && !ttlExpiry.isAfter(now);
    }

    public String canonicalId() {
        return mapping.canonicalId();
    }

    public long version() {
        return mapping.version();
    }
}
