package com.contact.resolution.cache;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.DistributedCacheEntry;
import com.contact.resolution.core.model.ResolutionSource;

import java.time.Duration;
import java.util.Optional;

/**
 * Medium-TTL cache shared by every node.
 *
 * <p>An entry's version never exceeds the authoritative version for the same key:
 * the tier is only ever written with versions read from the authoritative store,
 * and a write carrying an older version than the one held is ignored.</p>
 */
public interface DistributedCache extends CacheTier {

    /**
     * TTL applied by {@link #put(CacheKey, CachedMapping)}.
     */
    Duration defaultTtl();

    /**
     * Stores a mapping with an explicit TTL.
     *
     * @throws TierUnavailableException if the cache cannot be reached
     */
    void put(CacheKey key, CachedMapping mapping, Duration ttl);

    /**
     * Returns the full entry, including its expiry, or empty if absent or expired.
     *
     * @throws TierUnavailableException if the cache cannot be reached
     */
    Optional<DistributedCacheEntry> getEntry(CacheKey key);

    @Override
    default ResolutionSource source() {
        return ResolutionSource.DISTRIBUTED;
    }

    @Override
    default Optional<CachedMapping> get(CacheKey key) {
        return getEntry(key).map(DistributedCacheEntry::mapping);
    }

    @Override
    default void put(CacheKey key, CachedMapping mapping) {
        put(key, mapping, defaultTtl());
    }
}
