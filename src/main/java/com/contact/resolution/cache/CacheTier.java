package com.contact.resolution.cache;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.ResolutionSource;

import java.util.Optional;

/**
 * A storage tier that can answer lookups for normalized keys.
 *
 * <p>Implementations range from the node-local edge cache to the durable authoritative
 * store; the resolver consults them in latency order and writes back through the
 * faster ones. Transient failures surface as {@link TierUnavailableException} so the
 * caller can fall through to the next tier.</p>
 */
public interface CacheTier {

    /**
     * Returns the source label reported when this tier answers a lookup.
     */
    ResolutionSource source();

    /**
     * Looks up the mapping for a key.
     *
     * @param key a non-empty normalized key
     * @return the mapping, or empty on a miss
     * @throws TierUnavailableException if the tier cannot be reached
     */
    Optional<CachedMapping> get(CacheKey key);

    /**
     * Stores a mapping. A mapping older than the one already held is ignored.
     *
     * @throws TierUnavailableException if the tier cannot be reached
     */
    void put(CacheKey key, CachedMapping mapping);

    /**
     * Removes the mapping for a key.
     *
     * @throws TierUnavailableException if the tier cannot be reached
     */
    void evict(CacheKey key);
}
