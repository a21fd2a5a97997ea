package com.contact.resolution.cache;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.DistributedCacheEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link DistributedCache} for single-node deployments and tests.
 * Expiry is evaluated lazily against the supplied clock.
 */
public class InMemoryDistributedCache implements DistributedCache {

    private final ConcurrentMap<CacheKey, DistributedCacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    public InMemoryDistributedCache() {
        this(Clock.systemUTC(), Duration.ofHours(6));
    }

    public InMemoryDistributedCache(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public void put(CacheKey key, CachedMapping mapping, Duration ttl) {
        Instant now = clock.instant();
        DistributedCacheEntry incoming = new DistributedCacheEntry(key, mapping, now.plus(ttl));
        entries.merge(key, incoming, (current, next) ->
                current.isExpired(now) || next.version() >= current.version() ? next : current);
    }

    @Override
    public Optional<DistributedCacheEntry> getEntry(CacheKey key) {
        DistributedCacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void evict(CacheKey key) {
        entries.remove(key);
    }

    /**
     * Number of entries held, including ones that have expired but not yet been read.
     */
    public int size() {
        return entries.size();
    }
}
