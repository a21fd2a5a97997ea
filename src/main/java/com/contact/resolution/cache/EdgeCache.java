package com.contact.resolution.cache;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.ResolutionSource;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed, node-local edge tier.
 *
 * <p>Best effort only: entries may be stale by up to the configured TTL and are never
 * treated as authoritative. A disabled cache answers every lookup with a miss.</p>
 */
public class EdgeCache implements CacheTier {
    private static final Logger log = LoggerFactory.getLogger(EdgeCache.class);

    private final Cache<CacheKey, CachedMapping> cache;
    private final boolean enabled;

    public EdgeCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public EdgeCache(CacheConfig config, Ticker ticker) {
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("EdgeCache initialized: enabled={}, maxSize={}, ttl={}",
                config.enabled(), config.maxSize(), config.ttl());
    }

    @Override
    public ResolutionSource source() {
        return ResolutionSource.EDGE;
    }

    @Override
    public Optional<CachedMapping> get(CacheKey key) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, CachedMapping mapping) {
        if (!enabled) {
            return;
        }
        cache.asMap().merge(key, mapping,
                (current, incoming) -> incoming.version() >= current.version() ? incoming : current);
    }

    @Override
    public void evict(CacheKey key) {
        cache.invalidate(key);
    }

    /**
     * Invalidates all edge entries.
     */
    public void evictAll() {
        cache.invalidateAll();
        log.debug("edge.evictAll");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
