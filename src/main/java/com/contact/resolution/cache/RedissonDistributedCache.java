package com.contact.resolution.cache;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.DistributedCacheEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed {@link DistributedCache} using Redisson buckets.
 *
 * <p>Each key is stored as a JSON document under {@code contact:<type>:<value>} with a
 * Redis-side TTL. The version guard on write is read-then-write and therefore best
 * effort; concurrent writers converge once the replication job republishes the
 * authoritative version.</p>
 */
public class RedissonDistributedCache implements DistributedCache {
    private static final Logger log = LoggerFactory.getLogger(RedissonDistributedCache.class);

    static final String KEY_PREFIX = "contact";

    private final RedissonClient redisson;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultTtl;

    public RedissonDistributedCache(RedissonClient redisson, Duration defaultTtl) {
        this(redisson, new ObjectMapper(), Clock.systemUTC(), defaultTtl);
    }

    public RedissonDistributedCache(RedissonClient redisson, ObjectMapper objectMapper,
                                    Clock clock, Duration defaultTtl) {
        this.redisson = redisson;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public void put(CacheKey key, CachedMapping mapping, Duration ttl) {
        RBucket<String> bucket = bucket(key);
        Instant now = clock.instant();
        try {
            Optional<CachePayload> current = decode(key, bucket.get());
            if (current.isPresent() && current.get().version() > mapping.version()) {
                log.debug("distributed.put.skipped key={} heldVersion={} offeredVersion={}",
                        key, current.get().version(), mapping.version());
                return;
            }
            CachePayload payload = new CachePayload(mapping.canonicalId(), mapping.entityId(),
                    mapping.version(), now.toEpochMilli(), now.plus(ttl).toEpochMilli());
            bucket.set(objectMapper.writeValueAsString(payload), ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RedisException e) {
            throw new TierUnavailableException("distributed", "Redis write failed for " + key, e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode cache payload for " + key, e);
        }
    }

    @Override
    public Optional<DistributedCacheEntry> getEntry(CacheKey key) {
        try {
            return decode(key, bucket(key).get())
                    .map(payload -> new DistributedCacheEntry(key,
                            new CachedMapping(payload.canonicalId(), payload.entityId(), payload.version()),
                            Instant.ofEpochMilli(payload.expiresAt())))
                    .filter(entry -> !entry.isExpired(clock.instant()));
        } catch (RedisException e) {
            throw new TierUnavailableException("distributed", "Redis read failed for " + key, e);
        }
    }

    @Override
    public void evict(CacheKey key) {
        try {
            bucket(key).delete();
        } catch (RedisException e) {
            throw new TierUnavailableException("distributed", "Redis delete failed for " + key, e);
        }
    }

    static String redisKey(CacheKey key) {
        return KEY_PREFIX + ":" + key.asString();
    }

    private RBucket<String> bucket(CacheKey key) {
        return redisson.getBucket(redisKey(key), StringCodec.INSTANCE);
    }

    private Optional<CachePayload> decode(CacheKey key, String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            CachePayload payload = objectMapper.readValue(json, CachePayload.class);
            if (payload.canonicalId() == null || payload.version() < 1) {
                log.warn("distributed.payload.invalid key={} payload={}", key, json);
                return Optional.empty();
            }
            return Optional.of(payload);
        } catch (JsonProcessingException e) {
            log.warn("distributed.payload.unreadable key={} error={}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CachePayload(
            String canonicalId,
            String entityId,
            long version,
            long cachedAt,
            long expiresAt
    ) {}
}
