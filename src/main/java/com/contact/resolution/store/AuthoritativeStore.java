package com.contact.resolution.store;

import com.contact.resolution.cache.CacheTier;
import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.core.model.ResolutionSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, versioned store of lookup records. The source of truth for every
 * cache tier in front of it.
 *
 * <p>Records are never deleted; invalidation is a soft mark that hides a record from
 * {@link #findValid(CacheKey)} until the next successful refresh. Failures surface as
 * {@link StorageException}; a record that violates its invariants surfaces as
 * {@link CorruptRecordException}.</p>
 */
public interface AuthoritativeStore extends CacheTier {

    /**
     * Returns the record for a key, including an invalidated one.
     */
    Optional<CacheRecord> find(CacheKey key);

    /**
     * Returns the record for a key unless it is invalidated.
     */
    default Optional<CacheRecord> findValid(CacheKey key) {
        return find(key).filter(record -> !record.isInvalidated());
    }

    /**
     * Creates or refreshes the record for a key.
     *
     * <p>Writers on the same key are serialized by compare-and-swap on the stored state
     * with bounded retries; once retries are exhausted the last writer wins.</p>
     */
    UpsertResult upsert(CacheKey key, String canonicalId, EntityMetadata metadata, RecordSource source);

    /**
     * Counts a hit served from a faster tier.
     *
     * @return false if no record exists
     */
    boolean recordHit(CacheKey key);

    /**
     * Marks the record invalidated and resets its replication pointers.
     *
     * @return false if no record exists
     */
    boolean invalidate(CacheKey key, String reason);

    /**
     * Returns live records whose distributed mirror is missing, behind or expired,
     * most recently verified first.
     */
    List<CacheRecord> findStaleForReplication(Instant now, int limit);

    /**
     * Records that {@code version} was written to the distributed cache.
     * Ignored for invalidated records or a version newer than the stored one.
     *
     * @return true if the pointers were updated
     */
    boolean markReplicated(CacheKey key, long version, Instant replicatedAt, Duration ttl);

    /**
     * Returns every record, live or invalidated, pointing at a canonical id.
     */
    List<CacheRecord> findByCanonicalId(String canonicalId);

    StoreStatistics statistics(Instant now);

    @Override
    default ResolutionSource source() {
        return ResolutionSource.AUTHORITATIVE;
    }

    @Override
    default Optional<CachedMapping> get(CacheKey key) {
        return findValid(key).map(CacheRecord::toMapping);
    }

    @Override
    default void put(CacheKey key, CachedMapping mapping) {
        upsert(key, mapping.canonicalId(), new EntityMetadata(mapping.entityId(), null), RecordSource.REPLICATED);
    }

    @Override
    default void evict(CacheKey key) {
        invalidate(key, "evicted");
    }
}
