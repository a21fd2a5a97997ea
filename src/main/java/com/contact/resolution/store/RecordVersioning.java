package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.RecordSource;

import java.time.Instant;

/**
 * Computes the next state of a record for an upsert.
 *
 * <p>The version starts at 1 and increments only when the canonical id differs from
 * the id currently stored. Confirming the same id refreshes verification metadata
 * and clears any invalidation mark without touching the version.</p>
 *
 * <p>Stores call this inside their compare-and-swap loop; it has no side effects.</p>
 */
public final class RecordVersioning {

    private RecordVersioning() {
    }

    /**
     * @param current     the stored record, or null if none exists
     * @param key         the record key
     * @param canonicalId the canonical id being written
     * @param metadata    entity metadata from the system of record, never null
     * @param source      where the write originated
     * @param now         the write time
     * @return the record to store and what changed
     * @throws CorruptRecordException if {@code current} carries a version below 1
     */
    public static UpsertResult next(CacheRecord current, CacheKey key, String canonicalId,
                                    EntityMetadata metadata, RecordSource source, Instant now) {
        if (canonicalId == null || canonicalId.isBlank()) {
            throw new IllegalArgumentException("canonicalId must not be blank");
        }
        if (current == null) {
            CacheRecord created = CacheRecord.builder()
                    .key(key)
                    .canonicalId(canonicalId)
                    .entityId(metadata.entityId())
                    .displayName(metadata.displayName())
                    .version(1)
                    .source(source)
                    .cachedAt(now)
                    .lastVerifiedAt(now)
                    .lastUsedAt(now)
                    .hitCount(1)
                    .build();
            return new UpsertResult(created, UpsertOutcome.CREATED);
        }

        requireValid(current);

        if (!current.getCanonicalId().equals(canonicalId)) {
            CacheRecord bumped = current.toBuilder()
                    .canonicalId(canonicalId)
                    .entityId(metadata.entityId())
                    .displayName(metadata.displayName())
                    .version(current.getVersion() + 1)
                    .source(source)
                    .lastVerifiedAt(now)
                    .lastUsedAt(now)
                    .hitCount(current.getHitCount() + 1)
                    .invalidatedAt(null)
                    .build();
            return new UpsertResult(bumped, UpsertOutcome.VERSION_BUMPED);
        }

        CacheRecord.Builder confirmed = current.toBuilder()
                .lastVerifiedAt(now)
                .lastUsedAt(now)
                .hitCount(current.getHitCount() + 1)
                .invalidatedAt(null);
        // keep what we know when the source had nothing to add
        if (metadata.hasEntityId()) {
            confirmed.entityId(metadata.entityId());
        }
        if (metadata.displayName() != null) {
            confirmed.displayName(metadata.displayName());
        }
        UpsertOutcome outcome = current.isInvalidated() ? UpsertOutcome.REFRESHED : UpsertOutcome.UNCHANGED;
        return new UpsertResult(confirmed.build(), outcome);
    }

    /**
     * Rejects records that no writer could have produced.
     *
     * @throws CorruptRecordException if the record is invalid
     */
    public static CacheRecord requireValid(CacheRecord record) {
        if (record.getVersion() < 1) {
            throw new CorruptRecordException(record.getKey(), "version " + record.getVersion() + " < 1");
        }
        if (record.getCanonicalId().isBlank()) {
            throw new CorruptRecordException(record.getKey(), "blank canonicalId");
        }
        return record;
    }
}
