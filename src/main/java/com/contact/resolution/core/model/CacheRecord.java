package com.contact.resolution.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative record mapping a lookup key to its canonical entity.
 *
 * <p>Records are immutable; every mutation produces a new instance through
 * {@link #toBuilder()}. The {@code replicated*} fields track what the distributed
 * cache mirror currently holds for this key.</p>
 */
public final class CacheRecord {
    private final CacheKey key;
    private final String canonicalId;
    private final String entityId;
    private final String displayName;
    private final long version;
    private final RecordSource source;
    private final Instant cachedAt;
    private final Instant lastVerifiedAt;
    private final Instant lastUsedAt;
    private final long hitCount;
    private final Instant invalidatedAt;
    private final long replicatedVersion;
    private final Instant replicatedAt;
    private final Duration replicatedTtl;
    private final Instant replicatedExpiresAt;

    private CacheRecord(Builder builder) {
        this.key = builder.key;
        this.canonicalId = builder.canonicalId;
        this.entityId = builder.entityId;
        this.displayName = builder.displayName;
        this.version = builder.version;
        this.source = builder.source != null ? builder.source : RecordSource.SYSTEM_OF_RECORD;
        this.cachedAt = builder.cachedAt;
        this.lastVerifiedAt = builder.lastVerifiedAt != null ? builder.lastVerifiedAt : builder.cachedAt;
        this.lastUsedAt = builder.lastUsedAt;
        this.hitCount = builder.hitCount;
        this.invalidatedAt = builder.invalidatedAt;
        this.replicatedVersion = builder.replicatedVersion;
        this.replicatedAt = builder.replicatedAt;
        this.replicatedTtl = builder.replicatedTtl;
        this.replicatedExpiresAt = builder.replicatedExpiresAt;
    }

    public CacheKey getKey() {
        return key;
    }

    public String getCanonicalId() {
        return canonicalId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getVersion() {
        return version;
    }

    public RecordSource getSource() {
        return source;
    }

    public Instant getCachedAt() {
        return cachedAt;
    }

    public Instant getLastVerifiedAt() {
        return lastVerifiedAt;
    }

    public Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public long getHitCount() {
        return hitCount;
    }

    public Instant getInvalidatedAt() {
        return invalidatedAt;
    }

    public long getReplicatedVersion() {
        return replicatedVersion;
    }

    public Instant getReplicatedAt() {
        return replicatedAt;
    }

    public Duration getReplicatedTtl() {
        return replicatedTtl;
    }

    public Instant getReplicatedExpiresAt() {
        return replicatedExpiresAt;
    }

    public boolean isInvalidated() {
        return invalidatedAt != null;
    }

    public boolean hasEntityId() {
        return entityId != null && !entityId.isBlank();
    }

    /**
     * Returns true if the distributed cache mirror for this record is missing,
     * behind the record's version, or past its propagated TTL.
     */
    public boolean isMirrorStale(Instant now) {
        return replicatedVersion < version
                || replicatedAt == null
                || replicatedExpiresAt == null
                || replicatedExpiresAt.isBefore(now);
    }

    /**
     * Returns the value cache tiers hold for this record.
     */
    public CachedMapping toMapping() {
        return new CachedMapping(canonicalId, entityId, version);
    }

    public Builder toBuilder() {
        return new Builder()
                .key(key)
                .canonicalId(canonicalId)
                .entityId(entityId)
                .displayName(displayName)
                .version(version)
                .source(source)
                .cachedAt(cachedAt)
                .lastVerifiedAt(lastVerifiedAt)
                .lastUsedAt(lastUsedAt)
                .hitCount(hitCount)
                .invalidatedAt(invalidatedAt)
                .replicatedVersion(replicatedVersion)
                .replicatedAt(replicatedAt)
                .replicatedTtl(replicatedTtl)
                .replicatedExpiresAt(replicatedExpiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheRecord that = (CacheRecord) o;
        return version == that.version
                && hitCount == that.hitCount
                && replicatedVersion == that.replicatedVersion
                && Objects.equals(key, that.key)
                && Objects.equals(canonicalId, that.canonicalId)
                && Objects.equals(entityId, that.entityId)
                && Objects.equals(displayName, that.displayName)
                && source == that.source
                && Objects.equals(cachedAt, that.cachedAt)
                && Objects.equals(lastVerifiedAt, that.lastVerifiedAt)
                && Objects.equals(lastUsedAt, that.lastUsedAt)
                && Objects.equals(invalidatedAt, that.invalidatedAt)
                && Objects.equals(replicatedAt, that.replicatedAt)
                && Objects.equals(replicatedTtl, that.replicatedTtl)
                && Objects.equals(replicatedExpiresAt, that.replicatedExpiresAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, canonicalId, version, hitCount, invalidatedAt, replicatedVersion);
    }

    @Override
    public String toString() {
        return "CacheRecord{" +
                "key=" + key +
                ", canonicalId='" + canonicalId + '\'' +
                ", version=" + version +
                ", source=" + source +
                ", hitCount=" + hitCount +
                ", invalidatedAt=" + invalidatedAt +
                ", replicatedVersion=" + replicatedVersion +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CacheKey key;
        private String canonicalId;
        private String entityId;
        private String displayName;
        private long version = 1;
        private RecordSource source;
        private Instant cachedAt;
        private Instant lastVerifiedAt;
        private Instant lastUsedAt;
        private long hitCount;
        private Instant invalidatedAt;
        private long replicatedVersion;
        private Instant replicatedAt;
        private Duration replicatedTtl;
        private Instant replicatedExpiresAt;

        public Builder key(CacheKey key) {
            this.key = key;
            return this;
        }

        public Builder canonicalId(String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder source(RecordSource source) {
            this.source = source;
            return this;
        }

        public Builder cachedAt(Instant cachedAt) {
            this.cachedAt = cachedAt;
            return this;
        }

        public Builder lastVerifiedAt(Instant lastVerifiedAt) {
            this.lastVerifiedAt = lastVerifiedAt;
            return this;
        }

        public Builder lastUsedAt(Instant lastUsedAt) {
            this.lastUsedAt = lastUsedAt;
            return this;
        }

        public Builder hitCount(long hitCount) {
            this.hitCount = hitCount;
            return this;
        }

        public Builder invalidatedAt(Instant invalidatedAt) {
            this.invalidatedAt = invalidatedAt;
            return this;
        }

        public Builder replicatedVersion(long replicatedVersion) {
            this.replicatedVersion = replicatedVersion;
            return this;
        }

        public Builder replicatedAt(Instant replicatedAt) {
            this.replicatedAt = replicatedAt;
            return this;
        }

        public Builder replicatedTtl(Duration replicatedTtl) {
            this.replicatedTtl = replicatedTtl;
            return this;
        }

        public Builder replicatedExpiresAt(Instant replicatedExpiresAt) {
            this.replicatedExpiresAt = replicatedExpiresAt;
            return this;
        }

        /**
         * Clears the replication pointers so the record reads as never mirrored.
         */
        public Builder clearReplication() {
            this.replicatedVersion = 0;
            this.replicatedAt = null;
            this.replicatedTtl = null;
            this.replicatedExpiresAt = null;
            return this;
        }

        public CacheRecord build() {
            Objects.requireNonNull(key, "key is required");
            Objects.requireNonNull(canonicalId, "canonicalId is required");
            Objects.requireNonNull(cachedAt, "cachedAt is required");
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Cannot build a record for an empty key");
            }
            return new CacheRecord(this);
        }
    }
}
