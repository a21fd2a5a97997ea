package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory {@link AuthoritativeStore} for single-node deployments and tests.
 *
 * <p>Compare-and-swap is {@link ConcurrentHashMap#putIfAbsent} for new keys and
 * {@link ConcurrentHashMap#replace(Object, Object, Object)} for existing ones.</p>
 */
public class InMemoryAuthoritativeStore implements AuthoritativeStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAuthoritativeStore.class);

    private final ConcurrentHashMap<CacheKey, CacheRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ConflictRetryPolicy retryPolicy;

    public InMemoryAuthoritativeStore() {
        this(Clock.systemUTC(), ConflictRetryPolicy.defaults());
    }

    public InMemoryAuthoritativeStore(Clock clock) {
        this(clock, ConflictRetryPolicy.defaults());
    }

    public InMemoryAuthoritativeStore(Clock clock, ConflictRetryPolicy retryPolicy) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
    }

    @Override
    public Optional<CacheRecord> find(CacheKey key) {
        requireKey(key);
        return Optional.ofNullable(records.get(key)).map(RecordVersioning::requireValid);
    }

    @Override
    public UpsertResult upsert(CacheKey key, String canonicalId, EntityMetadata metadata, RecordSource source) {
        requireKey(key);
        EntityMetadata meta = metadata != null ? metadata : EntityMetadata.empty();

        for (int attempt = 1; attempt <= retryPolicy.maxRetries(); attempt++) {
            CacheRecord current = records.get(key);
            UpsertResult result = RecordVersioning.next(current, key, canonicalId, meta, source, clock.instant());
            boolean swapped = current == null
                    ? records.putIfAbsent(key, result.record()) == null
                    : records.replace(key, current, result.record());
            if (swapped) {
                log.debug("store.upsert key={} outcome={} version={}",
                        key, result.outcome(), result.record().getVersion());
                return result;
            }
            log.debug("store.upsert.conflict key={} attempt={}", key, attempt);
            if (!retryPolicy.pause(attempt)) {
                break;
            }
        }

        AtomicReference<UpsertResult> written = new AtomicReference<>();
        records.compute(key, (k, current) -> {
            UpsertResult result = RecordVersioning.next(current, k, canonicalId, meta, source, clock.instant());
            written.set(result);
            return result.record();
        });
        log.warn("store.upsert.last_writer_wins key={} version={}", key, written.get().record().getVersion());
        return written.get();
    }

    @Override
    public boolean recordHit(CacheKey key) {
        requireKey(key);
        Instant now = clock.instant();
        CacheRecord updated = records.computeIfPresent(key, (k, record) -> {
            CacheRecord.Builder builder = record.toBuilder()
                    .hitCount(record.getHitCount() + 1)
                    .lastUsedAt(now);
            if (!record.isInvalidated()) {
                builder.lastVerifiedAt(now);
            }
            return builder.build();
        });
        return updated != null;
    }

    @Override
    public boolean invalidate(CacheKey key, String reason) {
        requireKey(key);
        Instant now = clock.instant();
        CacheRecord updated = records.computeIfPresent(key, (k, record) -> record.toBuilder()
                .invalidatedAt(now)
                .clearReplication()
                .build());
        if (updated != null) {
            log.debug("store.invalidate key={} reason={}", key, reason);
        }
        return updated != null;
    }

    @Override
    public List<CacheRecord> findStaleForReplication(Instant now, int limit) {
        return records.values().stream()
                .filter(record -> !record.isInvalidated())
                .filter(record -> record.isMirrorStale(now))
                .sorted(Comparator.comparing(CacheRecord::getLastVerifiedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public boolean markReplicated(CacheKey key, long version, Instant replicatedAt, Duration ttl) {
        requireKey(key);
        AtomicBoolean marked = new AtomicBoolean(false);
        records.computeIfPresent(key, (k, record) -> {
            if (record.isInvalidated() || version > record.getVersion()) {
                return record;
            }
            marked.set(true);
            return record.toBuilder()
                    .replicatedVersion(version)
                    .replicatedAt(replicatedAt)
                    .replicatedTtl(ttl)
                    .replicatedExpiresAt(replicatedAt.plus(ttl))
                    .build();
        });
        return marked.get();
    }

    @Override
    public List<CacheRecord> findByCanonicalId(String canonicalId) {
        return records.values().stream()
                .filter(record -> record.getCanonicalId().equals(canonicalId))
                .toList();
    }

    @Override
    public StoreStatistics statistics(Instant now) {
        long total = 0;
        long invalidated = 0;
        long missingEntityId = 0;
        long staleMirror = 0;
        for (CacheRecord record : records.values()) {
            total++;
            if (record.isInvalidated()) {
                invalidated++;
                continue;
            }
            if (!record.hasEntityId()) {
                missingEntityId++;
            }
            if (record.isMirrorStale(now)) {
                staleMirror++;
            }
        }
        return new StoreStatistics(total, total - invalidated, invalidated, missingEntityId, staleMirror);
    }

    public int size() {
        return records.size();
    }

    private static void requireKey(CacheKey key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("A non-empty key is required");
        }
    }
}
