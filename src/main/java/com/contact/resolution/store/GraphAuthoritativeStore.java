package com.contact.resolution.store;

import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link AuthoritativeStore} backed by FalkorDB {@code :LookupRecord} nodes.
 *
 * <p>Timestamps are stored as epoch milliseconds. A new key is claimed with
 * {@code MERGE ... ON CREATE SET}, tagging the node with a per-call token so the
 * caller can tell whether it created the node or lost the race. Existing records are
 * updated with a conditional {@code MATCH ... WHERE} on the state that was read
 * (version, canonical id and hit count); no matched row means another writer got
 * there first.</p>
 */
public class GraphAuthoritativeStore implements AuthoritativeStore {
    private static final Logger log = LoggerFactory.getLogger(GraphAuthoritativeStore.class);

    private static final String RETURN_RECORD = """
            RETURN r.key AS key, r.canonicalId AS canonicalId, r.entityId AS entityId,
                   r.displayName AS displayName, r.version AS version, r.source AS source,
                   r.cachedAt AS cachedAt, r.lastVerifiedAt AS lastVerifiedAt, r.lastUsedAt AS lastUsedAt,
                   r.hitCount AS hitCount, r.invalidatedAt AS invalidatedAt,
                   r.replicatedVersion AS replicatedVersion, r.replicatedAt AS replicatedAt,
                   r.replicatedTtlMs AS replicatedTtlMs, r.replicatedExpiresAt AS replicatedExpiresAt
            """;

    private static final String SET_STATE = """
            r.canonicalId = $canonicalId, r.entityId = $entityId, r.displayName = $displayName,
            r.version = $version, r.source = $source, r.lookupType = $lookupType,
            r.cachedAt = $cachedAt, r.lastVerifiedAt = $lastVerifiedAt, r.lastUsedAt = $lastUsedAt,
            r.hitCount = $hitCount, r.invalidatedAt = $invalidatedAt,
            r.replicatedVersion = $replicatedVersion, r.replicatedAt = $replicatedAt,
            r.replicatedTtlMs = $replicatedTtlMs, r.replicatedExpiresAt = $replicatedExpiresAt
            """;

    private final GraphConnection connection;
    private final Clock clock;
    private final ConflictRetryPolicy retryPolicy;

    public GraphAuthoritativeStore(GraphConnection connection) {
        this(connection, Clock.systemUTC(), ConflictRetryPolicy.defaults());
    }

    public GraphAuthoritativeStore(GraphConnection connection, Clock clock, ConflictRetryPolicy retryPolicy) {
        this.connection = connection;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Optional<CacheRecord> find(CacheKey key) {
        requireKey(key);
        List<Map<String, Object>> rows = query("find", "MATCH (r:LookupRecord {key: $key})\n" + RETURN_RECORD,
                Map.of("key", key.asString()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(RecordVersioning.requireValid(mapToRecord(rows.get(0))));
    }

    @Override
    public UpsertResult upsert(CacheKey key, String canonicalId, EntityMetadata metadata, RecordSource source) {
        requireKey(key);
        EntityMetadata meta = metadata != null ? metadata : EntityMetadata.empty();

        for (int attempt = 1; attempt <= retryPolicy.maxRetries(); attempt++) {
            CacheRecord current = find(key).orElse(null);
            UpsertResult result = RecordVersioning.next(current, key, canonicalId, meta, source, clock.instant());
            boolean written = current == null ? tryCreate(result.record()) : tryReplace(current, result.record());
            if (written) {
                log.debug("store.upsert key={} outcome={} version={}",
                        key, result.outcome(), result.record().getVersion());
                return result;
            }
            log.debug("store.upsert.conflict key={} attempt={}", key, attempt);
            if (!retryPolicy.pause(attempt)) {
                break;
            }
        }

        CacheRecord current = find(key).orElse(null);
        UpsertResult result = RecordVersioning.next(current, key, canonicalId, meta, source, clock.instant());
        Map<String, Object> params = stateParams(result.record());
        execute("upsert", "MERGE (r:LookupRecord {key: $key})\nSET\n" + SET_STATE, params);
        log.warn("store.upsert.last_writer_wins key={} version={}", key, result.record().getVersion());
        return result;
    }

    private boolean tryCreate(CacheRecord record) {
        Map<String, Object> params = stateParams(record);
        String token = UUID.randomUUID().toString();
        params.put("token", token);
        List<Map<String, Object>> rows = query("create", """
                MERGE (r:LookupRecord {key: $key})
                ON CREATE SET r.createdBy = $token,
                """ + SET_STATE + """
                RETURN r.createdBy = $token AS created
                """, params);
        return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0).get("created"));
    }

    private boolean tryReplace(CacheRecord expected, CacheRecord next) {
        Map<String, Object> params = stateParams(next);
        params.put("expectedVersion", expected.getVersion());
        params.put("expectedCanonicalId", expected.getCanonicalId());
        params.put("expectedHitCount", expected.getHitCount());
        List<Map<String, Object>> rows = query("replace", """
                MATCH (r:LookupRecord {key: $key})
                WHERE r.version = $expectedVersion
                  AND r.canonicalId = $expectedCanonicalId
                  AND r.hitCount = $expectedHitCount
                SET
                """ + SET_STATE + """
                RETURN r.version AS version
                """, params);
        return !rows.isEmpty();
    }

    @Override
    public boolean recordHit(CacheKey key) {
        requireKey(key);
        List<Map<String, Object>> rows = query("recordHit", """
                MATCH (r:LookupRecord {key: $key})
                SET r.hitCount = coalesce(r.hitCount, 0) + 1,
                    r.lastUsedAt = $now,
                    r.lastVerifiedAt = CASE WHEN r.invalidatedAt IS NULL THEN $now ELSE r.lastVerifiedAt END
                RETURN r.key AS key
                """, Map.of("key", key.asString(), "now", clock.millis()));
        return !rows.isEmpty();
    }

    @Override
    public boolean invalidate(CacheKey key, String reason) {
        requireKey(key);
        List<Map<String, Object>> rows = query("invalidate", """
                MATCH (r:LookupRecord {key: $key})
                SET r.invalidatedAt = $now,
                    r.invalidationReason = $reason,
                    r.replicatedVersion = 0,
                    r.replicatedAt = null,
                    r.replicatedTtlMs = null,
                    r.replicatedExpiresAt = null
                RETURN r.key AS key
                """, Map.of("key", key.asString(), "now", clock.millis(),
                        "reason", reason != null ? reason : "unspecified"));
        if (!rows.isEmpty()) {
            log.debug("store.invalidate key={} reason={}", key, reason);
        }
        return !rows.isEmpty();
    }

    @Override
    public List<CacheRecord> findStaleForReplication(Instant now, int limit) {
        List<Map<String, Object>> rows = query("findStale", """
                MATCH (r:LookupRecord)
                WHERE r.invalidatedAt IS NULL
                  AND (r.replicatedVersion IS NULL OR r.replicatedVersion < r.version
                       OR r.replicatedAt IS NULL OR r.replicatedExpiresAt IS NULL
                       OR r.replicatedExpiresAt < $now)
                """ + RETURN_RECORD + """
                ORDER BY lastVerifiedAt DESC
                LIMIT $limit
                """, Map.of("now", now.toEpochMilli(), "limit", limit));
        return rows.stream().map(this::mapToRecord).toList();
    }

    @Override
    public boolean markReplicated(CacheKey key, long version, Instant replicatedAt, Duration ttl) {
        requireKey(key);
        List<Map<String, Object>> rows = query("markReplicated", """
                MATCH (r:LookupRecord {key: $key})
                WHERE r.invalidatedAt IS NULL AND r.version >= $replicatedVersion
                SET r.replicatedVersion = $replicatedVersion,
                    r.replicatedAt = $replicatedAt,
                    r.replicatedTtlMs = $replicatedTtlMs,
                    r.replicatedExpiresAt = $replicatedExpiresAt
                RETURN r.key AS key
                """, Map.of(
                        "key", key.asString(),
                        "replicatedVersion", version,
                        "replicatedAt", replicatedAt.toEpochMilli(),
                        "replicatedTtlMs", ttl.toMillis(),
                        "replicatedExpiresAt", replicatedAt.plus(ttl).toEpochMilli()));
        return !rows.isEmpty();
    }

    @Override
    public List<CacheRecord> findByCanonicalId(String canonicalId) {
        List<Map<String, Object>> rows = query("findByCanonicalId",
                "MATCH (r:LookupRecord {canonicalId: $canonicalId})\n" + RETURN_RECORD,
                Map.of("canonicalId", canonicalId));
        return rows.stream().map(this::mapToRecord).toList();
    }

    @Override
    public StoreStatistics statistics(Instant now) {
        List<Map<String, Object>> rows = query("statistics", """
                MATCH (r:LookupRecord)
                RETURN count(r) AS total,
                       sum(CASE WHEN r.invalidatedAt IS NULL THEN 1 ELSE 0 END) AS active,
                       sum(CASE WHEN r.invalidatedAt IS NOT NULL THEN 1 ELSE 0 END) AS invalidated,
                       sum(CASE WHEN r.invalidatedAt IS NULL
                                 AND (r.entityId IS NULL OR trim(r.entityId) = '') THEN 1 ELSE 0 END) AS missingEntityId,
                       sum(CASE WHEN r.invalidatedAt IS NULL
                                 AND (r.replicatedExpiresAt IS NULL OR r.replicatedExpiresAt < $now
                                      OR r.replicatedVersion < r.version) THEN 1 ELSE 0 END) AS staleMirror
                """, Map.of("now", now.toEpochMilli()));
        if (rows.isEmpty()) {
            return StoreStatistics.empty();
        }
        Map<String, Object> row = rows.get(0);
        return new StoreStatistics(toLong(row.get("total")), toLong(row.get("active")),
                toLong(row.get("invalidated")), toLong(row.get("missingEntityId")),
                toLong(row.get("staleMirror")));
    }

    private Map<String, Object> stateParams(CacheRecord record) {
        Map<String, Object> params = new HashMap<>();
        params.put("key", record.getKey().asString());
        params.put("lookupType", record.getKey().type().getPrefix());
        params.put("canonicalId", record.getCanonicalId());
        params.put("entityId", record.getEntityId());
        params.put("displayName", record.getDisplayName());
        params.put("version", record.getVersion());
        params.put("source", record.getSource().name());
        params.put("cachedAt", toMillis(record.getCachedAt()));
        params.put("lastVerifiedAt", toMillis(record.getLastVerifiedAt()));
        params.put("lastUsedAt", toMillis(record.getLastUsedAt()));
        params.put("hitCount", record.getHitCount());
        params.put("invalidatedAt", toMillis(record.getInvalidatedAt()));
        params.put("replicatedVersion", record.getReplicatedVersion());
        params.put("replicatedAt", toMillis(record.getReplicatedAt()));
        params.put("replicatedTtlMs", record.getReplicatedTtl() != null ? record.getReplicatedTtl().toMillis() : null);
        params.put("replicatedExpiresAt", toMillis(record.getReplicatedExpiresAt()));
        return params;
    }

    private CacheRecord mapToRecord(Map<String, Object> row) {
        Object ttl = row.get("replicatedTtlMs");
        Object source = row.get("source");
        return CacheRecord.builder()
                .key(CacheKey.parse((String) row.get("key")))
                .canonicalId((String) row.get("canonicalId"))
                .entityId((String) row.get("entityId"))
                .displayName((String) row.get("displayName"))
                .version(toLong(row.get("version")))
                .source(source != null ? RecordSource.valueOf((String) source) : RecordSource.SYSTEM_OF_RECORD)
                .cachedAt(toInstant(row.get("cachedAt")))
                .lastVerifiedAt(toInstant(row.get("lastVerifiedAt")))
                .lastUsedAt(toInstant(row.get("lastUsedAt")))
                .hitCount(toLong(row.get("hitCount")))
                .invalidatedAt(toInstant(row.get("invalidatedAt")))
                .replicatedVersion(toLong(row.get("replicatedVersion")))
                .replicatedAt(toInstant(row.get("replicatedAt")))
                .replicatedTtl(ttl instanceof Number n ? Duration.ofMillis(n.longValue()) : null)
                .replicatedExpiresAt(toInstant(row.get("replicatedExpiresAt")))
                .build();
    }

    private List<Map<String, Object>> query(String operation, String cypher, Map<String, Object> params) {
        try {
            return connection.query(cypher, params);
        } catch (RuntimeException e) {
            throw new StorageException("Graph " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private void execute(String operation, String cypher, Map<String, Object> params) {
        try {
            connection.execute(cypher, params);
        } catch (RuntimeException e) {
            throw new StorageException("Graph " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant toInstant(Object value) {
        return value instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : null;
    }

    private static long toLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    private static void requireKey(CacheKey key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("A non-empty key is required");
        }
    }
}
