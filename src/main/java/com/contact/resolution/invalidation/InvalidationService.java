package com.contact.resolution.invalidation;

import com.contact.resolution.cache.DistributedCache;
import com.contact.resolution.cache.EdgeCache;
import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.rules.LookupKeyNormalizer;
import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Forces the next lookup of a key to go back to the system of record.
 *
 * <p>The authoritative record is marked invalidated first, then the distributed cache
 * and this node's edge cache are cleared. A replication run or background write-back
 * that races with the call fails to mark its copy replicated and withdraws it, so no
 * tier re-serves the old mapping once the call returns. If the store cannot be updated
 * the caches are left untouched. Edge caches on other nodes keep their copy until it
 * expires. Operator requests and drift remediation share this path.</p>
 */
public class InvalidationService {
    private static final Logger log = LoggerFactory.getLogger(InvalidationService.class);

    private static final String UNSPECIFIED = "unspecified";

    private final LookupKeyNormalizer normalizer;
    private final EdgeCache edgeCache;
    private final DistributedCache distributedCache;
    private final AuthoritativeStore store;
    private final MetricsService metrics;

    public InvalidationService(LookupKeyNormalizer normalizer, EdgeCache edgeCache,
                               DistributedCache distributedCache, AuthoritativeStore store,
                               MetricsService metrics) {
        this.normalizer = normalizer;
        this.edgeCache = edgeCache;
        this.distributedCache = distributedCache;
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Invalidates the mapping for a raw lookup value.
     *
     * @return the outcome; rejected without touching any tier if the value normalizes to nothing
     * @throws StorageException if the authoritative store cannot be updated
     * @throws com.contact.resolution.cache.TierUnavailableException if the distributed cache cannot be cleared
     */
    public InvalidationOutcome invalidate(LookupType type, String rawLookup, String reason) {
        CacheKey key = normalizer.normalize(type, rawLookup);
        String why = reason != null && !reason.isBlank() ? reason : UNSPECIFIED;
        if (key.isEmpty()) {
            log.warn("invalidate.rejected reason=empty_key type={} lookup={}", type.getPrefix(), rawLookup);
            return InvalidationOutcome.rejected(key, why);
        }
        try (LogContext ctx = LogContext.forInvalidation(LogContext.generateCorrelationId(), type.getPrefix())) {
            return invalidateKey(key, why);
        }
    }

    /**
     * Invalidates every key, live or not, that maps to a canonical id.
     *
     * @return one outcome per key found
     * @throws StorageException if the authoritative store cannot be read or updated
     */
    public List<InvalidationOutcome> invalidateCanonicalId(String canonicalId, String reason) {
        String why = reason != null && !reason.isBlank() ? reason : UNSPECIFIED;
        List<InvalidationOutcome> outcomes = new ArrayList<>();
        for (CacheRecord record : store.findByCanonicalId(canonicalId)) {
            try (LogContext ctx = LogContext.forInvalidation(LogContext.generateCorrelationId(),
                    record.getKey().type().getPrefix())) {
                outcomes.add(invalidateKey(record.getKey(), why));
            }
        }
        log.info("invalidate.canonical canonicalId={} keys={} reason={}", canonicalId, outcomes.size(), why);
        return outcomes;
    }

    private InvalidationOutcome invalidateKey(CacheKey key, String reason) {
        boolean existed;
        try {
            existed = store.invalidate(key, reason);
        } catch (StorageException e) {
            log.error("invalidate.store.failed key={} reason={} error={}", key, reason, e.getMessage());
            throw e;
        }
        distributedCache.evict(key);
        edgeCache.evict(key);
        metrics.incrementInvalidation(key.type());
        log.info("invalidate.completed key={} reason={} recordExisted={}", key, reason, existed);
        return new InvalidationOutcome(key, true, existed, reason);
    }
}
