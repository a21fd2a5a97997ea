package com.contact.resolution.api;

import com.contact.resolution.cache.CacheTier;
import com.contact.resolution.cache.DistributedCache;
import com.contact.resolution.cache.EdgeCache;
import com.contact.resolution.cache.TierUnavailableException;
import com.contact.resolution.core.model.CacheKey;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.core.model.CachedMapping;
import com.contact.resolution.core.model.EntityMetadata;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.RecordSource;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.rules.LookupKeyNormalizer;
import com.contact.resolution.source.SystemOfRecord;
import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.CorruptRecordException;
import com.contact.resolution.store.StorageException;
import com.contact.resolution.store.UpsertResult;
import com.contact.resolution.task.BackgroundTaskSupervisor;
import com.contact.resolution.tracing.Span;
import com.contact.resolution.tracing.TracingService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Resolves a phone number or email address to a canonical entity id by consulting
 * the tiers in latency order: edge cache, distributed cache, authoritative store,
 * then the system of record.
 *
 * <p>A hit in a slower tier is written back to the faster ones. The edge write happens
 * inline; everything else (distributed write-back, replication pointers, hit counting)
 * runs on the {@link BackgroundTaskSupervisor} and never delays the answer.</p>
 *
 * <p>Failure handling:</p>
 * <ul>
 *   <li>a tier that throws {@link TierUnavailableException} or {@link StorageException}
 *       is skipped and the next tier consulted</li>
 *   <li>a system of record call that fails or exceeds {@link ResolutionOptions#getSorTimeout()}
 *       is a miss</li>
 *   <li>a {@link CorruptRecordException} is the only exception that leaves {@link #resolve}</li>
 * </ul>
 *
 * <p>The resolver remembers the highest version it has surfaced per key and never returns
 * a cached mapping with a lower one; the lagging entry is evicted and the lookup falls
 * through. A system of record answer that could not be stored carries that highest
 * version, or 0 if none was surfaced. Misses are not cached.</p>
 */
public class TierResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TierResolver.class);

    private final LookupKeyNormalizer normalizer;
    private final EdgeCache edgeCache;
    private final DistributedCache distributedCache;
    private final AuthoritativeStore store;
    private final SystemOfRecord systemOfRecord;
    private final BackgroundTaskSupervisor supervisor;
    private final ResolutionOptions options;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final ExecutorService sorExecutor;
    private final Cache<CacheKey, Long> versionWatermarks;

    private final Map<ResolutionSource, LongAdder> resolutionCounts = new EnumMap<>(ResolutionSource.class);
    private final LongAdder tierFailures = new LongAdder();
    private final LongAdder laggingDiscarded = new LongAdder();
    private final LongAdder sorTimeouts = new LongAdder();
    private final LongAdder sorFailures = new LongAdder();

    public TierResolver(LookupKeyNormalizer normalizer, EdgeCache edgeCache, DistributedCache distributedCache,
                        AuthoritativeStore store, SystemOfRecord systemOfRecord,
                        BackgroundTaskSupervisor supervisor, ResolutionOptions options,
                        MetricsService metrics, TracingService tracing, Clock clock) {
        this.normalizer = normalizer;
        this.edgeCache = edgeCache;
        this.distributedCache = distributedCache;
        this.store = store;
        this.systemOfRecord = systemOfRecord;
        this.supervisor = supervisor;
        this.options = options;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
        this.sorExecutor = Executors.newFixedThreadPool(options.getSorThreads(),
                BackgroundTaskSupervisor.namedThreads("contact-sor"));
        this.versionWatermarks = Caffeine.newBuilder()
                .maximumSize(options.getVersionWatermarkSize())
                .build();
        for (ResolutionSource source : ResolutionSource.values()) {
            resolutionCounts.put(source, new LongAdder());
        }
    }

    /**
     * Resolves a raw lookup value.
     *
     * @param rawLookup raw phone number or email address, may be null
     * @param type      the lookup type
     * @return the result; {@link ResolutionResult#miss()} if nothing is known
     * @throws CorruptRecordException if the authoritative store holds an invalid record
     */
    public ResolutionResult resolve(String rawLookup, LookupType type) {
        long startNanos = System.nanoTime();
        CacheKey key = normalizer.normalize(type, rawLookup);
        if (key.isEmpty()) {
            log.debug("resolve.skipped reason=empty_key type={}", type.getPrefix());
            return complete(type, ResolutionResult.miss(), startNanos);
        }

        try (LogContext ctx = LogContext.forResolution(LogContext.generateCorrelationId(), type.getPrefix());
             Span span = tracing.startSpan("contact.resolve", Map.of("lookup.type", type.getPrefix()))) {
            try {
                ResolutionResult result = resolveKey(key, span);
                span.setAttribute("resolution.source", result.source().getLabel());
                span.setAttribute("resolution.version", result.version());
                span.setStatus(Span.SpanStatus.OK);
                return complete(type, result, startNanos);
            } catch (CorruptRecordException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("resolve.corrupt_record key={} error={}", key, e.getMessage());
                throw e;
            }
        }
    }

    private ResolutionResult resolveKey(CacheKey key, Span span) {
        Optional<CachedMapping> edgeHit = readCached(edgeCache, key, span);
        if (edgeHit.isPresent()) {
            countHitInBackground(key);
            return surface(key, edgeHit.get(), ResolutionSource.EDGE);
        }

        Optional<CachedMapping> distributedHit = readCached(distributedCache, key, span);
        if (distributedHit.isPresent()) {
            writeEdge(key, distributedHit.get());
            countHitInBackground(key);
            return surface(key, distributedHit.get(), ResolutionSource.DISTRIBUTED);
        }

        Optional<CacheRecord> record = readAuthoritative(key, span);
        if (record.isPresent()) {
            CachedMapping mapping = record.get().toMapping();
            writeEdgeIfCurrent(key, mapping);
            propagateInBackground(key, mapping);
            countHitInBackground(key);
            return surface(key, mapping, ResolutionSource.AUTHORITATIVE);
        }

        return resolveFromSystemOfRecord(key, span);
    }

    private ResolutionResult resolveFromSystemOfRecord(CacheKey key, Span span) {
        span.addEvent("sor.lookup");
        Optional<String> canonicalId = callSystemOfRecord("lookup", key, () -> switch (key.type()) {
            case PHONE -> systemOfRecord.lookupByPhone(key.normalizedValue());
            case EMAIL -> systemOfRecord.lookupByEmail(key.normalizedValue());
        }).flatMap(found -> found);
        if (canonicalId.isEmpty()) {
            log.debug("resolve.miss key={}", key);
            return ResolutionResult.miss();
        }

        EntityMetadata metadata = callSystemOfRecord("metadata", key,
                () -> systemOfRecord.getEntityMetadata(canonicalId.get()))
                .orElse(EntityMetadata.empty());

        UpsertResult upsert;
        try {
            upsert = store.upsert(key, canonicalId.get(), metadata, RecordSource.SYSTEM_OF_RECORD);
        } catch (StorageException e) {
            // Without a stored version the mapping must not reach any cache tier.
            log.error("resolve.upsert.failed key={} error={}", key, e.getMessage(), e);
            metrics.incrementTierFailure(ResolutionSource.AUTHORITATIVE.getLabel());
            long highest = Optional.ofNullable(versionWatermarks.getIfPresent(key)).orElse(0L);
            return new ResolutionResult(canonicalId.get(), metadata.entityId(), highest,
                    ResolutionSource.SYSTEM_OF_RECORD);
        }

        CachedMapping mapping = upsert.record().toMapping();
        log.info("resolve.sor.stored key={} canonicalId={} outcome={} version={}",
                key, mapping.canonicalId(), upsert.outcome(), mapping.version());
        writeEdgeIfCurrent(key, mapping);
        propagateInBackground(key, mapping);
        return surface(key, mapping, ResolutionSource.SYSTEM_OF_RECORD);
    }

    /**
     * Pre-populates the tiers with known mappings. Each mapping is written to the
     * authoritative store first so cached versions never run ahead of it.
     *
     * @return number of mappings loaded
     */
    public int warmUp(List<WarmUpMapping> mappings) {
        log.info("warmup.started count={}", mappings.size());
        int loaded = 0;
        for (WarmUpMapping mapping : mappings) {
            CacheKey key = normalizer.normalize(mapping.type(), mapping.lookup());
            if (key.isEmpty()) {
                log.warn("warmup.skipped reason=empty_key lookup={} type={}", mapping.lookup(), mapping.type());
                continue;
            }
            try {
                UpsertResult upsert = store.upsert(key, mapping.canonicalId(),
                        new EntityMetadata(mapping.entityId(), null), RecordSource.REPLICATED);
                CachedMapping cached = upsert.record().toMapping();
                writeDistributed(key, cached);
                writeEdge(key, cached);
                loaded++;
            } catch (StorageException | TierUnavailableException e) {
                log.error("warmup.entry.failed key={} error={}", key, e.getMessage());
            }
        }
        log.info("warmup.completed loaded={} requested={}", loaded, mappings.size());
        return loaded;
    }

    public ResolutionStatistics statistics() {
        Map<ResolutionSource, Long> counts = new EnumMap<>(ResolutionSource.class);
        resolutionCounts.forEach((source, adder) -> counts.put(source, adder.sum()));
        return new ResolutionStatistics(counts, tierFailures.sum(), laggingDiscarded.sum(),
                sorTimeouts.sum(), sorFailures.sum());
    }

    private Optional<CachedMapping> readCached(CacheTier tier, CacheKey key, Span span) {
        Optional<CachedMapping> hit;
        try {
            hit = tier.get(key);
        } catch (TierUnavailableException | StorageException e) {
            recordTierFailure(tier.source(), key, e, span);
            return Optional.empty();
        }
        if (hit.isEmpty()) {
            return hit;
        }
        Long highest = versionWatermarks.getIfPresent(key);
        if (highest != null && hit.get().version() < highest) {
            log.warn("resolve.lagging tier={} key={} version={} highestSeen={}",
                    tier.source().getLabel(), key, hit.get().version(), highest);
            laggingDiscarded.increment();
            metrics.incrementLaggingEntryDiscarded(tier.source().getLabel());
            span.addEvent("tier.lagging." + tier.source().getLabel());
            evictQuietly(tier, key);
            return Optional.empty();
        }
        return hit;
    }

    private Optional<CacheRecord> readAuthoritative(CacheKey key, Span span) {
        try {
            return store.findValid(key);
        } catch (StorageException | TierUnavailableException e) {
            recordTierFailure(ResolutionSource.AUTHORITATIVE, key, e, span);
            return Optional.empty();
        }
    }

    private <T> Optional<T> callSystemOfRecord(String operation, CacheKey key, Supplier<T> call) {
        try {
            return Optional.ofNullable(CompletableFuture.supplyAsync(call, sorExecutor)
                    .orTimeout(options.getSorTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                sorTimeouts.increment();
                metrics.incrementSystemOfRecordTimeout();
                log.warn("resolve.sor.timeout operation={} key={} timeout={}",
                        operation, key, options.getSorTimeout());
            } else {
                sorFailures.increment();
                log.warn("resolve.sor.failed operation={} key={} error={}", operation, key, cause.getMessage());
            }
            return Optional.empty();
        }
    }

    private ResolutionResult surface(CacheKey key, CachedMapping mapping, ResolutionSource source) {
        versionWatermarks.asMap().merge(key, mapping.version(), Math::max);
        log.debug("resolve.hit tier={} key={} version={}", source.getLabel(), key, mapping.version());
        return new ResolutionResult(mapping.canonicalId(), mapping.entityId(), mapping.version(), source);
    }

    private ResolutionResult complete(LookupType type, ResolutionResult result, long startNanos) {
        resolutionCounts.get(result.source()).increment();
        metrics.recordResolution(type, result.source(), Duration.ofNanos(System.nanoTime() - startNanos));
        return result;
    }

    private void writeEdge(CacheKey key, CachedMapping mapping) {
        try {
            edgeCache.put(key, mapping);
        } catch (TierUnavailableException e) {
            log.warn("resolve.edge.write.failed key={} error={}", key, e.getMessage());
        }
    }

    /**
     * Writes the edge inline, then withdraws the entry if an invalidation or a newer
     * version reached the store while the lookup was in flight.
     */
    private void writeEdgeIfCurrent(CacheKey key, CachedMapping mapping) {
        writeEdge(key, mapping);
        Optional<CacheRecord> current;
        try {
            current = store.findValid(key);
        } catch (StorageException | TierUnavailableException e) {
            log.debug("resolve.edge.recheck.failed key={} error={}", key, e.getMessage());
            return;
        }
        if (current.isEmpty() || current.get().getVersion() > mapping.version()) {
            evictQuietly(edgeCache, key);
            log.debug("resolve.edge.withdrawn key={} version={}", key, mapping.version());
        }
    }

    private void writeDistributed(CacheKey key, CachedMapping mapping) {
        Duration ttl = options.getDistributedTtl();
        distributedCache.put(key, mapping, ttl);
        if (!store.markReplicated(key, mapping.version(), clock.instant(), ttl)) {
            // invalidated while the write was queued
            distributedCache.evict(key);
            log.debug("resolve.propagate.withdrawn key={} version={}", key, mapping.version());
        }
    }

    private void propagateInBackground(CacheKey key, CachedMapping mapping) {
        supervisor.submit("propagate", () -> writeDistributed(key, mapping));
    }

    private void countHitInBackground(CacheKey key) {
        supervisor.submit("record-hit", () -> store.recordHit(key));
    }

    private void recordTierFailure(ResolutionSource tier, CacheKey key, RuntimeException e, Span span) {
        tierFailures.increment();
        metrics.incrementTierFailure(tier.getLabel());
        span.addEvent("tier.unavailable." + tier.getLabel());
        log.warn("resolve.tier.unavailable tier={} key={} error={}", tier.getLabel(), key, e.getMessage());
    }

    private void evictQuietly(CacheTier tier, CacheKey key) {
        try {
            tier.evict(key);
        } catch (TierUnavailableException e) {
            log.debug("resolve.evict.failed tier={} key={} error={}", tier.source().getLabel(), key, e.getMessage());
        }
    }

    @Override
    public void close() {
        sorExecutor.shutdownNow();
    }
}
