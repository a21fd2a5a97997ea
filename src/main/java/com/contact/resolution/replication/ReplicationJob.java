package com.contact.resolution.replication;

import com.contact.resolution.cache.DistributedCache;
import com.contact.resolution.cache.TierUnavailableException;
import com.contact.resolution.core.model.CacheRecord;
import com.contact.resolution.lock.DistributedLock;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.StorageException;
import com.contact.resolution.tracing.Span;
import com.contact.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pushes authoritative records out to the distributed cache.
 *
 * <p>Each run selects live records whose mirror is missing, behind the record version
 * or past its TTL, most recently verified first, writes them to the distributed cache
 * and records what was written on the row. A row that fails is counted as skipped and
 * picked up again next run. Running twice against an unchanged store propagates
 * nothing the second time.</p>
 *
 * <p>Runs are single-flight across nodes through the {@link DistributedLock}; a run that
 * finds the lease held returns empty.</p>
 */
public class ReplicationJob implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ReplicationJob.class);

    static final String LOCK_KEY = "job:replication";

    private final AuthoritativeStore store;
    private final DistributedCache distributedCache;
    private final DistributedLock lock;
    private final ReplicationConfig config;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;
    private final AtomicReference<ReplicationStats> lastRun = new AtomicReference<>();

    public ReplicationJob(AuthoritativeStore store, DistributedCache distributedCache, DistributedLock lock,
                          ReplicationConfig config, MetricsService metrics, TracingService tracing, Clock clock) {
        this.store = store;
        this.distributedCache = distributedCache;
        this.lock = lock;
        this.config = config;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    @Override
    public void run() {
        runOnce();
    }

    /**
     * Runs one replication pass.
     *
     * @return the run's stats, or empty if another run holds the lease
     * @throws StorageException if candidate rows cannot be selected
     */
    public Optional<ReplicationStats> runOnce() {
        if (!lock.tryLock(LOCK_KEY)) {
            log.info("replication.skipped reason=already_running");
            return Optional.empty();
        }
        try (LogContext ctx = LogContext.forJob("replication");
             Span span = tracing.startSpan("contact.replicate")) {
            ReplicationStats stats = replicate();
            span.setAttribute("replication.selected", stats.selected());
            span.setAttribute("replication.written", stats.written());
            span.setAttribute("replication.skipped", stats.skipped());
            span.setStatus(Span.SpanStatus.OK);
            lastRun.set(stats);
            metrics.recordReplicationRun(stats.selected(), stats.written(), stats.skipped());
            log.info("replication.completed selected={} written={} skipped={}",
                    stats.selected(), stats.written(), stats.skipped());
            return Optional.of(stats);
        } finally {
            lock.unlock(LOCK_KEY);
        }
    }

    private ReplicationStats replicate() {
        Instant now = clock.instant();
        List<CacheRecord> candidates = store.findStaleForReplication(now, config.batchSize());
        int written = 0;
        int skipped = 0;
        for (CacheRecord record : candidates) {
            try {
                distributedCache.put(record.getKey(), record.toMapping(), config.ttl());
                if (store.markReplicated(record.getKey(), record.getVersion(), now, config.ttl())) {
                    written++;
                } else {
                    // invalidated since it was selected
                    distributedCache.evict(record.getKey());
                    skipped++;
                }
            } catch (TierUnavailableException | StorageException e) {
                skipped++;
                log.warn("replication.row.failed key={} version={} error={}",
                        record.getKey(), record.getVersion(), e.getMessage());
            }
        }
        return new ReplicationStats(candidates.size(), written, skipped, now);
    }

    /**
     * Returns the stats of the most recent completed run, if any.
     */
    public Optional<ReplicationStats> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    public ReplicationConfig getConfig() {
        return config;
    }
}
