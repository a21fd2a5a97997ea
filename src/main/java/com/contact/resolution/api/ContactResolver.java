package com.contact.resolution.api;

import com.contact.resolution.alert.AlertDispatcher;
import com.contact.resolution.alert.LoggingAlertDispatcher;
import com.contact.resolution.cache.CacheConfig;
import com.contact.resolution.cache.DistributedCache;
import com.contact.resolution.cache.EdgeCache;
import com.contact.resolution.cache.InMemoryDistributedCache;
import com.contact.resolution.cache.RedissonDistributedCache;
import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.graph.FalkorDBConnection;
import com.contact.resolution.graph.GraphConnection;
import com.contact.resolution.health.DriftConfig;
import com.contact.resolution.health.DriftMonitor;
import com.contact.resolution.health.GraphStoreHealthCheck;
import com.contact.resolution.health.HealthCheck;
import com.contact.resolution.health.HealthCheckRegistry;
import com.contact.resolution.health.HealthSnapshot;
import com.contact.resolution.health.IdentityCoverageCheck;
import com.contact.resolution.health.PerformanceSnapshot;
import com.contact.resolution.health.SourceDriftCheck;
import com.contact.resolution.health.TierStalenessCheck;
import com.contact.resolution.invalidation.InvalidationOutcome;
import com.contact.resolution.invalidation.InvalidationService;
import com.contact.resolution.lock.DistributedLock;
import com.contact.resolution.lock.GraphDistributedLock;
import com.contact.resolution.lock.LocalDistributedLock;
import com.contact.resolution.lock.LockConfig;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.metrics.NoOpMetricsService;
import com.contact.resolution.replication.ReplicationConfig;
import com.contact.resolution.replication.ReplicationJob;
import com.contact.resolution.replication.ReplicationStats;
import com.contact.resolution.rules.LookupKeyNormalizer;
import com.contact.resolution.source.SystemOfRecord;
import com.contact.resolution.store.AuthoritativeStore;
import com.contact.resolution.store.ConflictRetryPolicy;
import com.contact.resolution.store.GraphAuthoritativeStore;
import com.contact.resolution.store.InMemoryAuthoritativeStore;
import com.contact.resolution.task.BackgroundTaskSupervisor;
import com.contact.resolution.task.JobScheduler;
import com.contact.resolution.tracing.NoOpTracingService;
import com.contact.resolution.tracing.TracingService;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for contact resolution.
 *
 * <p>Wires the tiers, the background supervisor, the replication job and the drift
 * monitor behind one object. Without further configuration everything runs in-process:
 * an in-memory authoritative store and distributed cache, a local lock, no-op metrics
 * and tracing, and alerts written to the log.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ContactResolver resolver = ContactResolver.builder()
 *     .systemOfRecord(HttpSystemOfRecord.builder().baseUrl(url).build())
 *     .falkorDB("localhost", 6379, "contacts")
 *     .redisson(redissonClient)
 *     .build();
 * resolver.start();
 *
 * ResolutionResult result = resolver.resolve("+1 (336) 518-5544", LookupType.PHONE);
 * resolver.invalidate(LookupType.PHONE, "+13365185544", "merged in CRM");
 * HealthSnapshot health = resolver.getHealthSnapshot();
 * </pre>
 */
public class ContactResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContactResolver.class);

    private static final int JOB_LEASE_SECONDS = 600;

    private final TierResolver tierResolver;
    private final InvalidationService invalidationService;
    private final ReplicationJob replicationJob;
    private final DriftMonitor driftMonitor;
    private final BackgroundTaskSupervisor supervisor;
    private final EdgeCache edgeCache;
    private final AuthoritativeStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final Clock clock;
    private JobScheduler scheduler;

    private ContactResolver(Builder builder) {
        this.clock = builder.clock;
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        ResolutionOptions options = builder.options;
        MetricsService metrics = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }

        this.store = resolveStore(builder);
        DistributedCache distributedCache = resolveDistributedCache(builder, options);
        DistributedLock lock = resolveLock(builder);
        this.edgeCache = new EdgeCache(builder.edgeCacheConfig);
        LookupKeyNormalizer normalizer = new LookupKeyNormalizer();

        this.supervisor = new BackgroundTaskSupervisor(options.getBackgroundThreads(),
                options.getBackgroundQueueCapacity(), metrics);
        this.tierResolver = new TierResolver(normalizer, edgeCache, distributedCache, store,
                builder.systemOfRecord, supervisor, options, metrics, tracing, clock);
        this.invalidationService = new InvalidationService(normalizer, edgeCache, distributedCache, store, metrics);
        this.replicationJob = new ReplicationJob(store, distributedCache, lock, builder.replicationConfig,
                metrics, tracing, clock);

        HealthCheckRegistry registry = new HealthCheckRegistry(clock);
        SourceDriftCheck driftCheck = new SourceDriftCheck(builder.systemOfRecord, store, builder.driftConfig);
        registry.register(driftCheck);
        registry.register(new IdentityCoverageCheck(store, builder.driftConfig, clock));
        registry.register(new TierStalenessCheck(store, builder.driftConfig, clock));
        if (connection != null) {
            registry.register(new GraphStoreHealthCheck(connection));
        }
        builder.healthChecks.forEach(registry::register);

        this.driftMonitor = DriftMonitor.builder()
                .registry(registry)
                .driftCheck(driftCheck)
                .alertDispatcher(builder.alertDispatcher != null
                        ? builder.alertDispatcher : new LoggingAlertDispatcher())
                .invalidationService(invalidationService)
                .lock(lock)
                .config(builder.driftConfig)
                .performance(this::performance)
                .metrics(metrics)
                .clock(clock)
                .build();

        log.info("contact-resolver.created systemOfRecord={} store={} distributedCache={} options={}",
                builder.systemOfRecord.getName(), store.getClass().getSimpleName(),
                distributedCache.getClass().getSimpleName(), options);
    }

    private static AuthoritativeStore resolveStore(Builder builder) {
        if (builder.authoritativeStore != null) {
            return builder.authoritativeStore;
        }
        if (builder.connection != null) {
            return new GraphAuthoritativeStore(builder.connection, builder.clock, ConflictRetryPolicy.defaults());
        }
        return new InMemoryAuthoritativeStore(builder.clock);
    }

    private static DistributedCache resolveDistributedCache(Builder builder, ResolutionOptions options) {
        if (builder.distributedCache != null) {
            return builder.distributedCache;
        }
        if (builder.redisson != null) {
            return new RedissonDistributedCache(builder.redisson, options.getDistributedTtl());
        }
        return new InMemoryDistributedCache(builder.clock, options.getDistributedTtl());
    }

    private static DistributedLock resolveLock(Builder builder) {
        if (builder.distributedLock != null) {
            return builder.distributedLock;
        }
        LockConfig jobLease = LockConfig.singleFlight(JOB_LEASE_SECONDS);
        if (builder.connection != null) {
            return new GraphDistributedLock(builder.connection, jobLease, builder.clock);
        }
        return new LocalDistributedLock(jobLease);
    }

    /**
     * Resolves a raw phone number or email address to its canonical entity.
     *
     * @see TierResolver#resolve(String, LookupType)
     */
    public ResolutionResult resolve(String rawLookup, LookupType type) {
        return tierResolver.resolve(rawLookup, type);
    }

    /**
     * Forces the next lookup of a key back to the system of record.
     *
     * @throws com.contact.resolution.store.StorageException if the store cannot be updated
     */
    public InvalidationOutcome invalidate(LookupType type, String rawLookup, String reason) {
        return invalidationService.invalidate(type, rawLookup, reason);
    }

    /**
     * Invalidates every key mapped to a canonical entity.
     */
    public List<InvalidationOutcome> invalidateCanonicalId(String canonicalId, String reason) {
        return invalidationService.invalidateCanonicalId(canonicalId, reason);
    }

    /**
     * Returns the latest monitor snapshot. Before the first run the checks are evaluated
     * once, without alerting or recording, and that result is reused until a run completes.
     */
    public HealthSnapshot getHealthSnapshot() {
        return driftMonitor.current();
    }

    /**
     * Runs the drift monitor now.
     *
     * @return the snapshot, or empty if a run is already in progress
     */
    public Optional<HealthSnapshot> runHealthChecks() {
        return driftMonitor.runOnce();
    }

    /**
     * Runs the replication job now.
     *
     * @return the run's stats, or empty if a run is already in progress
     */
    public Optional<ReplicationStats> replicate() {
        return replicationJob.runOnce();
    }

    /**
     * Pre-populates every tier with known mappings.
     *
     * @return number of mappings loaded
     */
    public int warmUp(List<WarmUpMapping> mappings) {
        return tierResolver.warmUp(mappings);
    }

    public ResolutionStatistics statistics() {
        return tierResolver.statistics();
    }

    public List<HealthSnapshot> healthHistory() {
        return driftMonitor.history();
    }

    /**
     * Schedules the replication job and the drift monitor. Calling it twice has no effect.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = new JobScheduler(2);
        Duration replicationInterval = replicationJob.getConfig().interval();
        Duration driftInterval = driftMonitor.getConfig().interval();
        scheduler.schedule("replication", replicationInterval, replicationInterval, replicationJob);
        scheduler.schedule("drift-monitor", driftInterval, driftInterval, driftMonitor);
        log.info("contact-resolver.started replicationInterval={} driftInterval={}",
                replicationInterval, driftInterval);
    }

    private PerformanceSnapshot performance() {
        ResolutionStatistics stats = tierResolver.statistics();
        Map<String, Long> bySource = new LinkedHashMap<>();
        for (ResolutionSource source : ResolutionSource.values()) {
            bySource.put(source.getLabel(), stats.count(source));
        }
        return new PerformanceSnapshot(bySource, edgeCache.getStats(), store.statistics(clock.instant()),
                replicationJob.lastRun().orElse(null), supervisor.stats());
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.close();
            scheduler = null;
        }
        tierResolver.close();
        supervisor.close();
        if (ownsConnection && connection != null) {
            connection.close();
        }
        log.info("contact-resolver.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SystemOfRecord systemOfRecord;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private AuthoritativeStore authoritativeStore;
        private DistributedCache distributedCache;
        private RedissonClient redisson;
        private CacheConfig edgeCacheConfig = CacheConfig.defaults();
        private ResolutionOptions options = ResolutionOptions.defaults();
        private ReplicationConfig replicationConfig = ReplicationConfig.defaults();
        private DriftConfig driftConfig = DriftConfig.defaults();
        private DistributedLock distributedLock;
        private AlertDispatcher alertDispatcher;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock = Clock.systemUTC();
        private final List<HealthCheck> healthChecks = new ArrayList<>();

        /**
         * Sets the slow source consulted on a full miss. Required.
         */
        public Builder systemOfRecord(SystemOfRecord systemOfRecord) {
            this.systemOfRecord = systemOfRecord;
            return this;
        }

        /**
         * Backs the authoritative store and job leases with an existing graph connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned by this resolver and closed with it.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Controls whether graph indexes are created on startup.
         */
        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder authoritativeStore(AuthoritativeStore authoritativeStore) {
            this.authoritativeStore = authoritativeStore;
            return this;
        }

        public Builder distributedCache(DistributedCache distributedCache) {
            this.distributedCache = distributedCache;
            return this;
        }

        /**
         * Uses Redis through the given client as the distributed cache.
         */
        public Builder redisson(RedissonClient redisson) {
            this.redisson = redisson;
            return this;
        }

        public Builder edgeCache(CacheConfig edgeCacheConfig) {
            this.edgeCacheConfig = edgeCacheConfig;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder replication(ReplicationConfig replicationConfig) {
            this.replicationConfig = replicationConfig;
            return this;
        }

        public Builder drift(DriftConfig driftConfig) {
            this.driftConfig = driftConfig;
            return this;
        }

        /**
         * Sets the lock guarding the scheduled jobs. Defaults to a graph lease when a graph
         * connection is configured, otherwise an in-process lock.
         */
        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        /**
         * Sets where degraded health is reported. Defaults to {@link LoggingAlertDispatcher}.
         */
        public Builder alertDispatcher(AlertDispatcher alertDispatcher) {
            this.alertDispatcher = alertDispatcher;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Registers an additional check run by the drift monitor.
         */
        public Builder healthCheck(HealthCheck check) {
            this.healthChecks.add(check);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public ContactResolver build() {
            if (systemOfRecord == null) {
                throw new IllegalStateException("SystemOfRecord is required");
            }
            return new ContactResolver(this);
        }
    }
}
