package com.contact.resolution.health;

import com.contact.resolution.alert.AlertDispatcher;
import com.contact.resolution.alert.AlertSeverity;
import com.contact.resolution.cache.TierUnavailableException;
import com.contact.resolution.invalidation.InvalidationService;
import com.contact.resolution.lock.DistributedLock;
import com.contact.resolution.logging.LogContext;
import com.contact.resolution.metrics.MetricsService;
import com.contact.resolution.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Periodically runs the registered health checks and alerts on degradation.
 *
 * <p>A run is single-flight across nodes through the {@link DistributedLock}. After the
 * checks it records a {@link HealthSnapshot} in a bounded history, dispatches an alert
 * when any check is degraded and, if configured, invalidates the entities the drift
 * check found out of sync so the next lookup refreshes them. Neither alerting nor
 * remediation failures change the outcome of the run.</p>
 */
public class DriftMonitor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DriftMonitor.class);

    static final String LOCK_KEY = "job:drift";
    static final String DRIFT_REASON = "drift-detected";

    private final HealthCheckRegistry registry;
    private final SourceDriftCheck driftCheck;
    private final AlertDispatcher alertDispatcher;
    private final InvalidationService invalidationService;
    private final DistributedLock lock;
    private final DriftConfig config;
    private final Supplier<PerformanceSnapshot> performance;
    private final MetricsService metrics;
    private final Clock clock;
    private final Deque<HealthSnapshot> history = new ArrayDeque<>();
    private final AtomicReference<HealthSnapshot> coldStart = new AtomicReference<>();

    private DriftMonitor(Builder builder) {
        this.registry = builder.registry;
        this.driftCheck = builder.driftCheck;
        this.alertDispatcher = builder.alertDispatcher;
        this.invalidationService = builder.invalidationService;
        this.lock = builder.lock;
        this.config = builder.config;
        this.performance = builder.performance;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
    }

    @Override
    public void run() {
        runOnce();
    }

    /**
     * Runs the checks, records the snapshot and alerts if degraded.
     *
     * @return the snapshot, or empty if another run holds the lease
     */
    public Optional<HealthSnapshot> runOnce() {
        if (!lock.tryLock(LOCK_KEY)) {
            log.info("drift.skipped reason=already_running");
            return Optional.empty();
        }
        try (LogContext ctx = LogContext.forJob("drift-monitor")) {
            HealthSnapshot snapshot = evaluate();
            record(snapshot);
            Optional<HealthStatus> drift = driftStatus(snapshot);
            metrics.recordDriftCheck(snapshot.status(), drift.map(SourceDriftCheck::ratioOf).orElse(0.0));

            List<HealthCheckResult> degraded = snapshot.degraded();
            if (!degraded.isEmpty()) {
                alert(snapshot, degraded);
            }
            if (config.invalidateOnDrift()) {
                drift.ifPresent(status -> remediate(SourceDriftCheck.outOfSyncOf(status)));
            }
            log.info("drift.completed status={} checks={} degraded={}",
                    snapshot.status(), snapshot.checks().size(), degraded.size());
            return Optional.of(snapshot);
        } finally {
            lock.unlock(LOCK_KEY);
        }
    }

    /**
     * Runs the checks and builds a snapshot without recording it or alerting.
     */
    public HealthSnapshot evaluate() {
        List<HealthCheckResult> results = registry.runAll();
        return new HealthSnapshot(HealthCheckRegistry.aggregate(results), results,
                collectPerformance(), clock.instant());
    }

    /**
     * Most recent recorded snapshot. Before the first run the checks are evaluated once
     * under the job lease and that snapshot is served, unrecorded and without alerting,
     * until a run records one. If a run holds the lease the checks are evaluated for this
     * call only.
     */
    public HealthSnapshot current() {
        Optional<HealthSnapshot> recorded = latest();
        if (recorded.isPresent()) {
            return recorded.get();
        }
        HealthSnapshot cached = coldStart.get();
        if (cached != null) {
            return cached;
        }
        if (!lock.tryLock(LOCK_KEY)) {
            log.debug("drift.cold_start.shared reason=run_in_progress");
            return evaluate();
        }
        try {
            Optional<HealthSnapshot> completed = latest();
            if (completed.isPresent()) {
                return completed.get();
            }
            HealthSnapshot snapshot = evaluate();
            coldStart.set(snapshot);
            log.info("drift.cold_start status={} checks={}", snapshot.status(), snapshot.checks().size());
            return snapshot;
        } finally {
            lock.unlock(LOCK_KEY);
        }
    }

    /**
     * Most recent recorded snapshot, if the monitor has run.
     */
    public Optional<HealthSnapshot> latest() {
        synchronized (history) {
            return Optional.ofNullable(history.peekLast());
        }
    }

    /**
     * Recorded snapshots, oldest first.
     */
    public List<HealthSnapshot> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public DriftConfig getConfig() {
        return config;
    }

    private void record(HealthSnapshot snapshot) {
        synchronized (history) {
            history.addLast(snapshot);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
        }
    }

    private Optional<HealthStatus> driftStatus(HealthSnapshot snapshot) {
        if (driftCheck == null) {
            return Optional.empty();
        }
        return snapshot.checks().stream()
                .filter(result -> result.name().equals(driftCheck.getName()))
                .map(HealthCheckResult::status)
                .findFirst();
    }

    private PerformanceSnapshot collectPerformance() {
        if (performance == null) {
            return null;
        }
        try {
            return performance.get();
        } catch (RuntimeException e) {
            log.error("drift.performance.failed error={}", e.getMessage(), e);
            return null;
        }
    }

    private void alert(HealthSnapshot snapshot, List<HealthCheckResult> degraded) {
        String summary = degraded.stream()
                .map(result -> "- " + result.name() + ": " + result.status().message())
                .collect(Collectors.joining("\n"));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recordedAt", snapshot.recordedAt().toString());
        for (HealthCheckResult result : degraded) {
            details.put(result.name(), result.status().status().name());
        }
        try {
            alertDispatcher.send(AlertSeverity.from(snapshot.status()), summary, details);
        } catch (RuntimeException e) {
            log.error("drift.alert.failed status={} error={}", snapshot.status(), e.getMessage());
        }
    }

    private void remediate(List<String> canonicalIds) {
        if (invalidationService == null || canonicalIds.isEmpty()) {
            return;
        }
        int invalidated = 0;
        for (String canonicalId : canonicalIds) {
            try {
                invalidated += invalidationService.invalidateCanonicalId(canonicalId, DRIFT_REASON).size();
            } catch (StorageException | TierUnavailableException e) {
                log.warn("drift.remediate.failed canonicalId={} error={}", canonicalId, e.getMessage());
            }
        }
        log.info("drift.remediated entities={} keys={}", canonicalIds.size(), invalidated);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HealthCheckRegistry registry;
        private SourceDriftCheck driftCheck;
        private AlertDispatcher alertDispatcher;
        private InvalidationService invalidationService;
        private DistributedLock lock;
        private DriftConfig config = DriftConfig.defaults();
        private Supplier<PerformanceSnapshot> performance;
        private MetricsService metrics;
        private Clock clock = Clock.systemUTC();

        public Builder registry(HealthCheckRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * The drift check whose findings feed metrics and remediation. It must also be registered.
         */
        public Builder driftCheck(SourceDriftCheck driftCheck) {
            this.driftCheck = driftCheck;
            return this;
        }

        public Builder alertDispatcher(AlertDispatcher alertDispatcher) {
            this.alertDispatcher = alertDispatcher;
            return this;
        }

        public Builder invalidationService(InvalidationService invalidationService) {
            this.invalidationService = invalidationService;
            return this;
        }

        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder config(DriftConfig config) {
            this.config = config;
            return this;
        }

        public Builder performance(Supplier<PerformanceSnapshot> performance) {
            this.performance = performance;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DriftMonitor build() {
            if (registry == null) {
                throw new IllegalStateException("registry is required");
            }
            if (alertDispatcher == null) {
                throw new IllegalStateException("alertDispatcher is required");
            }
            if (lock == null) {
                throw new IllegalStateException("lock is required");
            }
            if (metrics == null) {
                throw new IllegalStateException("metrics is required");
            }
            return new DriftMonitor(this);
        }
    }
}
