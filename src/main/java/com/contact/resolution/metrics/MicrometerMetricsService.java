package com.contact.resolution.metrics;

import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.health.HealthStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code contact.resolution.duration} - Timer (tags: lookupType, source)</li>
 *   <li>{@code contact.resolution.tier.failure} - Counter (tag: tier)</li>
 *   <li>{@code contact.resolution.sor.timeout} - Counter</li>
 *   <li>{@code contact.resolution.lagging.discarded} - Counter (tag: tier)</li>
 *   <li>{@code contact.resolution.invalidation} - Counter (tag: lookupType)</li>
 *   <li>{@code contact.replication.rows} - Counter (tag: outcome)</li>
 *   <li>{@code contact.replication.batch.size} - DistributionSummary</li>
 *   <li>{@code contact.drift.checks} - Counter (tag: status)</li>
 *   <li>{@code contact.drift.ratio} - DistributionSummary</li>
 *   <li>{@code contact.task.failure} / {@code contact.task.rejected} - Counter (tag: task)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter sorTimeoutCounter;
    private final DistributionSummary replicationBatchSummary;
    private final DistributionSummary driftRatioSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.sorTimeoutCounter = Counter.builder("contact.resolution.sor.timeout")
                .description("System of record calls that timed out")
                .register(registry);
        this.replicationBatchSummary = DistributionSummary.builder("contact.replication.batch.size")
                .description("Rows selected per replication run")
                .register(registry);
        this.driftRatioSummary = DistributionSummary.builder("contact.drift.ratio")
                .description("Fraction of sampled entities out of sync")
                .register(registry);
    }

    @Override
    public void recordResolution(LookupType type, ResolutionSource source, Duration duration) {
        String key = type.name() + ":" + source.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("contact.resolution.duration")
                        .description("Duration of contact resolution")
                        .tag("lookupType", type.getPrefix())
                        .tag("source", source.getLabel())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementTierFailure(String tier) {
        counter("contact.resolution.tier.failure", "Tier reads or writes that failed", "tier", tier).increment();
    }

    @Override
    public void incrementSystemOfRecordTimeout() {
        sorTimeoutCounter.increment();
    }

    @Override
    public void incrementLaggingEntryDiscarded(String tier) {
        counter("contact.resolution.lagging.discarded",
                "Cached entries discarded for carrying an older version", "tier", tier).increment();
    }

    @Override
    public void incrementInvalidation(LookupType type) {
        counter("contact.resolution.invalidation", "Lookup keys invalidated",
                "lookupType", type.getPrefix()).increment();
    }

    @Override
    public void recordReplicationRun(int selected, int written, int skipped) {
        replicationBatchSummary.record(selected);
        counter("contact.replication.rows", "Rows processed by replication", "outcome", "written")
                .increment(written);
        counter("contact.replication.rows", "Rows processed by replication", "outcome", "skipped")
                .increment(skipped);
    }

    @Override
    public void recordDriftCheck(HealthStatus.Status status, double driftRatio) {
        counter("contact.drift.checks", "Drift checks by resulting status", "status", status.name()).increment();
        driftRatioSummary.record(driftRatio);
    }

    @Override
    public void incrementBackgroundTaskFailure(String taskName) {
        counter("contact.task.failure", "Background tasks that threw", "task", taskName).increment();
    }

    @Override
    public void incrementBackgroundTaskRejected(String taskName) {
        counter("contact.task.rejected", "Background tasks rejected by a full queue", "task", taskName).increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
