package com.contact.resolution.metrics;

import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.health.HealthStatus;

import java.time.Duration;

/**
 * Interface for recording contact resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordResolution(LookupType type, ResolutionSource source, Duration duration);

    void incrementTierFailure(String tier);

    void incrementSystemOfRecordTimeout();

    void incrementLaggingEntryDiscarded(String tier);

    void incrementInvalidation(LookupType type);

    void recordReplicationRun(int selected, int written, int skipped);

    void recordDriftCheck(HealthStatus.Status status, double driftRatio);

    void incrementBackgroundTaskFailure(String taskName);

    void incrementBackgroundTaskRejected(String taskName);
}
