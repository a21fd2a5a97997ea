package com.contact.resolution.metrics;

import com.contact.resolution.core.model.LookupType;
import com.contact.resolution.core.model.ResolutionSource;
import com.contact.resolution.health.HealthStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(LookupType type, ResolutionSource source, Duration duration) {
    }

    @Override
    public void incrementTierFailure(String tier) {
    }

    @Override
    public void incrementSystemOfRecordTimeout() {
    }

    @Override
    public void incrementLaggingEntryDiscarded(String tier) {
    }

    @Override
    public void incrementInvalidation(LookupType type) {
    }

    @Override
    public void recordReplicationRun(int selected, int written, int skipped) {
    }

    @Override
    public void recordDriftCheck(HealthStatus.Status status, double driftRatio) {
    }

    @Override
    public void incrementBackgroundTaskFailure(String taskName) {
    }

    @Override
    public void incrementBackgroundTaskRejected(String taskName) {
    }
}
