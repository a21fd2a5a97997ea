package com.contact.resolution.health;

import java.time.Duration;

/**
 * Configuration for the {@link DriftMonitor} and its checks.
 *
 * @param interval               delay between monitor runs
 * @param sampleSize             recently edited entities sampled from the system of record
 * @param tolerance              how far the store may trail a source edit before a sample counts as drifted
 * @param warningRatio           drift ratios at or below this are OK
 * @param criticalRatio          drift ratios at or above this are CRITICAL
 * @param coverageCriticalRatio  missing entity id ratios at or above this are CRITICAL; any lower non-zero ratio is WARNING
 * @param stalenessWarningRatio  stale mirror ratios above this are WARNING
 * @param stalenessCriticalRatio stale mirror ratios above this are CRITICAL
 * @param invalidateOnDrift      invalidate drifted entities after a run
 * @param historySize            number of snapshots retained
 */
public record DriftConfig(
        Duration interval,
        int sampleSize,
        Duration tolerance,
        double warningRatio,
        double criticalRatio,
        double coverageCriticalRatio,
        double stalenessWarningRatio,
        double stalenessCriticalRatio,
        boolean invalidateOnDrift,
        int historySize
) {

    public DriftConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be > 0");
        }
        if (tolerance == null || tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        requireRatio(warningRatio, "warningRatio");
        requireRatio(criticalRatio, "criticalRatio");
        requireRatio(coverageCriticalRatio, "coverageCriticalRatio");
        requireRatio(stalenessWarningRatio, "stalenessWarningRatio");
        requireRatio(stalenessCriticalRatio, "stalenessCriticalRatio");
        if (warningRatio >= criticalRatio) {
            throw new IllegalArgumentException("warningRatio must be below criticalRatio");
        }
        if (stalenessWarningRatio > stalenessCriticalRatio) {
            throw new IllegalArgumentException("stalenessWarningRatio must not exceed stalenessCriticalRatio");
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be > 0");
        }
    }

    /**
     * Every 15 minutes, 25 samples, 15 minute tolerance, any drift warns and 70% is critical.
     */
    public static DriftConfig defaults() {
        return new DriftConfig(Duration.ofMinutes(15), 25, Duration.ofMinutes(15),
                0.0, 0.70, 0.10, 0.10, 0.25, false, 96);
    }

    public DriftConfig withThresholds(double warningRatio, double criticalRatio) {
        return new DriftConfig(interval, sampleSize, tolerance, warningRatio, criticalRatio,
                coverageCriticalRatio, stalenessWarningRatio, stalenessCriticalRatio, invalidateOnDrift, historySize);
    }

    public DriftConfig withInterval(Duration interval) {
        return new DriftConfig(interval, sampleSize, tolerance, warningRatio, criticalRatio,
                coverageCriticalRatio, stalenessWarningRatio, stalenessCriticalRatio, invalidateOnDrift, historySize);
    }

    public DriftConfig withInvalidateOnDrift(boolean invalidateOnDrift) {
        return new DriftConfig(interval, sampleSize, tolerance, warningRatio, criticalRatio,
                coverageCriticalRatio, stalenessWarningRatio, stalenessCriticalRatio, invalidateOnDrift, historySize);
    }

    private static void requireRatio(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1");
        }
    }
}
