package com.contact.resolution.api;

import com.contact.resolution.core.model.ResolutionSource;

import java.util.Map;

/**
 * Counters kept by the {@link TierResolver} since startup.
 *
 * @param resolutionsBySource lookups answered per source, including misses
 * @param tierFailures        tier reads that failed and fell through
 * @param laggingDiscarded    cached entries discarded for carrying an older version
 * @param sorTimeouts         system of record calls that timed out
 * @param sorFailures         system of record calls that failed
 */
public record ResolutionStatistics(
        Map<ResolutionSource, Long> resolutionsBySource,
        long tierFailures,
        long laggingDiscarded,
        long sorTimeouts,
        long sorFailures
) {

    public ResolutionStatistics {
        resolutionsBySource = Map.copyOf(resolutionsBySource);
    }

    public long total() {
        return resolutionsBySource.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(ResolutionSource source) {
        return resolutionsBySource.getOrDefault(source, 0L);
    }
}
