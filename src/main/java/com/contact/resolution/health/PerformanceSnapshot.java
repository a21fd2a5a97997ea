package com.contact.resolution.health;

import com.contact.resolution.cache.CacheStats;
import com.contact.resolution.replication.ReplicationStats;
import com.contact.resolution.store.StoreStatistics;
import com.contact.resolution.task.TaskStats;

import java.util.Map;

/**
 * Operational counters captured alongside health checks.
 *
 * @param resolutionsBySource resolution counts keyed by source label
 * @param edgeCache           this node's edge cache counters
 * @param store               authoritative store aggregates
 * @param lastReplication     the most recent replication run, null if none has completed
 * @param backgroundTasks     background task counters
 */
public record PerformanceSnapshot(
        Map<String, Long> resolutionsBySource,
        CacheStats edgeCache,
        StoreStatistics store,
        ReplicationStats lastReplication,
        TaskStats backgroundTasks
) {

    public PerformanceSnapshot {
        resolutionsBySource = resolutionsBySource != null ? Map.copyOf(resolutionsBySource) : Map.of();
    }
}
