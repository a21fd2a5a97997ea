package com.contact.resolution.rest.dto;

import com.contact.resolution.health.HealthCheckResult;
import com.contact.resolution.health.HealthSnapshot;
import com.contact.resolution.health.PerformanceSnapshot;
import com.contact.resolution.replication.ReplicationStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a {@link HealthSnapshot}. Timestamps are ISO-8601 strings.
 */
public record HealthResponse(String status, String recordedAt, List<Check> checks, Map<String, Object> performance) {

    public record Check(String name, String status, String message, Map<String, Object> details, String checkedAt) {

        static Check from(HealthCheckResult result) {
            return new Check(result.name(), result.status().status().name(), result.status().message(),
                    result.status().details(), result.checkedAt().toString());
        }
    }

    public static HealthResponse from(HealthSnapshot snapshot) {
        return new HealthResponse(snapshot.status().name(), snapshot.recordedAt().toString(),
                snapshot.checks().stream().map(Check::from).toList(),
                performance(snapshot.performance()));
    }

    private static Map<String, Object> performance(PerformanceSnapshot performance) {
        Map<String, Object> view = new LinkedHashMap<>();
        if (performance == null) {
            return view;
        }
        view.put("resolutionsBySource", performance.resolutionsBySource());
        if (performance.edgeCache() != null) {
            view.put("edgeCache", Map.of(
                    "size", performance.edgeCache().size(),
                    "hitRate", performance.edgeCache().hitRate()));
        }
        if (performance.store() != null) {
            view.put("store", Map.of(
                    "active", performance.store().active(),
                    "invalidated", performance.store().invalidated(),
                    "missingEntityId", performance.store().missingEntityId(),
                    "staleMirror", performance.store().staleMirror()));
        }
        ReplicationStats replication = performance.lastReplication();
        if (replication != null) {
            view.put("lastReplication", Map.of(
                    "selected", replication.selected(),
                    "written", replication.written(),
                    "skipped", replication.skipped(),
                    "ranAt", replication.ranAt().toString()));
        }
        if (performance.backgroundTasks() != null) {
            view.put("backgroundTasks", Map.of(
                    "completed", performance.backgroundTasks().completed(),
                    "failed", performance.backgroundTasks().failed(),
                    "rejected", performance.backgroundTasks().rejected(),
                    "active", performance.backgroundTasks().active()));
        }
        return view;
    }
}
