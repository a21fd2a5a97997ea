package com.contact.resolution.health;

import com.contact.resolution.graph.GraphConnection;

/**
 * Health check for FalkorDB connectivity behind the graph-backed store.
 * Executes a trivial query and measures latency.
 */
public class GraphStoreHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphStoreHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graph-store";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            connection.query("RETURN 1");
            long latencyMs = System.currentTimeMillis() - startMs;

            return HealthStatus.ok()
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("graphName", connection.getGraphName());
        } catch (Exception e) {
            return HealthStatus.critical("Authoritative store unreachable: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
