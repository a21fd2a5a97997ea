package com.contact.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding authoritative lookup records and job leases.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters, referenced as {@code $name}
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column alias.
     *
     * @param query  the Cypher query
     * @param params query parameters, referenced as {@code $name}
     * @return result rows
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by lookup records and leases if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
