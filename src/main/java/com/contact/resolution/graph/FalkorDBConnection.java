package com.contact.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB implementation of {@link GraphConnection} using the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.trace("graph.execute query={}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.trace("graph.query query={}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("graph.ping.failed graph={} error={}", graphName, e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        safeExecute("CREATE INDEX FOR (r:LookupRecord) ON (r.key)");
        safeExecute("CREATE INDEX FOR (r:LookupRecord) ON (r.canonicalId)");
        safeExecute("CREATE INDEX FOR (r:LookupRecord) ON (r.lastVerifiedAt)");
        safeExecute("CREATE INDEX FOR (l:Lock) ON (l.key)");
        log.info("graph.indexes.ready graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index already exists
            log.debug("graph.index.skipped query={} reason={}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders with literal values. Longer names are
     * replaced first so {@code $key} never clobbers {@code $keyPrefix}.
     */
    static String processParams(String query, Map<String, Object> params) {
        String result = query;
        List<Map.Entry<String, Object>> entries = new ArrayList<>(params.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, Object> e) -> e.getKey().length()).reversed());
        for (Map.Entry<String, Object> entry : entries) {
            result = result.replace("$" + entry.getKey(), formatValue(entry.getValue()));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.close.failed graph={}", graphName, e);
        }
        log.info("graph.closed graph={}", graphName);
    }
}
