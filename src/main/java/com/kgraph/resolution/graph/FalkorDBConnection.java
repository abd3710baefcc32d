package com.kgraph.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link GraphConnection} to FalkorDB through the JFalkorDB driver.
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
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Executing: {}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("Querying: {}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        log.debug("Query returned {} rows", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating knowledge graph indexes on {}", graphName);
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.id)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.type)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.label)");
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index already exists
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $name} placeholders with literal values. Longer names are replaced first
     * so that {@code $id} does not clobber {@code $idList}.
     */
    static String processParams(String query, Map<String, Object> params) {
        List<String> names = new ArrayList<>(params.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());
        String result = query;
        for (String name : names) {
            result = result.replace("$" + name, formatValue(params.get(name)));
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
        if (value instanceof Collection<?> values) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Object element : values) {
                joiner.add(formatValue(element));
            }
            return joiner.toString();
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB connection", e);
        }
        log.info("FalkorDB connection closed");
    }
}
