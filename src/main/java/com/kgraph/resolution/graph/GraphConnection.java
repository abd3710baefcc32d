package com.kgraph.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to a Cypher-speaking graph database.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement, with {@code $name} placeholders
     * @param params placeholder values
     */
    void execute(String query, Map<String, Object> params);

    /**
     * Executes a Cypher query and returns its rows.
     *
     * @param query  the Cypher query, with {@code $name} placeholders
     * @param params placeholder values
     * @return one map per row, keyed by column name
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes the knowledge graph relies on, if missing.
     */
    void createIndexes();

    @Override
    void close();
}
