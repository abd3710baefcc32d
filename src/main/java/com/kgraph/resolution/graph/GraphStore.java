package com.kgraph.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Graph storage the knowledge graph is materialized into.
 *
 * <p>Nodes are keyed by canonical entity id. Edges are keyed by
 * {@code (from, predicate, to)}: upserting an existing edge updates its attributes
 * and never creates a second one.</p>
 */
public interface GraphStore {

    /**
     * Creates the node or replaces its attributes.
     */
    void upsertNode(int id, Map<String, Object> attributes);

    /**
     * Creates the edge or replaces its attributes. Both nodes must exist.
     */
    void upsertEdge(int fromId, int toId, String predicate, Map<String, Object> attributes);

    /**
     * Deletes the edge if it exists. The nodes stay.
     */
    void removeEdge(int fromId, int toId, String predicate);

    /**
     * Nodes reachable from {@code nodeId} within {@code depth} hops, following edges in
     * either direction. The start node is not included.
     *
     * @return neighbors with their shortest hop distance, nearest first
     */
    List<GraphNeighbor> query(int nodeId, int depth);

    boolean containsNode(int id);
}
