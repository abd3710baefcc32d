package com.kgraph.resolution.graph;

/**
 * A node reached by a graph traversal.
 *
 * @param nodeId id of the reached node
 * @param hops   shortest distance from the start node, at least 1
 */
public record GraphNeighbor(int nodeId, int hops) {

    public GraphNeighbor {
        if (hops < 1) {
            throw new IllegalArgumentException("hops must be at least 1, got " + hops);
        }
    }
}
