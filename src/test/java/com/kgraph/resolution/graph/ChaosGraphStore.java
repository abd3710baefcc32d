package com.kgraph.resolution.graph;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator around a {@link GraphStore} that injects write failures for resilience testing.
 * Injected failures are {@link TransientStoreException}s, so callers retry them.
 */
public class ChaosGraphStore implements GraphStore {

    private final GraphStore delegate;
    private final Set<Integer> failingNodes = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean failEdges = new AtomicBoolean(false);
    private final AtomicInteger nodeWrites = new AtomicInteger();
    private final AtomicInteger edgeWrites = new AtomicInteger();

    public ChaosGraphStore(GraphStore delegate) {
        this.delegate = delegate;
    }

    /**
     * Makes every write of the given node fail until {@link #reset()}.
     */
    public void failNode(int id) {
        failingNodes.add(id);
    }

    /**
     * When enabled, all upsertEdge() calls fail.
     */
    public void setFailEdges(boolean fail) {
        failEdges.set(fail);
    }

    public void reset() {
        failingNodes.clear();
        failEdges.set(false);
    }

    public int getNodeWrites() {
        return nodeWrites.get();
    }

    public int getEdgeWrites() {
        return edgeWrites.get();
    }

    @Override
    public void upsertNode(int id, Map<String, Object> attributes) {
        nodeWrites.incrementAndGet();
        if (failingNodes.contains(id)) {
            throw new TransientStoreException("ChaosGraphStore: simulated failure writing node " + id, null);
        }
        delegate.upsertNode(id, attributes);
    }

    @Override
    public void upsertEdge(int fromId, int toId, String predicate, Map<String, Object> attributes) {
        edgeWrites.incrementAndGet();
        if (failEdges.get()) {
            throw new TransientStoreException("ChaosGraphStore: simulated edge failure", null);
        }
        delegate.upsertEdge(fromId, toId, predicate, attributes);
    }

    @Override
    public void removeEdge(int fromId, int toId, String predicate) {
        if (failEdges.get()) {
            throw new TransientStoreException("ChaosGraphStore: simulated edge failure", null);
        }
        delegate.removeEdge(fromId, toId, predicate);
    }

    @Override
    public List<GraphNeighbor> query(int nodeId, int depth) {
        return delegate.query(nodeId, depth);
    }

    @Override
    public boolean containsNode(int id) {
        return delegate.containsNode(id);
    }
}
