package com.kgraph.resolution.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link GraphStore} kept in memory. Used in tests and for embedded pipelines.
 */
public class InMemoryGraphStore implements GraphStore {

    /**
     * A stored edge.
     */
    public record Edge(int fromId, String predicate, int toId, Map<String, Object> attributes) {
        public String key() {
            return fromId + "-" + predicate + "->" + toId;
        }
    }

    private final Map<Integer, Map<String, Object>> nodes = new ConcurrentHashMap<>();
    private final Map<String, Edge> edges = new ConcurrentHashMap<>();
    private final Map<Integer, Set<Integer>> adjacency = new ConcurrentHashMap<>();

    @Override
    public void upsertNode(int id, Map<String, Object> attributes) {
        nodes.put(id, Map.copyOf(attributes));
    }

    @Override
    public synchronized void upsertEdge(int fromId, int toId, String predicate, Map<String, Object> attributes) {
        if (!nodes.containsKey(fromId) || !nodes.containsKey(toId)) {
            throw new IllegalStateException("Cannot add edge " + fromId + "-" + predicate + "->" + toId
                    + ": missing endpoint node");
        }
        Edge edge = new Edge(fromId, predicate, toId, Map.copyOf(attributes));
        edges.put(edge.key(), edge);
        adjacency.computeIfAbsent(fromId, k -> ConcurrentHashMap.newKeySet()).add(toId);
        adjacency.computeIfAbsent(toId, k -> ConcurrentHashMap.newKeySet()).add(fromId);
    }

    @Override
    public synchronized void removeEdge(int fromId, int toId, String predicate) {
        if (edges.remove(fromId + "-" + predicate + "->" + toId) == null) {
            return;
        }
        boolean stillLinked = edges.values().stream().anyMatch(edge ->
                (edge.fromId() == fromId && edge.toId() == toId) || (edge.fromId() == toId && edge.toId() == fromId));
        if (!stillLinked) {
            unlink(fromId, toId);
            unlink(toId, fromId);
        }
    }

    private void unlink(int nodeId, int neighborId) {
        Set<Integer> neighbors = adjacency.get(nodeId);
        if (neighbors != null) {
            neighbors.remove(neighborId);
            if (neighbors.isEmpty()) {
                adjacency.remove(nodeId);
            }
        }
    }

    @Override
    public List<GraphNeighbor> query(int nodeId, int depth) {
        if (depth <= 0 || !nodes.containsKey(nodeId)) {
            return List.of();
        }
        Map<Integer, Integer> distances = new LinkedHashMap<>();
        distances.put(nodeId, 0);
        Deque<Integer> frontier = new ArrayDeque<>();
        frontier.add(nodeId);
        while (!frontier.isEmpty()) {
            int current = frontier.poll();
            int hops = distances.get(current);
            if (hops == depth) {
                continue;
            }
            for (int next : adjacency.getOrDefault(current, Set.of())) {
                if (!distances.containsKey(next)) {
                    distances.put(next, hops + 1);
                    frontier.add(next);
                }
            }
        }
        List<GraphNeighbor> neighbors = new ArrayList<>(distances.size() - 1);
        for (Map.Entry<Integer, Integer> entry : distances.entrySet()) {
            if (entry.getKey() != nodeId) {
                neighbors.add(new GraphNeighbor(entry.getKey(), entry.getValue()));
            }
        }
        return neighbors;
    }

    @Override
    public boolean containsNode(int id) {
        return nodes.containsKey(id);
    }

    public Optional<Map<String, Object>> getNode(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<Edge> getEdges() {
        return new ArrayList<>(edges.values());
    }

    public List<Edge> edgesFrom(int fromId) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges.values()) {
            if (edge.fromId() == fromId) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Ids linked to {@code nodeId} by an edge in either direction.
     */
    public Set<Integer> neighborsOf(int nodeId) {
        return Set.copyOf(adjacency.getOrDefault(nodeId, Set.of()));
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Copy of all node attributes, keyed by node id.
     */
    public Map<Integer, Map<String, Object>> getNodes() {
        return new HashMap<>(nodes);
    }
}
