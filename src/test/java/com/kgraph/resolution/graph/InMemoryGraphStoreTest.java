package com.kgraph.resolution.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryGraphStore Tests")
class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        for (int id = 1; id <= 5; id++) {
            store.upsertNode(id, Map.of("label", "node-" + id));
        }
        // 1 -> 2 -> 3 -> 4, 5 -> 1
        store.upsertEdge(1, 2, "KNOWS", Map.of());
        store.upsertEdge(2, 3, "KNOWS", Map.of());
        store.upsertEdge(3, 4, "KNOWS", Map.of());
        store.upsertEdge(5, 1, "WORKS_FOR", Map.of());
    }

    @Test
    @DisplayName("Traversal should follow edges both ways and report shortest hops")
    void traversal() {
        List<GraphNeighbor> neighbors = store.query(1, 2);

        assertEquals(List.of(new GraphNeighbor(2, 1), new GraphNeighbor(5, 1), new GraphNeighbor(3, 2)),
                neighbors.stream().sorted(Comparator.comparingInt(GraphNeighbor::hops)
                        .thenComparingInt(GraphNeighbor::nodeId)).toList());
    }

    @Test
    @DisplayName("Traversal should exclude the start node and stop at the depth")
    void depthLimit() {
        assertTrue(store.query(4, 3).stream().noneMatch(n -> n.nodeId() == 4));
        assertEquals(3, store.query(4, 3).size());
        assertEquals(4, store.query(4, 4).size());
        assertTrue(store.query(1, 0).isEmpty());
        assertTrue(store.query(99, 2).isEmpty());
    }

    @Test
    @DisplayName("Upserting should replace attributes without duplicating")
    void upsertReplaces() {
        store.upsertNode(1, Map.of("label", "renamed"));
        store.upsertEdge(1, 2, "KNOWS", Map.of("since", 2020));

        assertEquals("renamed", store.getNode(1).orElseThrow().get("label"));
        assertEquals(5, store.nodeCount());
        assertEquals(4, store.edgeCount());
        assertEquals(2020, store.edgesFrom(1).get(0).attributes().get("since"));
    }

    @Test
    @DisplayName("Edges should require both endpoint nodes")
    void missingEndpoint() {
        assertThrows(IllegalStateException.class, () -> store.upsertEdge(1, 42, "KNOWS", Map.of()));
        assertTrue(store.containsNode(1));
        assertFalse(store.containsNode(42));
    }

    @Test
    @DisplayName("Removing an edge should unlink its endpoints unless another edge joins them")
    void removeEdge() {
        store.upsertEdge(2, 1, "FOLLOWS", Map.of());

        store.removeEdge(1, 2, "KNOWS");
        assertEquals(4, store.edgeCount());
        assertEquals(Set.of(1, 3), store.neighborsOf(2));

        store.removeEdge(2, 1, "FOLLOWS");
        assertEquals(Set.of(3), store.neighborsOf(2));
        assertTrue(store.query(1, 3).stream().noneMatch(n -> n.nodeId() == 2));

        store.removeEdge(1, 2, "KNOWS");
        assertEquals(3, store.edgeCount());
    }
}
