package com.kgraph.resolution.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FalkorDbGraphStore Tests")
class FalkorDbGraphStoreTest {

    @Mock
    private GraphConnection connection;

    private FalkorDbGraphStore store;

    @BeforeEach
    void setUp() {
        store = new FalkorDbGraphStore(connection);
    }

    @Test
    @DisplayName("Node upserts should MERGE on id and SET every attribute")
    @SuppressWarnings("unchecked")
    void upsertNode() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("label", "Apple Inc.");
        attributes.put("mentionCount", 3);

        store.upsertNode(1, attributes);

        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(query.capture(), params.capture());
        assertEquals("MERGE (e:Entity {id: $id}) SET e.label = $n_label, e.mentionCount = $n_mentionCount",
                query.getValue());
        assertEquals(Map.of("id", 1, "n_label", "Apple Inc.", "n_mentionCount", 3), params.getValue());
    }

    @Test
    @DisplayName("Edge upserts should MERGE a typed relationship between existing nodes")
    @SuppressWarnings("unchecked")
    void upsertEdge() {
        store.upsertEdge(3, 7, "WORKS_FOR", Map.of("provenance", List.of("doc@0-8")));

        ArgumentCaptor<String> query = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(query.capture(), params.capture());
        assertTrue(query.getValue().contains("MERGE (a)-[r:WORKS_FOR]->(b) SET r.provenance = $r_provenance"));
        assertEquals(3, params.getValue().get("fromId"));
        assertEquals(7, params.getValue().get("toId"));
    }

    @Test
    @DisplayName("Edge removal should DELETE only the typed relationship")
    void removeEdge() {
        store.removeEdge(3, 7, "WORKS_FOR");

        verify(connection).execute(contains("-[r:WORKS_FOR]->(b:Entity {id: $toId})\nDELETE r"),
                eq(Map.of("fromId", 3, "toId", 7)));
        assertThrows(IllegalArgumentException.class, () -> store.removeEdge(3, 7, "KNOWS]-() DETACH DELETE"));
    }

    @Test
    @DisplayName("Unsafe predicates and property keys should never reach the database")
    void rejectsUnsafeInput() {
        assertThrows(IllegalArgumentException.class,
                () -> store.upsertEdge(1, 2, "KNOWS]->(x) DELETE x //", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> store.upsertNode(1, Map.of("label = 'x', e.id", "y")));
        verifyNoInteractions(connection);
    }

    @Test
    @DisplayName("Traversal should map rows to neighbors")
    void query() {
        when(connection.query(contains("[*1..2]"), eq(Map.of("id", 1)))).thenReturn(List.of(
                Map.of("id", 2L, "hops", 1L),
                Map.of("id", 5L, "hops", 2L)));

        assertEquals(List.of(new GraphNeighbor(2, 1), new GraphNeighbor(5, 2)), store.query(1, 2));
        assertTrue(store.query(1, 0).isEmpty());
    }

    @Test
    @DisplayName("containsNode should count matching nodes")
    void containsNode() {
        when(connection.query(anyString(), eq(Map.of("id", 1)))).thenReturn(List.of(Map.of("c", 1L)));
        when(connection.query(anyString(), eq(Map.of("id", 2)))).thenReturn(List.of(Map.of("c", 0L)));

        assertTrue(store.containsNode(1));
        assertFalse(store.containsNode(2));
    }

    @Test
    @DisplayName("I/O failures should be reported as transient")
    void ioFailureIsTransient() {
        doThrow(new RuntimeException("write failed", new UncheckedIOException(new IOException("connection reset"))))
                .when(connection).execute(anyString(), anyMap());

        assertThrows(TransientStoreException.class, () -> store.upsertNode(1, Map.of()));
    }

    @Test
    @DisplayName("Other failures should propagate unchanged")
    void otherFailurePropagates() {
        IllegalStateException failure = new IllegalStateException("syntax error");
        doThrow(failure).when(connection).execute(anyString(), anyMap());

        assertSame(failure, assertThrows(IllegalStateException.class, () -> store.upsertNode(1, Map.of())));
    }
}
