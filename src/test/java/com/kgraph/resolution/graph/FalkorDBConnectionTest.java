package com.kgraph.resolution.graph;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the parameter substitution of FalkorDBConnection.
 */
class FalkorDBConnectionTest {

    @Test
    void processParams_replacesLongerNamesFirst() {
        String query = FalkorDBConnection.processParams("MATCH (e {id: $id}) WHERE e.x IN $idList",
                Map.of("id", 1, "idList", List.of(1, 2)));

        assertEquals("MATCH (e {id: 1}) WHERE e.x IN [1, 2]", query);
    }

    @Test
    void formatValue_quotesAndEscapesStrings() {
        assertEquals("'O\\'Brien'", FalkorDBConnection.formatValue("O'Brien"));
        assertEquals("'a\\\\b'", FalkorDBConnection.formatValue("a\\b"));
    }

    @Test
    void formatValue_keepsNumbersBooleansAndNull() {
        assertEquals("42", FalkorDBConnection.formatValue(42));
        assertEquals("0.5", FalkorDBConnection.formatValue(0.5));
        assertEquals("true", FalkorDBConnection.formatValue(true));
        assertEquals("null", FalkorDBConnection.formatValue(null));
    }

    @Test
    void formatValue_formatsNestedCollections() {
        assertEquals("['doc-1', null, 3]", FalkorDBConnection.formatValue(Arrays.asList("doc-1", null, 3)));
    }
}
