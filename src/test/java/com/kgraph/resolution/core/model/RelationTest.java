package com.kgraph.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Relation Tests")
class RelationTest {

    @ParameterizedTest
    @CsvSource({
            "works for, WORKS_FOR",
            "  founded-by , FOUNDED_BY",
            "CEO of, CEO_OF",
            "located_in, LOCATED_IN",
            "'acquired (2014)', ACQUIRED_2014"
    })
    @DisplayName("Should turn free-form labels into predicates")
    void toPredicate(String label, String expected) {
        assertEquals(expected, Relation.toPredicate(label));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "--", "!!!"})
    @DisplayName("Should reject labels without usable characters")
    void toPredicateRejectsUnusable(String label) {
        assertThrows(IllegalArgumentException.class, () -> Relation.toPredicate(label));
    }

    @Test
    @DisplayName("Should upper-case the predicate")
    void upperCasesPredicate() {
        Relation relation = new Relation(1, "works_for", 2, Set.of("d@0-3"));
        assertEquals("WORKS_FOR", relation.predicate());
    }

    @Test
    @DisplayName("Should reject predicates that are not safe relationship types")
    void rejectsUnsafePredicate() {
        assertThrows(IllegalArgumentException.class,
                () -> new Relation(1, "WORKS FOR", 2, Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new Relation(1, "X]->(n) DETACH DELETE n//", 2, Set.of()));
    }

    @Test
    @DisplayName("Edge key should identify subject, predicate and object")
    void edgeKey() {
        Relation relation = new Relation(3, "WORKS_FOR", 7, null);
        assertEquals("3-WORKS_FOR->7", relation.edgeKey());
        assertTrue(relation.provenanceMentionIds().isEmpty());
    }

    @Test
    @DisplayName("withEndpoints should keep predicate and provenance")
    void withEndpoints() {
        Relation relation = new Relation(3, "WORKS_FOR", 7, Set.of("d@0-3", "d@10-15"));

        assertSame(relation, relation.withEndpoints(3, 7));

        Relation moved = relation.withEndpoints(4, 7);
        assertEquals(4, moved.subjectEntityId());
        assertEquals("WORKS_FOR", moved.predicate());
        assertEquals(relation.provenanceMentionIds(), moved.provenanceMentionIds());
    }

    @Test
    @DisplayName("Mention ids should be derived from document and span")
    void mentionIdIsDeterministic() {
        RawMention first = RawMention.of("doc-1", "Apple", 10, 15, "ORG", null);
        RawMention second = RawMention.of("doc-1", "Apple", 10, 15, "ORG", "context");

        assertEquals("doc-1@10-15", first.mentionId());
        assertEquals(first.mentionId(), second.mentionId());
        assertEquals("", first.context());
    }
}
