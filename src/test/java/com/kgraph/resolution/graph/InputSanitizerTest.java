package com.kgraph.resolution.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputSanitizer validation utility.
 */
class InputSanitizerTest {

    // ========== validateRelationshipType ==========

    @Test
    void validateRelationshipType_rejectsNullAndBlank() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType(""));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("   "));
    }

    @Test
    void validateRelationshipType_rejectsSpecialCharacters() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("WORKS-FOR"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("WORKS FOR"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("type; DROP"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRelationshipType("type'x"));
    }

    @Test
    void validateRelationshipType_acceptsValidTypes() {
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType("CEO_OF"));
        assertDoesNotThrow(() -> InputSanitizer.validateRelationshipType("ACQUIRED_2014"));
    }

    // ========== validatePropertyKey ==========

    @Test
    void validatePropertyKey_acceptsIdentifiers() {
        assertDoesNotThrow(() -> InputSanitizer.validatePropertyKey("mentionCount"));
        assertDoesNotThrow(() -> InputSanitizer.validatePropertyKey("_internal"));
    }

    @Test
    void validatePropertyKey_rejectsOthers() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validatePropertyKey(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validatePropertyKey("1st"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validatePropertyKey("a.b"));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validatePropertyKey("a b"));
    }

    // ========== sanitizeForCypher ==========

    @Test
    void sanitizeForCypher_acceptsNullAndMaxLength() {
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForCypher(null));
        assertDoesNotThrow(() -> InputSanitizer.sanitizeForCypher("A".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH)));
    }

    @Test
    void sanitizeForCypher_rejectsOverMaxLength() {
        String longValue = "A".repeat(InputSanitizer.MAX_CYPHER_VALUE_LENGTH + 1);
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.sanitizeForCypher(longValue));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.sanitizeForCypher(List.of("short", longValue)));
    }
}
