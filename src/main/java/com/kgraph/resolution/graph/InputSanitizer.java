package com.kgraph.resolution.graph;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Validation for values spliced into Cypher statements.
 */
public final class InputSanitizer {

    /** Maximum allowed length for Cypher string values. */
    public static final int MAX_CYPHER_VALUE_LENGTH = 4000;

    private static final Pattern RELATIONSHIP_TYPE = Pattern.compile("^[A-Za-z0-9_]+$");
    private static final Pattern PROPERTY_KEY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a relationship type. Only alphanumeric characters and underscores are allowed.
     *
     * @throws IllegalArgumentException if the type is invalid
     */
    public static void validateRelationshipType(String relationshipType) {
        if (relationshipType == null || relationshipType.isBlank()) {
            throw new IllegalArgumentException("Relationship type must not be null or blank");
        }
        if (!RELATIONSHIP_TYPE.matcher(relationshipType).matches()) {
            throw new IllegalArgumentException(
                    "Relationship type must contain only alphanumeric characters and underscores, " +
                            "got: '" + relationshipType + "'");
        }
    }

    /**
     * Validates a node or edge property name.
     *
     * @throws IllegalArgumentException if the key is not a plain identifier
     */
    public static void validatePropertyKey(String key) {
        if (key == null || !PROPERTY_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Property key must be a plain identifier, got: '" + key + "'");
        }
    }

    /**
     * Enforces the maximum length of string values, including strings inside collections.
     *
     * @throws IllegalArgumentException if a value exceeds the maximum length
     */
    public static void sanitizeForCypher(Object value) {
        if (value instanceof String s && s.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + s.length() + ")");
        }
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                sanitizeForCypher(element);
            }
        }
    }
}
