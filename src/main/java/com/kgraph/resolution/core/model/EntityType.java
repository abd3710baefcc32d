package com.kgraph.resolution.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Enumeration of entity types a mention can resolve to.
 * Extractors use many label vocabularies (CoNLL, OntoNotes, spaCy, GLiNER), so
 * {@link #fromLabel(String)} accepts the common spellings.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    LOCATION("Location"),
    PRODUCT("Product"),
    EVENT("Event"),
    CONCEPT("Concept"),
    UNKNOWN("Unknown");

    private static final Map<String, EntityType> ALIASES = Map.ofEntries(
            Map.entry("person", PERSON),
            Map.entry("per", PERSON),
            Map.entry("people", PERSON),
            Map.entry("organization", ORGANIZATION),
            Map.entry("organisation", ORGANIZATION),
            Map.entry("org", ORGANIZATION),
            Map.entry("company", ORGANIZATION),
            Map.entry("corporation", ORGANIZATION),
            Map.entry("location", LOCATION),
            Map.entry("loc", LOCATION),
            Map.entry("gpe", LOCATION),
            Map.entry("place", LOCATION),
            Map.entry("product", PRODUCT),
            Map.entry("work_of_art", PRODUCT),
            Map.entry("event", EVENT),
            Map.entry("concept", CONCEPT),
            Map.entry("misc", CONCEPT),
            Map.entry("technology", CONCEPT)
    );

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses an extractor-declared type label.
     *
     * @param label the declared label, may be null
     * @return the matching type, or empty when the label is absent or unknown
     */
    public static Optional<EntityType> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        EntityType type = ALIASES.get(key);
        if (type != null) {
            return Optional.of(type);
        }
        for (EntityType candidate : values()) {
            if (candidate != UNKNOWN && candidate.name().equalsIgnoreCase(key)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
