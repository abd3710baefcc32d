package com.kgraph.resolution.core.model;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A relation between two canonical entities, as supplied by the extractor.
 * Only valid once both endpoints are resolved to canonical ids.
 *
 * @param subjectEntityId      canonical id of the subject
 * @param predicate            relation label, upper-cased ({@code [A-Z0-9_]+})
 * @param objectEntityId       canonical id of the object
 * @param provenanceMentionIds ids of the mentions the relation was extracted from
 */
public record Relation(
        int subjectEntityId,
        String predicate,
        int objectEntityId,
        Set<String> provenanceMentionIds
) {
    private static final Pattern PREDICATE_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

    public Relation {
        Objects.requireNonNull(predicate, "predicate is required");
        if (!PREDICATE_PATTERN.matcher(predicate).matches()) {
            throw new IllegalArgumentException(
                    "Predicate must contain only alphanumeric characters and underscores, got: '" + predicate + "'");
        }
        predicate = predicate.toUpperCase(Locale.ROOT);
        provenanceMentionIds = provenanceMentionIds != null
                ? Set.copyOf(new LinkedHashSet<>(provenanceMentionIds)) : Set.of();
    }

    /**
     * Turns a free-form extractor label ("works for") into a predicate ("WORKS_FOR").
     */
    public static String toPredicate(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Relation label must not be null or blank");
        }
        String predicate = label.trim().replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        if (predicate.isEmpty()) {
            throw new IllegalArgumentException("Relation label has no usable characters: '" + label + "'");
        }
        return predicate.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns a copy pointing at the given endpoints, used when endpoints were merged.
     */
    public Relation withEndpoints(int subjectId, int objectId) {
        if (subjectId == subjectEntityId && objectId == objectEntityId) {
            return this;
        }
        return new Relation(subjectId, predicate, objectId, provenanceMentionIds);
    }

    /**
     * Identity of the edge in the graph store: one edge per (subject, predicate, object).
     */
    public String edgeKey() {
        return subjectEntityId + "-" + predicate + "->" + objectEntityId;
    }
}
