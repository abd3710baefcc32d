package com.kgraph.resolution.core.model;

import java.util.Objects;

/**
 * A normalized, not-yet-resolved mention awaiting a merge decision.
 *
 * @param normalizedKey comparison key (suffixes/honorifics stripped, folded)
 * @param surfaceForm   original surface form, never stripped
 * @param entityType    classified entity type
 * @param mention       the mention this candidate was produced from
 */
public record Candidate(
        String normalizedKey,
        String surfaceForm,
        EntityType entityType,
        RawMention mention
) {
    public Candidate {
        Objects.requireNonNull(normalizedKey, "normalizedKey is required");
        Objects.requireNonNull(surfaceForm, "surfaceForm is required");
        Objects.requireNonNull(entityType, "entityType is required");
        Objects.requireNonNull(mention, "mention is required");
    }

    public String mentionId() {
        return mention.mentionId();
    }

    public String documentId() {
        return mention.documentId();
    }
}
