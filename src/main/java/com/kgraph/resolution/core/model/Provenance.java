package com.kgraph.resolution.core.model;

import java.util.Objects;

/**
 * Where a mention that resolved to a canonical entity came from.
 */
public record Provenance(String documentId, String mentionId, int startOffset, int endOffset) {

    public Provenance {
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(mentionId, "mentionId is required");
    }

    public static Provenance of(RawMention mention) {
        return new Provenance(mention.documentId(), mention.mentionId(),
                mention.startOffset(), mention.endOffset());
    }
}
