package com.kgraph.resolution.extraction;

import java.util.Objects;

/**
 * A relation between two mentions of the same document, before resolution.
 */
public record MentionRelation(String subjectMentionId, String predicate, String objectMentionId) {

    public MentionRelation {
        Objects.requireNonNull(subjectMentionId, "subjectMentionId is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(objectMentionId, "objectMentionId is required");
    }
}
