package com.kgraph.resolution.core.model;

/**
 * Confidence tier of a resolution decision.
 * Determines whether a candidate is merged and whether the merge is flagged.
 */
public enum DecisionTier {
    /**
     * Score at or above the high threshold. Merged automatically.
     */
    HIGH_CONFIDENCE,

    /**
     * Score between the mid and high thresholds.
     * Merged, but flagged for audit.
     */
    LOW_CONFIDENCE,

    /**
     * Score below the mid threshold. A new canonical entity is created.
     */
    NEW_ENTITY,

    /**
     * The only string match had a different entity type.
     * A new canonical entity is created and the pair is flagged for manual review.
     */
    TYPE_CONFLICT;

    public boolean isMerge() {
        return this == HIGH_CONFIDENCE || this == LOW_CONFIDENCE;
    }

    public boolean requiresReview() {
        return this == LOW_CONFIDENCE || this == TYPE_CONFLICT;
    }
}
