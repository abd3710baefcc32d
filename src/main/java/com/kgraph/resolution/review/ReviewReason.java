package com.kgraph.resolution.review;

/**
 * Why a decision was flagged for manual review.
 */
public enum ReviewReason {
    /**
     * The mention was merged with a score between the mid and high thresholds.
     */
    LOW_CONFIDENCE,

    /**
     * The mention's key names an entity of another type; a separate entity was created.
     */
    TYPE_CONFLICT
}
