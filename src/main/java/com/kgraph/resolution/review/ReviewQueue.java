package com.kgraph.resolution.review;

import java.util.List;
import java.util.Optional;

/**
 * Storage for review items. Low-confidence merges and type conflicts end up here.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    Optional<ReviewItem> get(String reviewId);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    List<ReviewItem> getPendingByReason(ReviewReason reason);

    void approve(String reviewId, String reviewerId, String notes);

    void reject(String reviewId, String reviewerId, String notes);

    long countPending();
}
