package com.kgraph.resolution.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ReviewQueue} kept in memory.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("Submitted review item {} (reason={}, mention={}, entity={}, related={})",
                item.getId(), item.getReason(), item.getMentionId(), item.getEntityId(), item.getRelatedEntityId());
        return item;
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public List<ReviewItem> getPendingByReason(ReviewReason reason) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> item.getReason() == reason)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        require(reviewId).markApproved(reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).markRejected(reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
