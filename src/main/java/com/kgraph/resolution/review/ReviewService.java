package com.kgraph.resolution.review;

import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.merge.ApplyOutcome;
import com.kgraph.resolution.merge.MergeEngine;
import com.kgraph.resolution.similarity.ResolutionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Files flagged decisions and carries out reviewers' verdicts.
 *
 * <p>Approving a type conflict merges the new entity into the conflicting one with a type
 * override. Approving a low-confidence merge confirms it. Rejecting either is recorded only;
 * merges are never split.</p>
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final MergeEngine mergeEngine;

    public ReviewService(ReviewQueue reviewQueue, MergeEngine mergeEngine) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
    }

    /**
     * Files a review item for an applied decision that needs one.
     *
     * @return the filed item, or empty when the outcome needs no review
     */
    public Optional<ReviewItem> flag(ApplyOutcome outcome) {
        if (outcome.isReplay() || !outcome.requiresReview() || outcome.resolution() == null) {
            return Optional.empty();
        }
        ResolutionDecision decision = outcome.resolution();
        boolean conflict = outcome.tier() == DecisionTier.TYPE_CONFLICT;
        ReviewItem item = ReviewItem.builder()
                .reason(conflict ? ReviewReason.TYPE_CONFLICT : ReviewReason.LOW_CONFIDENCE)
                .mentionId(decision.candidate().mentionId())
                .surfaceForm(decision.candidate().surfaceForm())
                .entityType(decision.candidate().entityType())
                .entityId(outcome.entityId())
                .relatedEntityId(conflict ? decision.conflictingEntityId() : outcome.entityId())
                .score(decision.score())
                .build();
        return Optional.of(submitForReview(item));
    }

    public ReviewItem submitForReview(ReviewItem item) {
        ReviewItem submitted = reviewQueue.submit(item);
        log.info("review.submitted reviewItemId={} reason={} mentionId={} entityId={} relatedEntityId={} score={}",
                submitted.getId(), item.getReason(), item.getMentionId(), item.getEntityId(),
                item.getRelatedEntityId(), item.getScore());
        return submitted;
    }

    /**
     * Approves an item. For a type conflict the two entities are merged, the conflicting
     * (older) entity surviving. If the merge fails the item stays pending.
     *
     * @return the entity the mention now belongs to
     */
    public Optional<CanonicalEntity> approve(String reviewId, String reviewerId, String notes) {
        ReviewItem item = pendingItem(reviewId);

        Optional<CanonicalEntity> result;
        if (item.getReason() == ReviewReason.TYPE_CONFLICT) {
            result = Optional.of(mergeEngine.mergeEntities(item.getEntityId(), item.getRelatedEntityId(),
                    reviewerId, true));
        } else {
            result = mergeEngine.getEntity(item.getEntityId());
        }
        // only a merge that went through closes the item
        reviewQueue.approve(reviewId, reviewerId, notes);
        log.info("review.approved reviewItemId={} reason={} reviewer={} entityId={}", reviewId, item.getReason(),
                reviewerId, result.map(CanonicalEntity::getId).orElse(null));
        return result;
    }

    public void reject(String reviewId, String reviewerId, String notes) {
        ReviewItem item = pendingItem(reviewId);
        reviewQueue.reject(reviewId, reviewerId, notes);
        log.info("review.rejected reviewItemId={} reason={} reviewer={} entityId={}", reviewId, item.getReason(),
                reviewerId, item.getEntityId());
    }

    public List<ReviewItem> getPendingReviews() {
        return reviewQueue.getPending();
    }

    public List<ReviewItem> getPendingReviews(ReviewReason reason) {
        return reviewQueue.getPendingByReason(reason);
    }

    public Optional<ReviewItem> getReviewItem(String reviewId) {
        return reviewQueue.get(reviewId);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private ReviewItem pendingItem(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId)
                .orElseThrow(() -> new IllegalArgumentException("Review item not found: " + reviewId));
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
