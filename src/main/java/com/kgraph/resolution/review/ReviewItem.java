package com.kgraph.resolution.review;

import com.kgraph.resolution.core.model.EntityType;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A flagged resolution decision awaiting a reviewer.
 *
 * <p>For {@link ReviewReason#LOW_CONFIDENCE} the mention was merged into {@code entityId}
 * and {@code relatedEntityId} is the same entity. For {@link ReviewReason#TYPE_CONFLICT} the
 * mention created {@code entityId} and {@code relatedEntityId} is the entity of the other type
 * sharing its key.</p>
 */
public class ReviewItem {

    private final String id;
    private final ReviewReason reason;
    private final String mentionId;
    private final String surfaceForm;
    private final EntityType entityType;
    private final int entityId;
    private final int relatedEntityId;
    private final double score;
    private final Instant submittedAt;
    private volatile ReviewStatus status;
    private volatile Instant reviewedAt;
    private volatile String reviewerId;
    private volatile String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.reason = Objects.requireNonNull(builder.reason, "reason is required");
        this.mentionId = Objects.requireNonNull(builder.mentionId, "mentionId is required");
        this.surfaceForm = builder.surfaceForm;
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.relatedEntityId = builder.relatedEntityId;
        this.score = builder.score;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public ReviewReason getReason() {
        return reason;
    }

    public String getMentionId() {
        return mentionId;
    }

    public String getSurfaceForm() {
        return surfaceForm;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public int getEntityId() {
        return entityId;
    }

    public int getRelatedEntityId() {
        return relatedEntityId;
    }

    public double getScore() {
        return score;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markApproved(String reviewerId, String notes) {
        mark(ReviewStatus.APPROVED, reviewerId, notes);
    }

    synchronized void markRejected(String reviewerId, String notes) {
        mark(ReviewStatus.REJECTED, reviewerId, notes);
    }

    private void mark(ReviewStatus newStatus, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.reviewedAt = Instant.now();
        this.status = newStatus;
    }

    @Override
    public String toString() {
        return "ReviewItem{id='" + id + "', reason=" + reason + ", mentionId='" + mentionId
                + "', entityId=" + entityId + ", relatedEntityId=" + relatedEntityId
                + ", score=" + score + ", status=" + status + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private ReviewReason reason;
        private String mentionId;
        private String surfaceForm;
        private EntityType entityType;
        private int entityId;
        private int relatedEntityId;
        private double score;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder reason(ReviewReason reason) {
            this.reason = reason;
            return this;
        }

        public Builder mentionId(String mentionId) {
            this.mentionId = mentionId;
            return this;
        }

        public Builder surfaceForm(String surfaceForm) {
            this.surfaceForm = surfaceForm;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(int entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder relatedEntityId(int relatedEntityId) {
            this.relatedEntityId = relatedEntityId;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
