package com.kgraph.resolution.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable audit record of one applied resolution decision.
 * Part of the append-only decision log.
 *
 * @param id              record id
 * @param mentionId       id of the mention the candidate came from
 * @param surfaceForm     candidate surface form
 * @param normalizedKey   candidate comparison key
 * @param entityType      candidate type
 * @param matchedEntityId the canonical id the candidate resolved to, or null when a new entity was created
 * @param resultEntityId  the canonical id the mention maps to after the decision
 * @param score           similarity score behind the decision
 * @param tier            decision tier
 * @param reasoning       human-readable explanation
 * @param timestamp       when the decision was applied
 */
public record MergeDecision(
        String id,
        String mentionId,
        String surfaceForm,
        String normalizedKey,
        EntityType entityType,
        Integer matchedEntityId,
        int resultEntityId,
        double score,
        DecisionTier tier,
        String reasoning,
        Instant timestamp
) {
    public static final String NEW_ENTITY = "new";

    public MergeDecision {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(mentionId, "mentionId is required");
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    /**
     * The matched entity id rendered for the audit trail, or {@code "new"}.
     */
    public String matchedEntityLabel() {
        return matchedEntityId != null ? String.valueOf(matchedEntityId) : NEW_ENTITY;
    }

    public boolean isMerge() {
        return matchedEntityId != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String mentionId;
        private String surfaceForm;
        private String normalizedKey;
        private EntityType entityType;
        private Integer matchedEntityId;
        private int resultEntityId;
        private double score;
        private DecisionTier tier;
        private String reasoning;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder candidate(Candidate candidate) {
            this.mentionId = candidate.mentionId();
            this.surfaceForm = candidate.surfaceForm();
            this.normalizedKey = candidate.normalizedKey();
            this.entityType = candidate.entityType();
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

        public Builder normalizedKey(String normalizedKey) {
            this.normalizedKey = normalizedKey;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder matchedEntityId(Integer matchedEntityId) {
            this.matchedEntityId = matchedEntityId;
            return this;
        }

        public Builder resultEntityId(int resultEntityId) {
            this.resultEntityId = resultEntityId;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder tier(DecisionTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeDecision build() {
            return new MergeDecision(id, mentionId, surfaceForm, normalizedKey, entityType,
                    matchedEntityId, resultEntityId, score, tier, reasoning, timestamp);
        }
    }
}
