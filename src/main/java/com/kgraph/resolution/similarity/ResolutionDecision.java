package com.kgraph.resolution.similarity;

import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.DecisionTier;

import java.util.Objects;

/**
 * What to do with a candidate: merge it into an existing entity or create a new one.
 *
 * @param candidate           the candidate being resolved
 * @param action              merge or create
 * @param targetEntityId      entity to merge into, null for {@link Action#CREATE_NEW}
 * @param score               best similarity score found (0.0 when the bucket was empty)
 * @param tier                confidence tier
 * @param blockingKey         the bucket the candidate was resolved in
 * @param conflictingEntityId for {@link DecisionTier#TYPE_CONFLICT}, the entity of another type with the same key
 * @param reasoning           human-readable explanation
 */
public record ResolutionDecision(
        Candidate candidate,
        Action action,
        Integer targetEntityId,
        double score,
        DecisionTier tier,
        String blockingKey,
        Integer conflictingEntityId,
        String reasoning
) {
    public enum Action {
        MERGE_INTO,
        CREATE_NEW
    }

    public ResolutionDecision {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(tier, "tier is required");
        if (score < 0.0 || score > 1.0 + 1e-9) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        if (action == Action.MERGE_INTO && (targetEntityId == null || !tier.isMerge())) {
            throw new IllegalArgumentException("MERGE_INTO requires a target and a merge tier");
        }
        if (action == Action.CREATE_NEW && tier.isMerge()) {
            throw new IllegalArgumentException("CREATE_NEW cannot carry tier " + tier);
        }
    }

    public static ResolutionDecision mergeInto(Candidate candidate, int targetEntityId, double score,
                                               DecisionTier tier, String blockingKey, String reasoning) {
        return new ResolutionDecision(candidate, Action.MERGE_INTO, targetEntityId, Math.min(1.0, score), tier,
                blockingKey, null, reasoning);
    }

    public static ResolutionDecision createNew(Candidate candidate, double bestScore, String blockingKey,
                                               String reasoning) {
        return new ResolutionDecision(candidate, Action.CREATE_NEW, null, Math.min(1.0, bestScore),
                DecisionTier.NEW_ENTITY, blockingKey, null, reasoning);
    }

    public static ResolutionDecision typeConflict(Candidate candidate, int conflictingEntityId, String blockingKey,
                                                  String reasoning) {
        return new ResolutionDecision(candidate, Action.CREATE_NEW, null, 1.0, DecisionTier.TYPE_CONFLICT,
                blockingKey, conflictingEntityId, reasoning);
    }

    public boolean isMerge() {
        return action == Action.MERGE_INTO;
    }
}
