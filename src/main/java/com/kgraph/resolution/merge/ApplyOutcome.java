package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.MergeDecision;
import com.kgraph.resolution.similarity.ResolutionDecision;

/**
 * What applying a decision did.
 *
 * @param entityId   canonical root the mention now maps to
 * @param kind       created, merged, or replayed (mention already applied)
 * @param tier       tier of the applied decision; null for replays
 * @param decision   the audit record appended, null for replays
 * @param resolution the resolver's decision, null for replays short-circuited before resolution
 */
public record ApplyOutcome(int entityId, Kind kind, DecisionTier tier, MergeDecision decision,
                           ResolutionDecision resolution) {

    public enum Kind {
        CREATED,
        MERGED,
        REPLAYED
    }

    public static ApplyOutcome replayed(int entityId) {
        return new ApplyOutcome(entityId, Kind.REPLAYED, null, null, null);
    }

    public boolean isReplay() {
        return kind == Kind.REPLAYED;
    }

    public boolean requiresReview() {
        return tier != null && tier.requiresReview();
    }
}
