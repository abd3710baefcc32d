package com.kgraph.resolution.audit;

import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.MergeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of every applied resolution decision.
 * Records are never modified or removed.
 */
public class DecisionLog {
    private static final Logger log = LoggerFactory.getLogger(DecisionLog.class);

    private final List<MergeDecision> records = new CopyOnWriteArrayList<>();

    public MergeDecision append(MergeDecision decision) {
        Objects.requireNonNull(decision, "decision is required");
        records.add(decision);
        log.debug("decision.recorded mentionId={} matched={} result={} tier={} score={}",
                decision.mentionId(), decision.matchedEntityLabel(), decision.resultEntityId(),
                decision.tier(), decision.score());
        return decision;
    }

    /**
     * All records in append order (immutable copy).
     */
    public List<MergeDecision> getAll() {
        return List.copyOf(records);
    }

    /**
     * Records whose mention resolved to, or was matched against, the given entity id.
     */
    public List<MergeDecision> forEntity(int entityId) {
        return records.stream()
                .filter(r -> r.resultEntityId() == entityId
                        || (r.matchedEntityId() != null && r.matchedEntityId() == entityId))
                .toList();
    }

    public List<MergeDecision> forMention(String mentionId) {
        return records.stream()
                .filter(r -> r.mentionId().equals(mentionId))
                .toList();
    }

    public List<MergeDecision> byTier(DecisionTier tier) {
        return records.stream()
                .filter(r -> r.tier() == tier)
                .toList();
    }

    public List<MergeDecision> between(Instant start, Instant end) {
        return records.stream()
                .filter(r -> !r.timestamp().isBefore(start) && !r.timestamp().isAfter(end))
                .toList();
    }

    public int size() {
        return records.size();
    }
}
