package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.similarity.ResolutionDecision;
import com.kgraph.resolution.similarity.SimilarityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the canonical entity state. Callers submit candidates and get the outcome back as a future.
 *
 * <p>Each candidate is routed to the lane of its blocking key, where it is resolved against the
 * current registry and the decision applied, before the next candidate of that lane is looked at.
 * Two mentions of the same bucket can therefore never both create an entity for the same name.</p>
 */
public class EntityRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);

    private final MergeEngine mergeEngine;
    private final SimilarityResolver resolver;
    private final MergeLanes lanes;

    public EntityRegistry(MergeEngine mergeEngine, SimilarityResolver resolver, MergeLanes lanes) {
        this.mergeEngine = Objects.requireNonNull(mergeEngine, "mergeEngine is required");
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
        this.lanes = Objects.requireNonNull(lanes, "lanes is required");
    }

    /**
     * Resolves and applies one candidate on its lane.
     */
    public CompletableFuture<ApplyOutcome> submit(Candidate candidate) {
        String blockingKey = resolver.blockingKey(candidate);
        return lanes.submit(blockingKey, () -> resolveAndApply(candidate));
    }

    private ApplyOutcome resolveAndApply(Candidate candidate) {
        Optional<ApplyOutcome> replayed = mergeEngine.replay(candidate.mentionId());
        if (replayed.isPresent()) {
            return replayed.get();
        }
        ResolutionDecision decision = resolver.resolve(candidate, mergeEngine);
        ApplyOutcome outcome = mergeEngine.apply(decision);
        log.debug("registry.applied mentionId={} entityId={} kind={}", candidate.mentionId(),
                outcome.entityId(), outcome.kind());
        return outcome;
    }

    public Optional<CanonicalEntity> lookup(String mentionId) {
        return mergeEngine.lookup(mentionId);
    }

    public Optional<CanonicalEntity> getEntity(int entityId) {
        return mergeEngine.getEntity(entityId);
    }

    public List<CanonicalEntity> getEntities() {
        return mergeEngine.getEntities();
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    public SimilarityResolver getResolver() {
        return resolver;
    }

    @Override
    public void close() {
        lanes.close();
    }
}
