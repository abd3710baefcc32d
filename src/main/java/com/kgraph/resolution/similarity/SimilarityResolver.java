package com.kgraph.resolution.similarity;

import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.metrics.MetricsService;
import com.kgraph.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a candidate refers to an existing canonical entity.
 *
 * <p>Only entities of the candidate's blocking bucket are scored. An entity's score is the best
 * composite score over its alias keys; an alias key equal to the candidate key scores 1.0.
 * The best entity wins on score, then on total mention count, then on the lower id.
 * Entities of another type are never merge targets. When nothing in the bucket reaches the
 * mid threshold but an entity of another type has exactly the candidate's key, the decision
 * is {@link DecisionTier#TYPE_CONFLICT}.</p>
 */
public class SimilarityResolver {
    private static final Logger log = LoggerFactory.getLogger(SimilarityResolver.class);

    private static final Comparator<Scored> BEST_FIRST = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparing(Comparator.comparingInt((Scored s) -> s.entity().getMentionCount()).reversed())
            .thenComparingInt(s -> s.entity().getId());

    private final CompositeSimilarityScorer scorer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final ResolutionOptions options;
    private final MetricsService metricsService;

    public SimilarityResolver() {
        this(new CompositeSimilarityScorer(), new TokenPrefixBlockingKeyStrategy(), ResolutionOptions.defaults(),
                new NoOpMetricsService());
    }

    public SimilarityResolver(CompositeSimilarityScorer scorer, BlockingKeyStrategy blockingKeyStrategy,
                              ResolutionOptions options, MetricsService metricsService) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.blockingKeyStrategy = Objects.requireNonNull(blockingKeyStrategy, "blockingKeyStrategy is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public String blockingKey(Candidate candidate) {
        return blockingKeyStrategy.blockingKey(candidate.entityType(), candidate.normalizedKey());
    }

    public ResolutionDecision resolve(Candidate candidate, RegistrySnapshot snapshot) {
        String blockingKey = blockingKey(candidate);

        Optional<Scored> best = snapshot.entitiesInBlock(blockingKey).stream()
                .filter(entity -> entity.getType() == candidate.entityType())
                .map(entity -> score(candidate, entity))
                .min(BEST_FIRST);

        double bestScore = best.map(Scored::score).orElse(0.0);
        if (best.isPresent()) {
            metricsService.recordSimilarityScore(bestScore);
        }

        if (best.isPresent() && bestScore >= options.getMidThreshold()) {
            Scored match = best.get();
            DecisionTier tier = bestScore >= options.getHighThreshold()
                    ? DecisionTier.HIGH_CONFIDENCE : DecisionTier.LOW_CONFIDENCE;
            String reasoning = String.format("matched '%s' (entity %d, alias key '%s') with score %.3f",
                    match.entity().getPrimaryLabel(), match.entity().getId(), match.aliasKey(), bestScore);
            log.debug("resolve.merge mentionId={} key='{}' targetEntityId={} score={} tier={}",
                    candidate.mentionId(), candidate.normalizedKey(), match.entity().getId(), bestScore, tier);
            return ResolutionDecision.mergeInto(candidate, match.entity().getId(), bestScore, tier, blockingKey,
                    reasoning);
        }

        Optional<CanonicalEntity> conflict = snapshot.entitiesWithKey(candidate.normalizedKey()).stream()
                .filter(entity -> entity.getType() != candidate.entityType())
                .min(Comparator.comparingInt(CanonicalEntity::getId));
        if (conflict.isPresent()) {
            CanonicalEntity other = conflict.get();
            log.info("resolve.type_conflict mentionId={} key='{}' candidateType={} conflictingEntityId={} conflictingType={}",
                    candidate.mentionId(), candidate.normalizedKey(), candidate.entityType(),
                    other.getId(), other.getType());
            return ResolutionDecision.typeConflict(candidate, other.getId(), blockingKey,
                    "key '" + candidate.normalizedKey() + "' already names entity " + other.getId()
                            + " of type " + other.getType() + ", candidate type is " + candidate.entityType());
        }

        log.debug("resolve.create mentionId={} key='{}' bestScore={}", candidate.mentionId(),
                candidate.normalizedKey(), bestScore);
        String reasoning = best.isPresent()
                ? String.format("best match '%s' scored %.3f, below %.2f",
                best.get().entity().getPrimaryLabel(), bestScore, options.getMidThreshold())
                : "no entity in bucket " + blockingKey;
        return ResolutionDecision.createNew(candidate, bestScore, blockingKey, reasoning);
    }

    private Scored score(Candidate candidate, CanonicalEntity entity) {
        String key = candidate.normalizedKey();
        if (entity.getAliasKeys().contains(key)) {
            return new Scored(entity, key, 1.0);
        }
        String bestAlias = null;
        double bestScore = 0.0;
        for (String aliasKey : entity.getAliasKeys()) {
            double score = scorer.compute(key, aliasKey);
            if (bestAlias == null || score > bestScore) {
                bestAlias = aliasKey;
                bestScore = score;
            }
        }
        return new Scored(entity, bestAlias, bestScore);
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public CompositeSimilarityScorer getScorer() {
        return scorer;
    }

    private record Scored(CanonicalEntity entity, String aliasKey, double score) {
    }
}
