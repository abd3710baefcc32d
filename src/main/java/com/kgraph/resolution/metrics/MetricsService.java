package com.kgraph.resolution.metrics;

import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;

import java.time.Duration;

/**
 * Records ingestion and resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline runs
 * without a metrics backend configured.
 */
public interface MetricsService {

    void recordChunkExtraction(String status, Duration duration);

    void recordIngestionDuration(Duration duration);

    void incrementMentionsExtracted(int count);

    void incrementEntityCreated(EntityType type);

    void incrementEntityMerged(EntityType type, DecisionTier tier);

    void incrementMentionReplayed();

    void incrementMentionMalformed();

    void incrementTypeConflict(EntityType type);

    void incrementRetry(String operation);

    void recordSimilarityScore(double score);

    void recordEmbeddingCacheHit();

    void recordEmbeddingCacheMiss();
}
