package com.kgraph.resolution.metrics;

import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;

import java.time.Duration;

/**
 * {@link MetricsService} that records nothing.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordChunkExtraction(String status, Duration duration) {
    }

    @Override
    public void recordIngestionDuration(Duration duration) {
    }

    @Override
    public void incrementMentionsExtracted(int count) {
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMerged(EntityType type, DecisionTier tier) {
    }

    @Override
    public void incrementMentionReplayed() {
    }

    @Override
    public void incrementMentionMalformed() {
    }

    @Override
    public void incrementTypeConflict(EntityType type) {
    }

    @Override
    public void incrementRetry(String operation) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordEmbeddingCacheHit() {
    }

    @Override
    public void recordEmbeddingCacheMiss() {
    }
}
