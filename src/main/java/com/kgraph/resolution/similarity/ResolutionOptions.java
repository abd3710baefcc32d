package com.kgraph.resolution.similarity;

import java.util.Objects;

/**
 * Decision thresholds and similarity weights of the resolver.
 * A score at or above {@code highThreshold} merges with high confidence, a score in
 * {@code [midThreshold, highThreshold)} merges with low confidence, anything lower creates a new entity.
 */
public class ResolutionOptions {

    private static final double DEFAULT_HIGH_THRESHOLD = 0.92;
    private static final double DEFAULT_MID_THRESHOLD = 0.80;

    private final double highThreshold;
    private final double midThreshold;
    private final SimilarityWeights similarityWeights;
    private final boolean explicitWeights;

    private ResolutionOptions(Builder builder) {
        this.highThreshold = builder.highThreshold;
        this.midThreshold = builder.midThreshold;
        this.similarityWeights = builder.similarityWeights != null
                ? builder.similarityWeights : SimilarityWeights.defaults();
        this.explicitWeights = builder.similarityWeights != null;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public double getMidThreshold() {
        return midThreshold;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    /**
     * Weights to score with. Unless weights were set explicitly, {@link SimilarityWeights#withEmbeddings()}
     * is used when an embedding function is available and {@link SimilarityWeights#defaults()} otherwise.
     */
    public SimilarityWeights effectiveWeights(boolean embeddingsAvailable) {
        if (explicitWeights || !embeddingsAvailable) {
            return similarityWeights;
        }
        return SimilarityWeights.withEmbeddings();
    }

    public boolean hasExplicitWeights() {
        return explicitWeights;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter options: fewer automatic merges, more new entities.
     */
    public static ResolutionOptions conservative() {
        return builder()
                .highThreshold(0.97)
                .midThreshold(0.90)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double highThreshold = DEFAULT_HIGH_THRESHOLD;
        private double midThreshold = DEFAULT_MID_THRESHOLD;
        private SimilarityWeights similarityWeights;

        public Builder highThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
            return this;
        }

        public Builder midThreshold(double midThreshold) {
            this.midThreshold = midThreshold;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = Objects.requireNonNull(similarityWeights, "similarityWeights is required");
            return this;
        }

        public ResolutionOptions build() {
            if (highThreshold < 0.0 || highThreshold > 1.0 || midThreshold < 0.0 || midThreshold > 1.0) {
                throw new IllegalArgumentException("Thresholds must be between 0.0 and 1.0");
            }
            if (midThreshold > highThreshold) {
                throw new IllegalArgumentException("midThreshold (" + midThreshold
                        + ") must not exceed highThreshold (" + highThreshold + ")");
            }
            return new ResolutionOptions(this);
        }
    }
}
