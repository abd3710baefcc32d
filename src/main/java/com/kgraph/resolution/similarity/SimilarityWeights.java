package com.kgraph.resolution.similarity;

/**
 * Weights of the composite similarity score. Must be non-negative and sum to 1.0.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double jaroWinklerWeight,
        double tokenSetWeight,
        double embeddingWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || jaroWinklerWeight < 0 || tokenSetWeight < 0 || embeddingWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = levenshteinWeight + jaroWinklerWeight + tokenSetWeight + embeddingWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Lexical weights, token overlap dominant: 0.20 / 0.30 / 0.50 / 0.
     */
    public static SimilarityWeights defaults() {
        return new SimilarityWeights(0.20, 0.30, 0.50, 0.0);
    }

    /**
     * Weights used when an embedding function is configured: 0.15 / 0.20 / 0.35 / 0.30.
     */
    public static SimilarityWeights withEmbeddings() {
        return new SimilarityWeights(0.15, 0.20, 0.35, 0.30);
    }

    public boolean usesEmbeddings() {
        return embeddingWeight > 0.0;
    }
}
