package com.kgraph.resolution.similarity;

import java.util.Objects;

/**
 * Cosine similarity of embedding vectors, clamped to {@code [0, 1]}.
 */
public class EmbeddingSimilarity implements SimilarityAlgorithm {

    private final EmbeddingFunction embeddingFunction;

    public EmbeddingSimilarity(EmbeddingFunction embeddingFunction) {
        this.embeddingFunction = Objects.requireNonNull(embeddingFunction, "embeddingFunction is required");
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        return Math.max(0.0, cosine(embeddingFunction.embed(s1), embeddingFunction.embed(s2)));
    }

    @Override
    public String getName() {
        return "Embedding";
    }

    /**
     * Cosine of the angle between two vectors; 0.0 for empty, zero-length or mismatched vectors.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
