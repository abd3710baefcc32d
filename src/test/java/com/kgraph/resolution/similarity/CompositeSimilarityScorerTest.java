package com.kgraph.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompositeSimilarityScorer Tests")
class CompositeSimilarityScorerTest {

    private final CompositeSimilarityScorer scorer = new CompositeSimilarityScorer();
    private final ResolutionOptions options = ResolutionOptions.defaults();

    @Test
    @DisplayName("Identical keys should score 1.0")
    void identical() {
        assertEquals(1.0, scorer.compute("apple", "apple"));
    }

    @Test
    @DisplayName("Short and long forms of a name should land between the thresholds")
    void nameVariantIsLowConfidence() {
        CompositeSimilarityScorer.SimilarityBreakdown breakdown =
                scorer.computeWithBreakdown("tim cook", "timothy cook");

        assertEquals(0.849, breakdown.compositeScore(), 0.005);
        assertTrue(breakdown.compositeScore() >= options.getMidThreshold());
        assertTrue(breakdown.compositeScore() < options.getHighThreshold());
        assertEquals(0.0, breakdown.embeddingScore());
    }

    @Test
    @DisplayName("A name that merely starts like another should stay below the mid threshold")
    void prefixOnlyStaysBelowThreshold() {
        assertTrue(scorer.compute("apple", "applebees") < options.getMidThreshold());
        assertTrue(scorer.compute("microsoft", "apple") < 0.5);
    }

    @Test
    @DisplayName("Composite should be the weighted sum of its parts")
    void weightedSum() {
        CompositeSimilarityScorer.SimilarityBreakdown b = scorer.computeWithBreakdown("jon smith", "john smith");
        double expected = 0.20 * b.levenshteinScore() + 0.30 * b.jaroWinklerScore() + 0.50 * b.tokenSetScore();
        assertEquals(expected, b.compositeScore(), 1e-9);
    }

    @Test
    @DisplayName("Embedding weight should pull in the embedding signal")
    void embeddingSignal() {
        EmbeddingFunction sameVector = text -> new float[]{1f, 1f, 0f};
        CompositeSimilarityScorer withEmbeddings =
                new CompositeSimilarityScorer(SimilarityWeights.withEmbeddings(), sameVector);

        CompositeSimilarityScorer.SimilarityBreakdown b = withEmbeddings.computeWithBreakdown("ibm", "big blue");

        assertEquals(1.0, b.embeddingScore(), 1e-9);
        assertTrue(b.compositeScore() >= 0.30);
    }

    @Test
    @DisplayName("Embedding weight without an embedding function should be rejected")
    void embeddingWeightRequiresFunction() {
        assertThrows(IllegalArgumentException.class,
                () -> new CompositeSimilarityScorer(SimilarityWeights.withEmbeddings(), null));
    }

    @Test
    @DisplayName("Null input should score zero")
    void nullInput() {
        assertEquals(0.0, scorer.compute(null, "apple"));
    }

    @Test
    @DisplayName("Weights must be non-negative and sum to one")
    void weightValidation() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.5, 0.5, 0.5, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 0.6, 0.5, 0.0));
        assertFalse(SimilarityWeights.defaults().usesEmbeddings());
        assertTrue(SimilarityWeights.withEmbeddings().usesEmbeddings());
    }

    @Test
    @DisplayName("Resolution options should keep mid at or below high")
    void optionValidation() {
        assertEquals(0.92, options.getHighThreshold());
        assertEquals(0.80, options.getMidThreshold());
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().highThreshold(0.7).midThreshold(0.8).build());
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionOptions.builder().highThreshold(1.2).build());
        assertTrue(ResolutionOptions.conservative().getMidThreshold() > options.getMidThreshold());
    }

    @Test
    @DisplayName("Embedding weights should apply only when embeddings are available and no weights were set")
    void effectiveWeights() {
        assertEquals(SimilarityWeights.defaults(), options.effectiveWeights(false));
        assertEquals(SimilarityWeights.withEmbeddings(), options.effectiveWeights(true));
        assertFalse(options.hasExplicitWeights());

        SimilarityWeights lexicalOnly = new SimilarityWeights(0.5, 0.5, 0.0, 0.0);
        ResolutionOptions explicit = ResolutionOptions.builder().similarityWeights(lexicalOnly).build();
        assertTrue(explicit.hasExplicitWeights());
        assertEquals(lexicalOnly, explicit.effectiveWeights(true));
    }
}
