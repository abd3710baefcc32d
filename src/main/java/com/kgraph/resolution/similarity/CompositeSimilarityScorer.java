package com.kgraph.resolution.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted sum of Levenshtein, Jaro-Winkler, soft token-set and (optionally) embedding similarity
 * over normalized keys. Equal keys score 1.0 without computing anything.
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final TokenSetSimilarity tokenSet = new TokenSetSimilarity();
    private final EmbeddingSimilarity embedding;
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaults(), null);
    }

    /**
     * @param weights           the weights; an embedding weight above zero requires {@code embeddingFunction}
     * @param embeddingFunction may be null when {@code weights} give embeddings no weight
     */
    public CompositeSimilarityScorer(SimilarityWeights weights, EmbeddingFunction embeddingFunction) {
        if (weights.usesEmbeddings() && embeddingFunction == null) {
            throw new IllegalArgumentException("Embedding weight is set but no embedding function was given");
        }
        this.weights = weights;
        this.embedding = embeddingFunction != null ? new EmbeddingSimilarity(embeddingFunction) : null;
    }

    @Override
    public double compute(String s1, String s2) {
        return computeWithBreakdown(s1, s2).compositeScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return new SimilarityBreakdown(0.0, 0.0, 0.0, 0.0, 0.0);
        }
        if (s1.equals(s2)) {
            return new SimilarityBreakdown(1.0, 1.0, 1.0, weights.usesEmbeddings() ? 1.0 : 0.0, 1.0);
        }
        double lev = levenshtein.compute(s1, s2);
        double jw = jaroWinkler.compute(s1, s2);
        double tokens = tokenSet.compute(s1, s2);
        double emb = weights.usesEmbeddings() ? embedding.compute(s1, s2) : 0.0;
        double composite = weights.levenshteinWeight() * lev
                + weights.jaroWinklerWeight() * jw
                + weights.tokenSetWeight() * tokens
                + weights.embeddingWeight() * emb;

        log.trace("similarity.computed a='{}' b='{}' levenshtein={} jaroWinkler={} tokenSet={} embedding={} composite={}",
                s1, s2, lev, jw, tokens, emb, composite);
        return new SimilarityBreakdown(lev, jw, tokens, emb, composite);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    /**
     * Per-algorithm scores behind one composite score.
     */
    public record SimilarityBreakdown(
            double levenshteinScore,
            double jaroWinklerScore,
            double tokenSetScore,
            double embeddingScore,
            double compositeScore
    ) {
        @Override
        public String toString() {
            return String.format("levenshtein=%.3f jaroWinkler=%.3f tokenSet=%.3f embedding=%.3f composite=%.3f",
                    levenshteinScore, jaroWinklerScore, tokenSetScore, embeddingScore, compositeScore);
        }
    }
}
