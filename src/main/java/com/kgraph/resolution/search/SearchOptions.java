package com.kgraph.resolution.search;

/**
 * Tuning for {@link HybridSearchService}.
 *
 * @param minScore              seeds scoring below this are dropped
 * @param hopDecay              relevance multiplier per graph hop, in (0, 1]
 * @param maxExploreDepth       upper bound for the caller's explore depth
 * @param maxSeeds              number of best seeds expanded through the graph
 * @param keywordBoostWeight    added to a hit's score per boost keyword it matches, times the match similarity
 * @param keywordMatchThreshold minimum fuzzy similarity between a boost keyword and an alias word
 * @param entityBoostWeight     added to the score of a document mentioning a direct match, times the best seed score
 */
public record SearchOptions(double minScore, double hopDecay, int maxExploreDepth, int maxSeeds,
                            double keywordBoostWeight, double keywordMatchThreshold, double entityBoostWeight) {

    public static final double DEFAULT_KEYWORD_BOOST_WEIGHT = 0.15;
    public static final double DEFAULT_KEYWORD_MATCH_THRESHOLD = 0.8;
    public static final double DEFAULT_ENTITY_BOOST_WEIGHT = 0.05;

    public SearchOptions {
        if (minScore < 0.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be between 0.0 and 1.0, got " + minScore);
        }
        if (hopDecay <= 0.0 || hopDecay > 1.0) {
            throw new IllegalArgumentException("hopDecay must be in (0.0, 1.0], got " + hopDecay);
        }
        if (maxExploreDepth < 0) {
            throw new IllegalArgumentException("maxExploreDepth must not be negative");
        }
        if (maxSeeds < 1) {
            throw new IllegalArgumentException("maxSeeds must be at least 1");
        }
        if (keywordBoostWeight < 0.0 || keywordBoostWeight > 1.0 || entityBoostWeight < 0.0 || entityBoostWeight > 1.0) {
            throw new IllegalArgumentException("Boost weights must be between 0.0 and 1.0");
        }
        if (keywordMatchThreshold <= 0.0 || keywordMatchThreshold > 1.0) {
            throw new IllegalArgumentException("keywordMatchThreshold must be in (0.0, 1.0], got "
                    + keywordMatchThreshold);
        }
    }

    public SearchOptions(double minScore, double hopDecay, int maxExploreDepth, int maxSeeds) {
        this(minScore, hopDecay, maxExploreDepth, maxSeeds, DEFAULT_KEYWORD_BOOST_WEIGHT,
                DEFAULT_KEYWORD_MATCH_THRESHOLD, DEFAULT_ENTITY_BOOST_WEIGHT);
    }

    public static SearchOptions defaults() {
        return new SearchOptions(0.3, 0.5, 3, 20);
    }

    public SearchOptions withBoosts(double keywordBoostWeight, double keywordMatchThreshold, double entityBoostWeight) {
        return new SearchOptions(minScore, hopDecay, maxExploreDepth, maxSeeds, keywordBoostWeight,
                keywordMatchThreshold, entityBoostWeight);
    }

    /**
     * Clamps a requested explore depth to {@code [0, maxExploreDepth]}.
     */
    public int clampDepth(int exploreDepth) {
        return Math.max(0, Math.min(exploreDepth, maxExploreDepth));
    }
}
