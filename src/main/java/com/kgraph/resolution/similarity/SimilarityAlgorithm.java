package com.kgraph.resolution.similarity;

/**
 * A string similarity measure returning a score in {@code [0.0, 1.0]}, 1.0 meaning identical.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
