package com.kgraph.resolution.similarity;

/**
 * External text embedding model.
 * Vectors returned for different texts must have the same dimension.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    float[] embed(String text);
}
