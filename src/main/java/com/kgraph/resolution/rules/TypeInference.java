package com.kgraph.resolution.rules;

import com.kgraph.resolution.core.model.EntityType;

/**
 * Classifies a mention whose extractor label is missing or unknown.
 */
@FunctionalInterface
public interface TypeInference {

    /**
     * @return the inferred type, or {@link EntityType#UNKNOWN} when undecided
     */
    EntityType infer(String surfaceForm, String context);
}
