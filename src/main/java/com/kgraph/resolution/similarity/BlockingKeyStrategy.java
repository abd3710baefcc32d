package com.kgraph.resolution.similarity;

import com.kgraph.resolution.core.model.EntityType;

/**
 * Assigns a candidate to the bucket it is compared within.
 *
 * <p>Only entities in the same bucket are scored against a candidate, and all merges for one
 * bucket are applied by a single writer. The key must therefore be a pure function of the
 * type and the normalized key, and must include the type.</p>
 */
@FunctionalInterface
public interface BlockingKeyStrategy {

    String blockingKey(EntityType type, String normalizedKey);
}
