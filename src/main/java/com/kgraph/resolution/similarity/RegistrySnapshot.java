package com.kgraph.resolution.similarity;

import com.kgraph.resolution.core.model.CanonicalEntity;

import java.util.Collection;

/**
 * Read-only view of the entity registry used while resolving a candidate.
 * Only root entities are returned.
 */
public interface RegistrySnapshot {

    /**
     * Root entities whose aliases fall in the given blocking bucket.
     */
    Collection<CanonicalEntity> entitiesInBlock(String blockingKey);

    /**
     * Root entities of any type having an alias with exactly this normalized key.
     */
    Collection<CanonicalEntity> entitiesWithKey(String normalizedKey);
}
