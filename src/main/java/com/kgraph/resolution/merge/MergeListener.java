package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.CanonicalEntity;

/**
 * Notified by the {@link MergeEngine} after its state changed.
 * Calls happen after the change is visible to readers. A {@link RegistryCorruptionException} is
 * propagated to the caller of the merge engine; other exceptions are logged and ignored.
 */
public interface MergeListener {

    /**
     * An entity was created or gained a mention.
     */
    default void onEntityUpdated(CanonicalEntity entity) {
    }

    /**
     * Root {@code sourceEntityId} was merged into {@code target}.
     */
    default void onEntitiesMerged(int sourceEntityId, CanonicalEntity target) {
    }
}
