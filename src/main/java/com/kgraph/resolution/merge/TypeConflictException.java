package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.EntityType;

/**
 * Thrown when a merge would join entities of different types.
 */
public class TypeConflictException extends RuntimeException {

    private final int sourceEntityId;
    private final int targetEntityId;

    public TypeConflictException(int sourceEntityId, EntityType sourceType, int targetEntityId, EntityType targetType) {
        super("Cannot merge entity " + sourceEntityId + " (" + sourceType + ") into entity "
                + targetEntityId + " (" + targetType + ")");
        this.sourceEntityId = sourceEntityId;
        this.targetEntityId = targetEntityId;
    }

    public int getSourceEntityId() {
        return sourceEntityId;
    }

    public int getTargetEntityId() {
        return targetEntityId;
    }
}
