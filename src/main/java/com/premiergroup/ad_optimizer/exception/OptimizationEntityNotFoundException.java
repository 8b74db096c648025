package com.premiergroup.ad_optimizer.exception;

import com.premiergroup.ad_optimizer.enums.EntityType;
import lombok.Getter;

/**
 * The requested ad set or ad does not exist or is not ACTIVE.
 */
@Getter
public class OptimizationEntityNotFoundException extends RuntimeException {

    private final EntityType entityType;
    private final String entityId;

    public OptimizationEntityNotFoundException(EntityType entityType, String entityId) {
        super(entityType.getLabel() + " not found or not active: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }
}
