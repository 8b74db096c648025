package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityType;

import java.util.List;

/**
 * Append-only trail of executed decisions.
 */
public interface AuditLogSink {

    OptimizationLog append(OptimizationLog record);

    /**
     * Newest first. Both filters are optional; {@code entityId} is ignored without {@code entityType}.
     */
    List<OptimizationLog> recent(EntityType entityType, String entityId, int limit);
}
