package com.premiergroup.ad_optimizer.store;

import com.premiergroup.ad_optimizer.dto.PerformanceTotals;
import com.premiergroup.ad_optimizer.enums.EntityType;

import java.time.LocalDate;

/**
 * Read side of the delivery telemetry.
 */
public interface TelemetryStore {

    /**
     * Sums the entity's daily snapshots between {@code start} and {@code end}, both inclusive.
     * Returns {@link PerformanceTotals#EMPTY} when there is no data.
     */
    PerformanceTotals aggregate(EntityType entityType, String entityId, LocalDate start, LocalDate end);
}
