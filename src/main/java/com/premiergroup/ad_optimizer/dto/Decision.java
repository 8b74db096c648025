package com.premiergroup.ad_optimizer.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.Priority;
import lombok.Builder;

import java.util.Objects;

/**
 * Outcome of analyzing one entity in one cycle. Non-mutating actions (MONITOR, REFRESH_CREATIVE) never
 * carry a previous/new value pair. A mutating decision's {@code previousValue} is the state the entity must
 * still be in when the decision is executed.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Decision(
        EntityType entityType,
        String entityId,
        String entityName,
        String accountId,
        String campaignId,
        OptimizationAction action,
        String reason,
        Priority priority,
        double confidence,
        PerformanceMetrics metrics,
        EntityFields previousValue,
        EntityFields newValue
) {

    public Decision {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(priority, "priority");
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
        if (!action.isMutating() && (previousValue != null || newValue != null)) {
            throw new IllegalArgumentException(action + " decisions must not propose a mutation");
        }
    }

    @JsonIgnore
    public boolean hasMutation() {
        return newValue != null && !newValue.isEmpty();
    }
}
