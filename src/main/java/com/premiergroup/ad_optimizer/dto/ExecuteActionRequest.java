package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ExecuteActionRequest(
        @NotNull(message = "entityType is required") EntityType entityType,
        @NotBlank(message = "entityId is required") String entityId,
        @NotNull(message = "action is required") OptimizationAction action,
        String reason,
        String performedBy
) {
}
