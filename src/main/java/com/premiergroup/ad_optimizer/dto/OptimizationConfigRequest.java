package com.premiergroup.ad_optimizer.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Partial overrides for a cycle started over HTTP. Null fields keep the configured default.
 */
public record OptimizationConfigRequest(
        @Positive(message = "targetCPA must be positive") Double targetCPA,
        @Positive(message = "targetROAS must be positive") Double targetROAS,
        @PositiveOrZero(message = "maxBudgetIncreasePercent must not be negative") Double maxBudgetIncreasePercent,
        @Min(value = 1, message = "minDataDays must be at least 1") Integer minDataDays,
        Boolean autoExecute,
        Boolean dryRun
) {

    public OptimizationConfig applyTo(OptimizationConfig base) {
        OptimizationConfig.OptimizationConfigBuilder builder = base.toBuilder();
        if (targetCPA != null) builder.targetCPA(targetCPA);
        if (targetROAS != null) builder.targetROAS(targetROAS);
        if (maxBudgetIncreasePercent != null) builder.maxBudgetIncreasePercent(maxBudgetIncreasePercent);
        if (minDataDays != null) builder.minDataDays(minDataDays);
        if (autoExecute != null) builder.autoExecute(autoExecute);
        if (dryRun != null) builder.dryRun(dryRun);
        return builder.build();
    }
}
