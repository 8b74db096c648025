package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.exception.InvalidOptimizationConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Settings of one optimization run. Defaults are applied by the builder, so a config built without
 * arguments proposes decisions but never mutates an entity ({@code autoExecute=false, dryRun=true}).
 */
@Value
@Builder(toBuilder = true)
public class OptimizationConfig {

    @Builder.Default
    double targetCPA = 50;

    @Builder.Default
    double targetROAS = 2.0;

    @Builder.Default
    double maxBudgetIncreasePercent = 20;

    @Builder.Default
    int minDataDays = 3;

    @Builder.Default
    boolean autoExecute = false;

    @Builder.Default
    boolean dryRun = true;

    /**
     * Length of the telemetry window each analysis sums over.
     */
    @Builder.Default
    int lookbackDays = 7;

    public static OptimizationConfig defaults() {
        return OptimizationConfig.builder().build();
    }

    /**
     * Whether decisions of a run are applied to the entity store.
     */
    public boolean executesDecisions() {
        return autoExecute && !dryRun;
    }

    public OptimizationConfig validate() {
        if (!(targetCPA > 0)) {
            throw new InvalidOptimizationConfigException("targetCPA must be positive, got " + targetCPA);
        }
        if (!(targetROAS > 0)) {
            throw new InvalidOptimizationConfigException("targetROAS must be positive, got " + targetROAS);
        }
        if (!(maxBudgetIncreasePercent >= 0)) {
            throw new InvalidOptimizationConfigException(
                    "maxBudgetIncreasePercent must not be negative, got " + maxBudgetIncreasePercent);
        }
        if (minDataDays < 1) {
            throw new InvalidOptimizationConfigException("minDataDays must be at least 1, got " + minDataDays);
        }
        if (lookbackDays < 1) {
            throw new InvalidOptimizationConfigException("lookbackDays must be at least 1, got " + lookbackDays);
        }
        return this;
    }
}
