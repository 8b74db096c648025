package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.enums.OptimizationAction;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record OptimizationCycleResult(
        String cycleId,
        Instant startedAt,
        Instant completedAt,
        int decisionsAnalyzed,
        int actionsExecuted,
        Map<OptimizationAction, Integer> actionsByType,
        List<String> errors,
        List<Decision> decisions
) {

    public OptimizationCycleResult {
        EnumMap<OptimizationAction, Integer> tallies = new EnumMap<>(OptimizationAction.class);
        for (OptimizationAction action : OptimizationAction.values()) {
            tallies.put(action, actionsByType.getOrDefault(action, 0));
        }
        actionsByType = Collections.unmodifiableMap(tallies);
        errors = List.copyOf(errors);
        decisions = List.copyOf(decisions);
    }
}
