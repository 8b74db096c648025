package com.premiergroup.ad_optimizer.dto;

import com.premiergroup.ad_optimizer.enums.OptimizationAction;

import java.util.List;

/**
 * @param recommendation REFRESH_CREATIVE when fatigued, MONITOR otherwise
 */
public record FatigueAssessment(boolean fatigued, List<FatigueSignal> signals, OptimizationAction recommendation) {

    public FatigueAssessment {
        signals = List.copyOf(signals);
    }
}
