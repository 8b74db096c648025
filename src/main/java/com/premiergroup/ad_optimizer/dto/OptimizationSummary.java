package com.premiergroup.ad_optimizer.dto;

public record OptimizationSummary(long totalActive, long inLearning) {
}
