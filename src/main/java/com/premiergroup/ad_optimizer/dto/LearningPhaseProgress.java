package com.premiergroup.ad_optimizer.dto;

public record LearningPhaseProgress(
        String status,
        long eventsCount,
        long eventsNeeded,
        double progressPercentage,
        long estimatedCompletionDays,
        boolean onTrack,
        double dailyEventRate
) {
}
