package com.premiergroup.ad_optimizer.engine;

import com.premiergroup.ad_optimizer.dto.CreativeFatigueSignals;
import com.premiergroup.ad_optimizer.dto.FatigueAssessment;
import com.premiergroup.ad_optimizer.dto.FatigueSignal;
import com.premiergroup.ad_optimizer.dto.LearningPhaseProgress;
import com.premiergroup.ad_optimizer.dto.PerformanceMetrics;
import com.premiergroup.ad_optimizer.dto.Trend;
import com.premiergroup.ad_optimizer.enums.FatigueSeverity;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.TrendDirection;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Threshold rules behind every optimization decision.
 */
public final class DecisionPolicy {

    static final long MIN_IMPRESSIONS_FOR_DECISION = 1000;
    static final long MIN_CLICKS_FOR_DECISION = 100;
    static final long MIN_CONVERSIONS_FOR_DECISION = 10;

    static final double PAUSE_CPA_MULTIPLIER = 2.5;
    static final double PAUSE_MIN_ROAS = 1.0;
    static final double PAUSE_MIN_CTR = 0.3;
    static final double PAUSE_MAX_FREQUENCY = 5.0;
    static final double PAUSE_MAX_CPC = 5.0;

    static final long WINNER_MIN_CONVERSIONS = 30;
    static final int WINNER_MIN_AGE_DAYS = 7;
    static final double WINNER_MIN_ROAS = 3.0;
    static final double WINNER_CPA_MULTIPLIER = 0.8;

    static final double EXCEPTIONAL_ROAS = 5.0;
    static final BigDecimal STANDARD_SCALE = new BigDecimal("1.2");
    static final BigDecimal EXCEPTIONAL_SCALE = new BigDecimal("1.3");
    static final BigDecimal MAX_CAMPAIGN_SHARE = new BigDecimal("0.4");

    public static final long LEARNING_EVENTS_TARGET = 50;
    static final double ON_TRACK_DAILY_EVENTS = 7;

    private DecisionPolicy() {}

    public static boolean hasMatureSample(PerformanceMetrics metrics) {
        boolean hasImpressions = metrics.impressions() >= MIN_IMPRESSIONS_FOR_DECISION;
        boolean hasClicksOrConversions = metrics.clicks() >= MIN_CLICKS_FOR_DECISION
                || metrics.conversions() >= MIN_CONVERSIONS_FOR_DECISION;
        return hasImpressions && hasClicksOrConversions;
    }

    public static boolean shouldPause(PerformanceMetrics metrics) {
        return pauseReason(metrics).isPresent();
    }

    /**
     * First matching pause trigger as a human-readable reason, empty when the entity should keep running
     * or the sample is too thin to judge.
     */
    public static Optional<String> pauseReason(PerformanceMetrics metrics) {
        if (!hasMatureSample(metrics)) {
            return Optional.empty();
        }
        if (metrics.targetCPA() > 0 && metrics.cpa() > metrics.targetCPA() * PAUSE_CPA_MULTIPLIER) {
            return Optional.of(String.format("High CPA: $%.2f (target: $%.2f)", metrics.cpa(), metrics.targetCPA()));
        }
        if (metrics.roas() < PAUSE_MIN_ROAS) {
            return Optional.of(String.format("Low ROAS: %.2fx (losing money)", metrics.roas()));
        }
        if (metrics.ctr() < PAUSE_MIN_CTR) {
            return Optional.of(String.format("Very low CTR: %.2f%%", metrics.ctr()));
        }
        if (metrics.frequency() > PAUSE_MAX_FREQUENCY) {
            return Optional.of(String.format("Frequency too high: %.1f impressions per person", metrics.frequency()));
        }
        if (metrics.cpc() > PAUSE_MAX_CPC) {
            return Optional.of(String.format("High CPC: $%.2f", metrics.cpc()));
        }
        return Optional.empty();
    }

    public static boolean isWinner(PerformanceMetrics metrics) {
        if (!hasMatureSample(metrics)) {
            return false;
        }
        boolean provenVolume = metrics.conversions() >= WINNER_MIN_CONVERSIONS
                && metrics.ageDays() >= WINNER_MIN_AGE_DAYS;
        boolean strongRoas = metrics.roas() > WINNER_MIN_ROAS;
        boolean cheapConversions = metrics.cpa() < metrics.targetCPA() * WINNER_CPA_MULTIPLIER;
        return provenVolume && strongRoas && cheapConversions;
    }

    /**
     * Winner budget: +30% when ROAS exceeds 5, +20% otherwise, never above 40% of the campaign's total
     * budget and never below the current budget.
     */
    public static BigDecimal scaleBudget(BigDecimal currentBudget,
                                         BigDecimal campaignTotalBudget,
                                         PerformanceMetrics metrics) {
        BigDecimal factor = metrics.roas() > EXCEPTIONAL_ROAS ? EXCEPTIONAL_SCALE : STANDARD_SCALE;
        BigDecimal candidate = currentBudget.multiply(factor);
        BigDecimal cap = campaignTotalBudget.multiply(MAX_CAMPAIGN_SHARE);
        return currentBudget.max(candidate.min(cap)).setScale(2, RoundingMode.HALF_UP);
    }

    public static String scaleReason(PerformanceMetrics metrics) {
        return metrics.roas() > EXCEPTIONAL_ROAS ? "Exceptional ROAS; scale +30%" : "Standard winner scale +20%";
    }

    /**
     * Fatigued when at least one signal is critical or at least two are warnings.
     */
    public static FatigueAssessment detectFatigue(CreativeFatigueSignals signals) {
        List<FatigueSignal> found = new ArrayList<>();

        if (signals.frequency() > 3.0) {
            found.add(new FatigueSignal("HIGH_FREQUENCY",
                    signals.frequency() > 5.0 ? FatigueSeverity.CRITICAL : FatigueSeverity.WARNING,
                    signals.frequency(),
                    "Users have seen the creative too many times"));
        }

        Trend ctr = signals.ctrTrend();
        if (ctr.direction() == TrendDirection.DOWN && ctr.pctChange() <= -20) {
            found.add(new FatigueSignal("DECLINING_CTR", FatigueSeverity.WARNING, ctr.pctChange(),
                    "CTR dropped 20%+ over the reference window"));
        }

        Trend cpc = signals.cpcTrend();
        if (cpc.direction() == TrendDirection.UP && cpc.pctChange() >= 30) {
            found.add(new FatigueSignal("RISING_CPC", FatigueSeverity.WARNING, cpc.pctChange(),
                    "Cost per click increased 30%+ over the reference window"));
        }

        if (signals.ageDays() >= 14) {
            found.add(new FatigueSignal("TIME_THRESHOLD",
                    signals.ageDays() > 21 ? FatigueSeverity.WARNING : FatigueSeverity.INFO,
                    signals.ageDays(),
                    "Creative has been running for 14+ days"));
        }

        long critical = found.stream().filter(s -> s.severity() == FatigueSeverity.CRITICAL).count();
        long warnings = found.stream().filter(s -> s.severity() == FatigueSeverity.WARNING).count();
        boolean fatigued = critical > 0 || warnings >= 2;

        return new FatigueAssessment(fatigued, found,
                fatigued ? OptimizationAction.REFRESH_CREATIVE : OptimizationAction.MONITOR);
    }

    public static LearningPhaseProgress learningPhaseProgress(long events, int ageDays, String status) {
        long safeEvents = Math.max(events, 0);
        double dailyRate = (double) safeEvents / Math.max(ageDays, 1);
        long remaining = Math.max(LEARNING_EVENTS_TARGET - safeEvents, 0);
        // floor the rate at one event a day so a stalled entity does not report an unbounded estimate
        long estimatedDays = (long) Math.ceil(remaining / Math.max(dailyRate, 1));

        return new LearningPhaseProgress(
                status == null ? "UNKNOWN" : status,
                safeEvents,
                remaining,
                (double) safeEvents / LEARNING_EVENTS_TARGET * 100,
                estimatedDays,
                dailyRate >= ON_TRACK_DAILY_EVENTS,
                dailyRate);
    }
}
