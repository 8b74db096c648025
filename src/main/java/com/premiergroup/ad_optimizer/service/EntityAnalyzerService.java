package com.premiergroup.ad_optimizer.service;

import com.premiergroup.ad_optimizer.dto.ConfidenceInterval;
import com.premiergroup.ad_optimizer.dto.CreativeFatigueSignals;
import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.EntityFields;
import com.premiergroup.ad_optimizer.dto.FatigueAssessment;
import com.premiergroup.ad_optimizer.dto.FatigueSignal;
import com.premiergroup.ad_optimizer.dto.LearningPhaseProgress;
import com.premiergroup.ad_optimizer.dto.OptimizationConfig;
import com.premiergroup.ad_optimizer.dto.PerformanceMetrics;
import com.premiergroup.ad_optimizer.dto.PerformanceTotals;
import com.premiergroup.ad_optimizer.dto.Trend;
import com.premiergroup.ad_optimizer.engine.CampaignBudgetLedger;
import com.premiergroup.ad_optimizer.engine.ConfidenceEstimator;
import com.premiergroup.ad_optimizer.engine.DecisionPolicy;
import com.premiergroup.ad_optimizer.entity.Ad;
import com.premiergroup.ad_optimizer.entity.AdSet;
import com.premiergroup.ad_optimizer.entity.Campaign;
import com.premiergroup.ad_optimizer.enums.AdEffectiveStatus;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.LearningPhaseStatus;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.Priority;
import com.premiergroup.ad_optimizer.exception.OptimizationEntityNotFoundException;
import com.premiergroup.ad_optimizer.store.EntityStore;
import com.premiergroup.ad_optimizer.store.TelemetryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns the recent telemetry of one ad set or ad into at most one {@link Decision}; first matching rule wins.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class EntityAnalyzerService {

    static final double LEARNING_CONFIDENCE = 0.9;
    static final double PAUSE_CONFIDENCE = 0.85;
    static final double SCALE_CONFIDENCE = 0.8;
    static final double DISAPPROVED_CONFIDENCE = 1.0;
    static final double LOW_CTR_NARROW_CONFIDENCE = 0.85;
    static final double LOW_CTR_WIDE_CONFIDENCE = 0.7;
    static final double FATIGUE_CONFIDENCE = 0.75;

    static final long LOW_CTR_MIN_IMPRESSIONS = 1000;
    static final double LOW_CTR_THRESHOLD = 0.3;
    static final BigDecimal FALLBACK_CAMPAIGN_BUDGET = new BigDecimal("10000");

    private final EntityStore entityStore;
    private final TelemetryStore telemetryStore;
    private final Clock clock;

    /**
     * A ledger seeded from the entity store, to be shared by every ad-set analysis of one cycle.
     */
    public CampaignBudgetLedger newLedger() {
        return new CampaignBudgetLedger(entityStore::sumActiveAdSetBudgets);
    }

    public Optional<Decision> analyze(EntityType entityType, String entityId,
                                      OptimizationConfig config, CampaignBudgetLedger ledger) {
        return switch (entityType) {
            case AD_SET -> analyzeAdSet(entityId, config, ledger);
            case AD -> analyzeAd(entityId, config);
        };
    }

    /**
     * @throws OptimizationEntityNotFoundException when the ad set is missing or not ACTIVE
     */
    public Optional<Decision> analyzeAdSet(String adSetId, OptimizationConfig config) {
        return analyzeAdSet(adSetId, config, newLedger());
    }

    public Optional<Decision> analyzeAdSet(String adSetId, OptimizationConfig config, CampaignBudgetLedger ledger) {
        AdSet adSet = entityStore.findAdSet(adSetId)
                .filter(a -> a.getStatus() == EntityStatus.ACTIVE)
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD_SET, adSetId));

        BigDecimal budget = adSet.getBudget() != null ? adSet.getBudget() : BigDecimal.ZERO;
        PerformanceTotals totals = telemetryStore.aggregate(EntityType.AD_SET, adSetId,
                windowStart(config), today());
        PerformanceMetrics metrics = PerformanceMetrics.from(totals,
                orZero(adSet.getAgeDays()),
                adSet.getOptimizationEventsCount() != null ? adSet.getOptimizationEventsCount() : 0,
                budget.doubleValue(),
                config);

        Decision.DecisionBuilder decision = Decision.builder()
                .entityType(EntityType.AD_SET)
                .entityId(adSetId)
                .entityName(adSet.getName())
                .accountId(adSet.getAccountId())
                .campaignId(adSet.getCampaignId())
                .metrics(metrics);

        if (adSet.getLearningPhaseStatus() == LearningPhaseStatus.LEARNING) {
            LearningPhaseProgress progress = DecisionPolicy.learningPhaseProgress(
                    metrics.optimizationEvents(), metrics.ageDays(), adSet.getLearningPhaseStatus().name());
            return Optional.of(decision
                    .action(OptimizationAction.MONITOR)
                    .reason(String.format("Learning phase: %.0f%% complete (%d/%d events). Est. %d days remaining.",
                            progress.progressPercentage(), progress.eventsCount(),
                            DecisionPolicy.LEARNING_EVENTS_TARGET, progress.estimatedCompletionDays()))
                    .priority(Priority.LOW)
                    .confidence(LEARNING_CONFIDENCE)
                    .build());
        }

        Optional<String> pauseReason = DecisionPolicy.pauseReason(metrics);
        if (pauseReason.isPresent()) {
            return Optional.of(decision
                    .action(OptimizationAction.PAUSE)
                    .reason(pauseReason.get())
                    .priority(Priority.HIGH)
                    .confidence(PAUSE_CONFIDENCE)
                    .previousValue(EntityFields.status(adSet.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.PAUSED))
                    .build());
        }

        if (DecisionPolicy.isWinner(metrics)) {
            return Optional.of(scaleDecision(adSet, budget, metrics, ledger, decision));
        }

        return Optional.empty();
    }

    public Optional<Decision> analyzeAd(String adId, OptimizationConfig config) {
        Ad ad = entityStore.findAd(adId)
                .filter(a -> a.getStatus() == EntityStatus.ACTIVE)
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD, adId));

        PerformanceTotals totals = telemetryStore.aggregate(EntityType.AD, adId, windowStart(config), today());
        PerformanceMetrics metrics = PerformanceMetrics.from(totals, orZero(ad.getAgeDays()), 0, 0, config);

        Decision.DecisionBuilder decision = Decision.builder()
                .entityType(EntityType.AD)
                .entityId(adId)
                .entityName(ad.getName())
                .accountId(ad.getAccountId())
                .campaignId(ad.getCampaignId())
                .metrics(metrics);

        if (ad.getEffectiveStatus() == AdEffectiveStatus.DISAPPROVED) {
            return Optional.of(decision
                    .action(OptimizationAction.MONITOR)
                    .reason("Ad is disapproved - review policy violations")
                    .priority(Priority.HIGH)
                    .confidence(DISAPPROVED_CONFIDENCE)
                    .build());
        }

        if (metrics.impressions() >= LOW_CTR_MIN_IMPRESSIONS && metrics.ctr() < LOW_CTR_THRESHOLD) {
            ConfidenceInterval interval = ConfidenceEstimator.interval(metrics.conversions(), metrics.clicks());
            // a narrower interval means the conversion rate is well measured
            double confidence = interval.marginOfError() < 1 ? LOW_CTR_NARROW_CONFIDENCE : LOW_CTR_WIDE_CONFIDENCE;
            return Optional.of(decision
                    .action(OptimizationAction.PAUSE)
                    .reason(String.format("Very low CTR: %.2f%% - creative not resonating", metrics.ctr()))
                    .priority(Priority.MEDIUM)
                    .confidence(confidence)
                    .previousValue(EntityFields.status(ad.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.PAUSED))
                    .build());
        }

        FatigueAssessment fatigue = assessFatigue(ad, totals, config);
        if (fatigue.fatigued()) {
            return Optional.of(decision
                    .action(OptimizationAction.REFRESH_CREATIVE)
                    .reason("Creative fatigue: " + fatigue.signals().stream()
                            .map(FatigueSignal::type)
                            .collect(Collectors.joining(", ")))
                    .priority(Priority.MEDIUM)
                    .confidence(FATIGUE_CONFIDENCE)
                    .build());
        }

        return Optional.empty();
    }

    public LearningPhaseProgress learningPhase(String adSetId) {
        AdSet adSet = entityStore.findAdSet(adSetId)
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD_SET, adSetId));
        return DecisionPolicy.learningPhaseProgress(
                adSet.getOptimizationEventsCount() != null ? adSet.getOptimizationEventsCount() : 0,
                orZero(adSet.getAgeDays()),
                adSet.getLearningPhaseStatus() != null ? adSet.getLearningPhaseStatus().name() : null);
    }

    public FatigueAssessment fatigue(String adId, OptimizationConfig config) {
        Ad ad = entityStore.findAd(adId)
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD, adId));
        PerformanceTotals current = telemetryStore.aggregate(EntityType.AD, adId, windowStart(config), today());
        return assessFatigue(ad, current, config);
    }

    private FatigueAssessment assessFatigue(Ad ad, PerformanceTotals current, OptimizationConfig config) {
        LocalDate currentStart = windowStart(config);
        PerformanceTotals previous = telemetryStore.aggregate(EntityType.AD, ad.getAdId(),
                currentStart.minusDays(config.getLookbackDays()), currentStart.minusDays(1));

        double frequency = current.reach() > 0 ? (double) current.impressions() / current.reach() : 0;
        CreativeFatigueSignals signals = new CreativeFatigueSignals(
                frequency,
                Trend.between(previous.ctr(), current.ctr()),
                Trend.between(previous.cpc(), current.cpc()),
                orZero(ad.getAgeDays()));
        return DecisionPolicy.detectFatigue(signals);
    }

    private Decision scaleDecision(AdSet adSet, BigDecimal budget, PerformanceMetrics metrics,
                                   CampaignBudgetLedger ledger, Decision.DecisionBuilder decision) {
        Optional<BigDecimal> campaignTotal = entityStore.findCampaign(adSet.getCampaignId())
                .map(Campaign::getTotalBudget)
                .filter(total -> total.signum() > 0);

        BigDecimal newBudget;
        if (campaignTotal.isPresent()) {
            BigDecimal scaled = DecisionPolicy.scaleBudget(budget, campaignTotal.get(), metrics);
            BigDecimal granted = ledger.reserve(adSet.getCampaignId(), campaignTotal.get(), scaled.subtract(budget));
            newBudget = budget.add(granted);
        } else {
            BigDecimal fallbackTotal = budget.signum() > 0 ? budget.multiply(BigDecimal.valueOf(2)) : FALLBACK_CAMPAIGN_BUDGET;
            newBudget = DecisionPolicy.scaleBudget(budget, fallbackTotal, metrics);
        }

        String performance = String.format("ROAS: %.2fx, CPA: $%.2f", metrics.roas(), metrics.cpa());
        if (newBudget.compareTo(budget) <= 0) {
            log.info("Ad set {} qualifies for scaling but campaign {} has no budget headroom",
                    adSet.getAdSetId(), adSet.getCampaignId());
            return decision
                    .action(OptimizationAction.MONITOR)
                    .reason("Winner, but campaign budget is fully allocated. " + performance)
                    .priority(Priority.LOW)
                    .confidence(SCALE_CONFIDENCE)
                    .build();
        }

        return decision
                .action(OptimizationAction.SCALE)
                .reason(DecisionPolicy.scaleReason(metrics) + ". " + performance)
                .priority(Priority.MEDIUM)
                .confidence(SCALE_CONFIDENCE)
                .previousValue(new EntityFields(adSet.getStatus(), budget))
                .newValue(EntityFields.budget(newBudget))
                .build();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private LocalDate windowStart(OptimizationConfig config) {
        return today().minusDays(config.getLookbackDays() - 1L);
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
