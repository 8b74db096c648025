package com.premiergroup.ad_optimizer.service;

import com.premiergroup.ad_optimizer.config.CycleSettings;
import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.OptimizationConfig;
import com.premiergroup.ad_optimizer.dto.OptimizationCycleResult;
import com.premiergroup.ad_optimizer.dto.OptimizationSummary;
import com.premiergroup.ad_optimizer.engine.CampaignBudgetLedger;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.exception.OptimizationEntityNotFoundException;
import com.premiergroup.ad_optimizer.store.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A failing entity is recorded in the cycle's error list and never stops the cycle.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class OptimizationCycleService {

    public static final String AUTO_PERFORMER = "auto_optimizer";

    private final EntityStore entityStore;
    private final EntityAnalyzerService analyzerService;
    private final DecisionExecutorService executorService;
    private final ThreadPoolTaskExecutor optimizationExecutor;
    private final OptimizationConfig defaultOptimizationConfig;
    private final CycleSettings cycleSettings;
    private final Clock clock;

    private final Set<AtomicBoolean> runningCycles = ConcurrentHashMap.newKeySet();

    /**
     * Hourly cycle with the configured defaults; with the shipped defaults it only reports.
     */
    @Scheduled(cron = "${optimization.cron:0 15 * * * *}")
    public void scheduledCycle() {
        try {
            runCycle(null, defaultOptimizationConfig);
        } catch (Exception e) {
            log.error("Scheduled optimization cycle failed", e);
        }
    }

    public OptimizationCycleResult runCycle(String accountId, OptimizationConfig config) {
        config.validate();

        String cycleId = "opt_" + UUID.randomUUID();
        Instant startedAt = Instant.now(clock);
        AtomicBoolean stopRequested = new AtomicBoolean(false);
        runningCycles.add(stopRequested);

        log.info("Starting optimization cycle {} (account={}, autoExecute={}, dryRun={})",
                cycleId, accountId, config.isAutoExecute(), config.isDryRun());

        List<String> errors = new ArrayList<>();
        Tally tally = new Tally();
        try {
            CampaignBudgetLedger ledger = analyzerService.newLedger();
            for (EntityType type : List.of(EntityType.AD_SET, EntityType.AD)) {
                List<String> ids;
                try {
                    ids = activeIds(type, accountId);
                } catch (Exception e) {
                    log.error("Could not enumerate active {} entities", type, e);
                    errors.add(type.getLabel() + " enumeration: " + describe(e));
                    continue;
                }
                List<EntityTask> tasks = ids.stream()
                        .map(id -> submit(type, id, config, ledger, stopRequested))
                        .toList();
                tasks.forEach(task -> collect(task, tally, errors));
            }
        } finally {
            runningCycles.remove(stopRequested);
        }

        Instant completedAt = Instant.now(clock);
        log.info("Optimization cycle {} completed in {} ms: analyzed={}, executed={}, actions={}, errors={}",
                cycleId, Duration.between(startedAt, completedAt).toMillis(),
                tally.analyzed, tally.executed, tally.actionsByType, errors.size());

        return new OptimizationCycleResult(cycleId, startedAt, completedAt, tally.analyzed, tally.executed,
                tally.actionsByType, errors, tally.decisions);
    }

    /**
     * Entities of running cycles that have not started yet are skipped; entities already being analyzed
     * finish normally.
     */
    public void stop() {
        runningCycles.forEach(flag -> flag.set(true));
        log.info("Stop requested for {} running optimization cycle(s)", runningCycles.size());
    }

    public OptimizationSummary summary(String accountId) {
        return new OptimizationSummary(
                entityStore.countActiveAdSets(accountId),
                entityStore.countLearningAdSets(accountId));
    }

    private List<String> activeIds(EntityType type, String accountId) {
        return switch (type) {
            case AD_SET -> entityStore.findAdSetIds(EntityStatus.ACTIVE, accountId);
            case AD -> entityStore.findAdIds(EntityStatus.ACTIVE, accountId);
        };
    }

    private EntityTask submit(EntityType type, String id, OptimizationConfig config,
                              CampaignBudgetLedger ledger, AtomicBoolean stopRequested) {
        AtomicBoolean abandoned = new AtomicBoolean(false);
        CompletableFuture<EntityOutcome> future = CompletableFuture.supplyAsync(
                () -> process(type, id, config, ledger, stopRequested, abandoned), optimizationExecutor);
        return new EntityTask(type, id, abandoned, future);
    }

    private EntityOutcome process(EntityType type, String id, OptimizationConfig config,
                                  CampaignBudgetLedger ledger, AtomicBoolean stopRequested, AtomicBoolean abandoned) {
        if (stopRequested.get()) {
            return EntityOutcome.notStarted();
        }

        Optional<Decision> decision;
        try {
            decision = analyzerService.analyze(type, id, config, ledger);
        } catch (OptimizationEntityNotFoundException e) {
            // paused or removed since enumeration
            log.debug("{} {} is no longer active, skipping", type.getLabel(), id);
            decision = Optional.empty();
        }

        if (decision.isPresent() && abandoned.get()) {
            // the aggregator already recorded the timeout
            releaseHeadroom(decision.get(), ledger);
            return EntityOutcome.notStarted();
        }

        boolean executed = false;
        String failure = null;
        if (decision.isPresent() && decision.get().action() != OptimizationAction.MONITOR
                && config.executesDecisions()) {
            executed = executorService.execute(decision.get(), AUTO_PERFORMER);
            if (!executed) {
                failure = errorLine(type, id, "failed to execute " + decision.get().action());
                releaseHeadroom(decision.get(), ledger);
            }
        }
        return new EntityOutcome(false, decision.orElse(null), executed, failure);
    }

    private static void releaseHeadroom(Decision decision, CampaignBudgetLedger ledger) {
        if (decision.action() != OptimizationAction.SCALE || ledger == null || decision.campaignId() == null
                || decision.previousValue() == null || decision.previousValue().budget() == null
                || decision.newValue() == null || decision.newValue().budget() == null) {
            return;
        }
        ledger.release(decision.campaignId(),
                decision.newValue().budget().subtract(decision.previousValue().budget()));
    }

    private void collect(EntityTask task, Tally tally, List<String> errors) {
        try {
            EntityOutcome outcome = task.future().get(cycleSettings.entityTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (outcome.skipped()) {
                return;
            }
            tally.record(outcome);
            if (outcome.failure() != null) {
                errors.add(outcome.failure());
            }
        } catch (TimeoutException e) {
            task.abandoned().set(true);
            task.future().cancel(true);
            log.warn("{} {} timed out after {}", task.type().getLabel(), task.id(), cycleSettings.entityTimeout());
            errors.add(errorLine(task.type(), task.id(),
                    "timed out after " + cycleSettings.entityTimeout().toSeconds() + "s"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Optimization of {} {} failed", task.type().getLabel(), task.id(), cause);
            errors.add(errorLine(task.type(), task.id(), describe(cause)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.abandoned().set(true);
            errors.add(errorLine(task.type(), task.id(), "interrupted"));
        }
    }

    private static String errorLine(EntityType type, String id, String message) {
        return type.getLabel() + " " + id + ": " + message;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private record EntityTask(EntityType type, String id, AtomicBoolean abandoned,
                              CompletableFuture<EntityOutcome> future) {
    }

    private record EntityOutcome(boolean skipped, Decision decision, boolean executed, String failure) {

        static EntityOutcome notStarted() {
            return new EntityOutcome(true, null, false, null);
        }
    }

    // calling thread only
    private static final class Tally {
        private int analyzed;
        private int executed;
        private final Map<OptimizationAction, Integer> actionsByType = new EnumMap<>(OptimizationAction.class);
        private final List<Decision> decisions = new ArrayList<>();

        Tally() {
            for (OptimizationAction action : OptimizationAction.values()) {
                actionsByType.put(action, 0);
            }
        }

        void record(EntityOutcome outcome) {
            analyzed++;
            Decision decision = outcome.decision();
            if (decision == null) {
                return;
            }
            decisions.add(decision);
            if (decision.action() != OptimizationAction.MONITOR) {
                actionsByType.merge(decision.action(), 1, Integer::sum);
            }
            if (outcome.executed()) {
                executed++;
            }
        }
    }
}
