package com.premiergroup.ad_optimizer.service;

import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.EntityFields;
import com.premiergroup.ad_optimizer.dto.ExecuteActionRequest;
import com.premiergroup.ad_optimizer.dto.ExecuteActionResponse;
import com.premiergroup.ad_optimizer.entity.Ad;
import com.premiergroup.ad_optimizer.entity.AdSet;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.Priority;
import com.premiergroup.ad_optimizer.exception.OptimizationEntityNotFoundException;
import com.premiergroup.ad_optimizer.store.EntityStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Operator-triggered actions. The decision is derived from the entity's current state and then goes through
 * the same executor and audit trail as automated decisions.
 */
@Service
@RequiredArgsConstructor
public class ManualActionService {

    static final BigDecimal MANUAL_SCALE_UP = new BigDecimal("1.2");
    static final BigDecimal MANUAL_SCALE_DOWN = new BigDecimal("0.8");

    private final EntityStore entityStore;
    private final DecisionExecutorService executorService;

    public ExecuteActionResponse execute(ExecuteActionRequest request) {
        Decision decision = request.entityType() == EntityType.AD_SET
                ? adSetDecision(request)
                : adDecision(request);
        boolean success = executorService.execute(decision, request.performedBy());
        String message = success
                ? request.action() + " action executed successfully"
                : request.action() + " action failed";
        return new ExecuteActionResponse(success, decision, message);
    }

    private Decision adSetDecision(ExecuteActionRequest request) {
        AdSet adSet = entityStore.findAdSet(request.entityId())
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD_SET, request.entityId()));
        BigDecimal budget = adSet.getBudget() != null ? adSet.getBudget() : BigDecimal.ZERO;

        Decision.DecisionBuilder decision = base(request)
                .entityName(adSet.getName())
                .accountId(adSet.getAccountId())
                .campaignId(adSet.getCampaignId());
        return switch (request.action()) {
            case PAUSE -> decision
                    .previousValue(EntityFields.status(adSet.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.PAUSED))
                    .build();
            case ACTIVATE -> decision
                    .previousValue(EntityFields.status(adSet.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.ACTIVE))
                    .build();
            case SCALE -> decision
                    .previousValue(new EntityFields(adSet.getStatus(), budget))
                    .newValue(EntityFields.budget(budget.multiply(MANUAL_SCALE_UP).setScale(0, RoundingMode.HALF_UP)))
                    .build();
            case REDUCE_BUDGET -> decision
                    .previousValue(new EntityFields(adSet.getStatus(), budget))
                    .newValue(EntityFields.budget(budget.multiply(MANUAL_SCALE_DOWN).setScale(0, RoundingMode.HALF_UP)))
                    .build();
            case MONITOR, REFRESH_CREATIVE -> decision.build();
        };
    }

    private Decision adDecision(ExecuteActionRequest request) {
        Ad ad = entityStore.findAd(request.entityId())
                .orElseThrow(() -> new OptimizationEntityNotFoundException(EntityType.AD, request.entityId()));

        Decision.DecisionBuilder decision = base(request)
                .entityName(ad.getName())
                .accountId(ad.getAccountId())
                .campaignId(ad.getCampaignId());
        return switch (request.action()) {
            case PAUSE -> decision
                    .previousValue(EntityFields.status(ad.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.PAUSED))
                    .build();
            case ACTIVATE -> decision
                    .previousValue(EntityFields.status(ad.getStatus()))
                    .newValue(EntityFields.status(EntityStatus.ACTIVE))
                    .build();
            case SCALE, REDUCE_BUDGET ->
                    throw new IllegalArgumentException(request.action() + " is only supported for ad sets");
            case MONITOR, REFRESH_CREATIVE -> decision.build();
        };
    }

    private static Decision.DecisionBuilder base(ExecuteActionRequest request) {
        String reason = request.reason() != null && !request.reason().isBlank()
                ? request.reason()
                : "Manual " + request.action().name().toLowerCase() + " action";
        return Decision.builder()
                .entityType(request.entityType())
                .entityId(request.entityId())
                .action(request.action())
                .reason(reason)
                .priority(Priority.HIGH)
                .confidence(1.0);
    }
}
