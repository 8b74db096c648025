package com.premiergroup.ad_optimizer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.EntityFields;
import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.store.AuditLogSink;
import com.premiergroup.ad_optimizer.store.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies a decision's proposed values to the entity store and records the execution in the audit log.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class DecisionExecutorService {

    public static final String SYSTEM_PERFORMER = "system";

    private final EntityStore entityStore;
    private final AuditLogSink auditLogSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Writes the fields named in {@code decision.newValue()} as long as the entity still matches
     * {@code decision.previousValue()}, then appends one audit record, also for decisions that change nothing
     * and for failed writes. Storage failures are logged and reported as {@code false}, never thrown.
     *
     * @return true when every named field was written and the audit record was stored
     */
    public boolean execute(Decision decision, String performedBy) {
        String performer = performedBy == null || performedBy.isBlank() ? SYSTEM_PERFORMER : performedBy;

        boolean applied = false;
        try {
            applied = apply(decision);
            if (!applied) {
                log.warn("{} {} was not updated for {}: entity is gone or changed since the decision was made",
                        decision.entityType().getLabel(), decision.entityId(), decision.action());
            }
        } catch (Exception e) {
            log.error("Failed to execute optimization decision {} on {} {}",
                    decision.action(), decision.entityType(), decision.entityId(), e);
        }

        try {
            auditLogSink.append(OptimizationLog.builder()
                    .entityType(decision.entityType())
                    .entityId(decision.entityId())
                    .accountId(decision.accountId())
                    .action(decision.action())
                    .reason(decision.reason())
                    .previousValue(toJson(decision.previousValue()))
                    .newValue(toJson(decision.newValue()))
                    .performedBy(performer)
                    .performedAt(Instant.now(clock))
                    .success(applied)
                    .build());
        } catch (Exception e) {
            log.error("Failed to audit optimization decision {} on {} {}",
                    decision.action(), decision.entityType(), decision.entityId(), e);
            return false;
        }

        if (applied) {
            log.info("Optimization decision executed: {} {} {} by {}",
                    decision.entityType(), decision.entityId(), decision.action(), performer);
        }
        return applied;
    }

    private boolean apply(Decision decision) {
        if (!decision.hasMutation()) {
            return true;
        }
        EntityFields target = decision.newValue();
        EntityFields expected = decision.previousValue();
        if (expected == null || expected.status() == null) {
            throw new IllegalArgumentException("Decision on " + decision.entityId() + " has no expected status");
        }

        if (decision.entityType() == EntityType.AD) {
            if (target.budget() != null) {
                throw new IllegalArgumentException("Ads have no budget: " + decision.entityId());
            }
            return entityStore.updateAdStatus(decision.entityId(), expected.status(), target.status());
        }

        EntityStatus status = expected.status();
        boolean applied = true;
        if (target.status() != null) {
            applied = entityStore.updateAdSetStatus(decision.entityId(), status, target.status());
            status = target.status();
        }
        if (applied && target.budget() != null) {
            if (expected.budget() == null) {
                throw new IllegalArgumentException("Decision on " + decision.entityId() + " has no expected budget");
            }
            applied = entityStore.updateAdSetBudget(decision.entityId(), status, expected.budget(), target.budget());
        }
        return applied;
    }

    private String toJson(EntityFields fields) throws JsonProcessingException {
        return fields == null ? null : objectMapper.writeValueAsString(fields);
    }
}
