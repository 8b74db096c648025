package com.premiergroup.ad_optimizer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.EntityFields;
import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.Priority;
import com.premiergroup.ad_optimizer.store.AuditLogSink;
import com.premiergroup.ad_optimizer.store.EntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecisionExecutorServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-18T10:00:00Z");

    @Mock
    private EntityStore entityStore;

    @Mock
    private AuditLogSink auditLogSink;

    private DecisionExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = new DecisionExecutorService(entityStore, auditLogSink, new ObjectMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Decision.DecisionBuilder decision(EntityType type, String id, OptimizationAction action) {
        return Decision.builder()
                .entityType(type)
                .entityId(id)
                .accountId("acc-1")
                .campaignId("c-1")
                .action(action)
                .reason("test")
                .priority(Priority.HIGH)
                .confidence(0.85);
    }

    private static Decision pauseAdSet(String id) {
        return decision(EntityType.AD_SET, id, OptimizationAction.PAUSE)
                .previousValue(EntityFields.status(EntityStatus.ACTIVE))
                .newValue(EntityFields.status(EntityStatus.PAUSED))
                .build();
    }

    private static Decision scaleAdSet(String id) {
        return decision(EntityType.AD_SET, id, OptimizationAction.SCALE)
                .previousValue(new EntityFields(EntityStatus.ACTIVE, new BigDecimal("100.00")))
                .newValue(EntityFields.budget(new BigDecimal("120.00")))
                .build();
    }

    private OptimizationLog capturedLog() {
        ArgumentCaptor<OptimizationLog> captor = ArgumentCaptor.forClass(OptimizationLog.class);
        verify(auditLogSink).append(captor.capture());
        return captor.getValue();
    }

    @Test
    void pauseAdSetWritesStatusAndAudits() {
        when(entityStore.updateAdSetStatus("as-1", EntityStatus.ACTIVE, EntityStatus.PAUSED)).thenReturn(true);

        assertThat(executor.execute(pauseAdSet("as-1"), "auto_optimizer")).isTrue();

        OptimizationLog log = capturedLog();
        assertThat(log.getEntityType()).isEqualTo(EntityType.AD_SET);
        assertThat(log.getEntityId()).isEqualTo("as-1");
        assertThat(log.getAccountId()).isEqualTo("acc-1");
        assertThat(log.getAction()).isEqualTo(OptimizationAction.PAUSE);
        assertThat(log.getPreviousValue()).isEqualTo("{\"status\":\"ACTIVE\"}");
        assertThat(log.getNewValue()).isEqualTo("{\"status\":\"PAUSED\"}");
        assertThat(log.getPerformedBy()).isEqualTo("auto_optimizer");
        assertThat(log.getPerformedAt()).isEqualTo(NOW);
        assertThat(log.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("scale writes only the budget, guarded by the status and budget it was decided on")
    void scaleWritesOnlyTheBudget() {
        when(entityStore.updateAdSetBudget("as-1", EntityStatus.ACTIVE, new BigDecimal("100.00"),
                new BigDecimal("120.00"))).thenReturn(true);

        assertThat(executor.execute(scaleAdSet("as-1"), "ops@example.com")).isTrue();

        verify(entityStore, never()).updateAdSetStatus(any(), any(), any());
        assertThat(capturedLog().getNewValue()).isEqualTo("{\"budget\":120.00}");
    }

    @Test
    @DisplayName("ad set paused by an operator after analysis is not scaled")
    void scaleOfPausedAdSetFails() {
        when(entityStore.updateAdSetBudget("as-1", EntityStatus.ACTIVE, new BigDecimal("100.00"),
                new BigDecimal("120.00"))).thenReturn(false);

        assertThat(executor.execute(scaleAdSet("as-1"), "auto_optimizer")).isFalse();

        assertThat(capturedLog().isSuccess()).isFalse();
    }

    @Test
    void pauseAdUsesAdStatus() {
        when(entityStore.updateAdStatus("ad-1", EntityStatus.ACTIVE, EntityStatus.PAUSED)).thenReturn(true);

        assertThat(executor.execute(decision(EntityType.AD, "ad-1", OptimizationAction.PAUSE)
                .previousValue(EntityFields.status(EntityStatus.ACTIVE))
                .newValue(EntityFields.status(EntityStatus.PAUSED))
                .build(), null)).isTrue();

        assertThat(capturedLog().getPerformedBy()).isEqualTo(DecisionExecutorService.SYSTEM_PERFORMER);
    }

    @Test
    void nonMutatingDecisionOnlyAudits() {
        assertThat(executor.execute(decision(EntityType.AD, "ad-1", OptimizationAction.REFRESH_CREATIVE)
                .build(), " ")).isTrue();

        verifyNoInteractions(entityStore);
        OptimizationLog log = capturedLog();
        assertThat(log.getPreviousValue()).isNull();
        assertThat(log.getNewValue()).isNull();
        assertThat(log.getPerformedBy()).isEqualTo("system");
    }

    @Test
    @DisplayName("entity gone or already in the target state is audited as a failure")
    void unchangedRowIsAuditedAsFailure() {
        when(entityStore.updateAdSetStatus("as-gone", EntityStatus.ACTIVE, EntityStatus.PAUSED)).thenReturn(false);

        assertThat(executor.execute(pauseAdSet("as-gone"), "system")).isFalse();

        assertThat(capturedLog().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("store failure returns false and is still audited")
    void storeFailureIsAudited() {
        when(entityStore.updateAdSetStatus("as-1", EntityStatus.ACTIVE, EntityStatus.PAUSED))
                .thenThrow(new IllegalStateException("database unavailable"));

        assertThat(executor.execute(pauseAdSet("as-1"), "system")).isFalse();

        OptimizationLog log = capturedLog();
        assertThat(log.isSuccess()).isFalse();
        assertThat(log.getNewValue()).isEqualTo("{\"status\":\"PAUSED\"}");
    }

    @Test
    void auditFailureReturnsFalse() {
        when(entityStore.updateAdStatus("ad-1", EntityStatus.PAUSED, EntityStatus.ACTIVE)).thenReturn(true);
        when(auditLogSink.append(any())).thenThrow(new IllegalStateException("disk full"));

        assertThat(executor.execute(decision(EntityType.AD, "ad-1", OptimizationAction.ACTIVATE)
                .previousValue(EntityFields.status(EntityStatus.PAUSED))
                .newValue(EntityFields.status(EntityStatus.ACTIVE))
                .build(), "system")).isFalse();
    }

    @Test
    void budgetOnAdIsRejected() {
        assertThat(executor.execute(decision(EntityType.AD, "ad-1", OptimizationAction.SCALE)
                .previousValue(new EntityFields(EntityStatus.ACTIVE, BigDecimal.ONE))
                .newValue(EntityFields.budget(BigDecimal.TEN))
                .build(), "system")).isFalse();

        verifyNoInteractions(entityStore);
        assertThat(capturedLog().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("mutation without the state it was decided on is refused")
    void missingExpectedStateIsRejected() {
        assertThat(executor.execute(decision(EntityType.AD_SET, "as-1", OptimizationAction.PAUSE)
                .newValue(EntityFields.status(EntityStatus.PAUSED))
                .build(), "system")).isFalse();

        verifyNoInteractions(entityStore);
        assertThat(capturedLog().isSuccess()).isFalse();
    }
}
