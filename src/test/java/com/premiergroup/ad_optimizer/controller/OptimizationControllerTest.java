package com.premiergroup.ad_optimizer.controller;

import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.EntityFields;
import com.premiergroup.ad_optimizer.dto.OptimizationConfig;
import com.premiergroup.ad_optimizer.dto.OptimizationCycleResult;
import com.premiergroup.ad_optimizer.enums.EntityStatus;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.enums.OptimizationAction;
import com.premiergroup.ad_optimizer.enums.Priority;
import com.premiergroup.ad_optimizer.exception.InvalidOptimizationConfigException;
import com.premiergroup.ad_optimizer.exception.OptimizationEntityNotFoundException;
import com.premiergroup.ad_optimizer.service.EntityAnalyzerService;
import com.premiergroup.ad_optimizer.service.ManualActionService;
import com.premiergroup.ad_optimizer.service.OptimizationCycleService;
import com.premiergroup.ad_optimizer.store.AuditLogSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OptimizationControllerTest {

    @Mock
    private OptimizationCycleService cycleService;

    @Mock
    private EntityAnalyzerService analyzerService;

    @Mock
    private ManualActionService manualActionService;

    @Mock
    private AuditLogSink auditLogSink;

    private final OptimizationConfig defaults = OptimizationConfig.defaults();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        OptimizationController controller = new OptimizationController(
                cycleService, analyzerService, manualActionService, auditLogSink, defaults);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionAdvice())
                .build();
    }

    private static OptimizationCycleResult emptyResult() {
        Instant now = Instant.parse("2026-10-18T10:00:00Z");
        return new OptimizationCycleResult("opt_1", now, now, 0, 0, Map.of(), List.of(), List.of());
    }

    @Test
    void cycleAppliesBodyOverridesToDefaults() throws Exception {
        when(cycleService.runCycle(eq("act_123"), any())).thenReturn(emptyResult());

        mockMvc.perform(post("/api/optimization/cycle")
                        .param("accountId", "act_123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"autoExecute\": true, \"dryRun\": false, \"targetCPA\": 40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleId").value("opt_1"))
                .andExpect(jsonPath("$.actionsByType.REFRESH_CREATIVE").value(0));

        ArgumentCaptor<OptimizationConfig> config = ArgumentCaptor.forClass(OptimizationConfig.class);
        verify(cycleService).runCycle(eq("act_123"), config.capture());
        assertThat(config.getValue().isAutoExecute()).isTrue();
        assertThat(config.getValue().isDryRun()).isFalse();
        assertThat(config.getValue().getTargetCPA()).isEqualTo(40.0);
        assertThat(config.getValue().getTargetROAS()).isEqualTo(defaults.getTargetROAS());
    }

    @Test
    void cycleWithoutBodyUsesDefaults() throws Exception {
        when(cycleService.runCycle(null, defaults)).thenReturn(emptyResult());

        mockMvc.perform(post("/api/optimization/cycle"))
                .andExpect(status().isOk());
    }

    @Test
    void invalidOverrideIsRejected() throws Exception {
        mockMvc.perform(post("/api/optimization/cycle")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetCPA\": -5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("targetCPA: targetCPA must be positive"));

        verifyNoInteractions(cycleService);
    }

    @Test
    void invalidConfigFromCycleIsBadRequest() throws Exception {
        when(cycleService.runCycle(any(), any()))
                .thenThrow(new InvalidOptimizationConfigException("lookbackDays must be at least 1, got 0"));

        mockMvc.perform(post("/api/optimization/cycle"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("lookbackDays must be at least 1, got 0"));
    }

    @Test
    void decisionIsReturned() throws Exception {
        when(analyzerService.analyzeAdSet("as-1", defaults)).thenReturn(Optional.of(Decision.builder()
                .entityType(EntityType.AD_SET)
                .entityId("as-1")
                .action(OptimizationAction.PAUSE)
                .reason("High CPA")
                .priority(Priority.HIGH)
                .confidence(0.85)
                .previousValue(EntityFields.status(EntityStatus.ACTIVE))
                .newValue(EntityFields.status(EntityStatus.PAUSED))
                .build()));

        mockMvc.perform(get("/api/optimization/ad-sets/as-1/decision"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("PAUSE"))
                .andExpect(jsonPath("$.newValue.status").value("PAUSED"))
                .andExpect(jsonPath("$.newValue.budget").doesNotExist());
    }

    @Test
    void noDecisionIsNoContent() throws Exception {
        when(analyzerService.analyzeAd("ad-1", defaults)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/optimization/ads/ad-1/decision"))
                .andExpect(status().isNoContent());
    }

    @Test
    void unknownEntityIsNotFound() throws Exception {
        when(analyzerService.analyzeAdSet("as-none", defaults))
                .thenThrow(new OptimizationEntityNotFoundException(EntityType.AD_SET, "as-none"));

        mockMvc.perform(get("/api/optimization/ad-sets/as-none/decision"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("AdSet not found or not active: as-none"));
    }

    @Test
    void executeRequiresEntityId() throws Exception {
        mockMvc.perform(post("/api/optimization/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityType\": \"AD_SET\", \"action\": \"PAUSE\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(manualActionService);
    }

    @Test
    void logsPassFiltersAndLimit() throws Exception {
        when(auditLogSink.recent(EntityType.AD, "ad-1", 20)).thenReturn(List.of());

        mockMvc.perform(get("/api/optimization/logs")
                        .param("entityType", "AD")
                        .param("entityId", "ad-1")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void configExposesDefaults() throws Exception {
        mockMvc.perform(get("/api/optimization/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetCPA").value(50.0))
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.autoExecute").value(false));
    }

    @Test
    void stopIsAccepted() throws Exception {
        mockMvc.perform(post("/api/optimization/cycle/stop"))
                .andExpect(status().isAccepted());

        verify(cycleService).stop();
    }
}
