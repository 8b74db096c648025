package com.premiergroup.ad_optimizer.controller;

import com.premiergroup.ad_optimizer.dto.Decision;
import com.premiergroup.ad_optimizer.dto.ExecuteActionRequest;
import com.premiergroup.ad_optimizer.dto.ExecuteActionResponse;
import com.premiergroup.ad_optimizer.dto.FatigueAssessment;
import com.premiergroup.ad_optimizer.dto.LearningPhaseProgress;
import com.premiergroup.ad_optimizer.dto.OptimizationConfig;
import com.premiergroup.ad_optimizer.dto.OptimizationConfigRequest;
import com.premiergroup.ad_optimizer.dto.OptimizationCycleResult;
import com.premiergroup.ad_optimizer.dto.OptimizationSummary;
import com.premiergroup.ad_optimizer.entity.OptimizationLog;
import com.premiergroup.ad_optimizer.enums.EntityType;
import com.premiergroup.ad_optimizer.service.EntityAnalyzerService;
import com.premiergroup.ad_optimizer.service.ManualActionService;
import com.premiergroup.ad_optimizer.service.OptimizationCycleService;
import com.premiergroup.ad_optimizer.store.AuditLogSink;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/optimization")
@RequiredArgsConstructor
@Validated
public class OptimizationController {

    private final OptimizationCycleService cycleService;
    private final EntityAnalyzerService analyzerService;
    private final ManualActionService manualActionService;
    private final AuditLogSink auditLogSink;
    private final OptimizationConfig defaultOptimizationConfig;

    /**
     * Runs one cycle with the configured defaults, overridden by any non-null field of the body.
     * <p>
     * Example: POST api/optimization/cycle?accountId=act_123 {"autoExecute": true, "dryRun": false}
     */
    @PostMapping("/cycle")
    public ResponseEntity<OptimizationCycleResult> runCycle(
            @RequestParam(required = false) String accountId,
            @Valid @RequestBody(required = false) OptimizationConfigRequest overrides
    ) {
        OptimizationConfig config = overrides != null
                ? overrides.applyTo(defaultOptimizationConfig)
                : defaultOptimizationConfig;
        return ResponseEntity.ok(cycleService.runCycle(accountId, config));
    }

    @PostMapping("/cycle/stop")
    public ResponseEntity<Void> stopCycles() {
        cycleService.stop();
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/ad-sets/{adSetId}/decision")
    public ResponseEntity<Decision> analyzeAdSet(@PathVariable String adSetId) {
        return toResponse(analyzerService.analyzeAdSet(adSetId, defaultOptimizationConfig));
    }

    @GetMapping("/ads/{adId}/decision")
    public ResponseEntity<Decision> analyzeAd(@PathVariable String adId) {
        return toResponse(analyzerService.analyzeAd(adId, defaultOptimizationConfig));
    }

    @GetMapping("/ad-sets/{adSetId}/learning-phase")
    public ResponseEntity<LearningPhaseProgress> learningPhase(@PathVariable String adSetId) {
        return ResponseEntity.ok(analyzerService.learningPhase(adSetId));
    }

    @GetMapping("/ads/{adId}/fatigue")
    public ResponseEntity<FatigueAssessment> fatigue(@PathVariable String adId) {
        return ResponseEntity.ok(analyzerService.fatigue(adId, defaultOptimizationConfig));
    }

    @PostMapping("/execute")
    public ResponseEntity<ExecuteActionResponse> execute(@Valid @RequestBody ExecuteActionRequest request) {
        return ResponseEntity.ok(manualActionService.execute(request));
    }

    @GetMapping("/logs")
    public ResponseEntity<List<OptimizationLog>> logs(
            @RequestParam(required = false) EntityType entityType,
            @RequestParam(required = false) String entityId,
            @RequestParam(defaultValue = "50")
            @Positive(message = "limit must be positive")
            @Max(value = 500, message = "limit must not exceed 500")
            int limit
    ) {
        return ResponseEntity.ok(auditLogSink.recent(entityType, entityId, limit));
    }

    @GetMapping("/summary")
    public ResponseEntity<OptimizationSummary> summary(@RequestParam(required = false) String accountId) {
        return ResponseEntity.ok(cycleService.summary(accountId));
    }

    @GetMapping("/config")
    public ResponseEntity<OptimizationConfig> config() {
        return ResponseEntity.ok(defaultOptimizationConfig);
    }

    private static ResponseEntity<Decision> toResponse(Optional<Decision> decision) {
        return decision.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }
}
