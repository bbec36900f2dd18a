package com.modelretraining.controller;

import com.modelretraining.dto.AlertDecisionResponse;
import com.modelretraining.dto.AttemptResponse;
import com.modelretraining.dto.ComparisonAuditResponse;
import com.modelretraining.dto.DriftAlertRequest;
import com.modelretraining.dto.RollbackRequest;
import com.modelretraining.dto.RollbackResponse;
import com.modelretraining.dto.StableModelResponse;
import com.modelretraining.exception.AttemptNotFoundException;
import com.modelretraining.exception.StableModelNotFoundException;
import com.modelretraining.model.DriftAlert;
import com.modelretraining.repository.ComparisonAuditRepository;
import com.modelretraining.repository.RetrainAttemptRepository;
import com.modelretraining.service.DriftListener;
import com.modelretraining.service.RollbackManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RetrainingController {

    private final DriftListener driftListener;
    private final RollbackManager rollbackManager;
    private final RetrainAttemptRepository attempts;
    private final ComparisonAuditRepository comparisonAudit;
    private final Clock clock;

    @PostMapping("/drift-alerts")
    public ResponseEntity<AlertDecisionResponse> driftAlert(@Valid @RequestBody DriftAlertRequest request) {
        log.info("POST /drift-alerts | triggerId={} | featureId={} | severity={}",
                 request.getTriggerId(), request.getFeatureId(), request.getSeverity());
        Instant observedAt = request.getObservedAt() != null ? request.getObservedAt() : Instant.now(clock);
        boolean forwarded = driftListener.handleAlert(new DriftAlert(
            request.getFeatureId(), request.getSeverity(), request.getTriggerId(), observedAt));
        AlertDecisionResponse body = AlertDecisionResponse.builder()
            .triggerId(request.getTriggerId())
            .forwarded(forwarded)
            .build();
        return ResponseEntity.status(forwarded ? HttpStatus.ACCEPTED : HttpStatus.OK).body(body);
    }

    @GetMapping("/attempts/{triggerId}")
    public ResponseEntity<AttemptResponse> latestAttempt(@PathVariable String triggerId) {
        return attempts.findTopByTriggerIdOrderByEnqueuedAtDesc(triggerId)
            .map(AttemptResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new AttemptNotFoundException(triggerId));
    }

    @GetMapping("/comparisons/{runId}")
    public ResponseEntity<List<ComparisonAuditResponse>> comparisons(@PathVariable String runId) {
        return ResponseEntity.ok(comparisonAudit.findByCandidateRunIdOrderByRecordedAtDesc(runId).stream()
            .map(ComparisonAuditResponse::from)
            .toList());
    }

    @GetMapping("/stable-model")
    public ResponseEntity<StableModelResponse> stableModel() {
        return rollbackManager.getStable()
            .map(StableModelResponse::from)
            .map(ResponseEntity::ok)
            .orElseThrow(StableModelNotFoundException::new);
    }

    @PostMapping("/stable-model/rollback")
    public ResponseEntity<RollbackResponse> rollback(@Valid @RequestBody RollbackRequest request) {
        log.info("POST /stable-model/rollback | reason={}", request.getReason());
        boolean rolledBack = rollbackManager.attemptRollback(request.getReason());
        return ResponseEntity.ok(RollbackResponse.builder()
            .reason(request.getReason())
            .rolledBack(rolledBack)
            .build());
    }
}
