package com.modelretraining.service;

import com.modelretraining.collaborator.DataReadinessChecker;
import com.modelretraining.collaborator.EvaluationDataProvider;
import com.modelretraining.collaborator.ModelTrainer;
import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.RetrainAttempt;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.FlowStage;
import com.modelretraining.model.ModelCandidate;
import com.modelretraining.model.NotificationEventType;
import com.modelretraining.model.ReadinessReport;
import com.modelretraining.model.RetrainStatus;
import com.modelretraining.model.Verdict;
import com.modelretraining.repository.RetrainAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Threads one retraining attempt through schedule approval, data readiness,
 * training, validation, comparison and promotion. Each attempt ends in exactly
 * one terminal status and exactly one notification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingFlow {

    static final String TRIGGER_TYPE = "drift";

    private final ScheduleOptimizer scheduleOptimizer;
    private final DataReadinessChecker readinessChecker;
    private final ModelTrainer trainer;
    private final EvaluationDataProvider evaluationData;
    private final ValidationGate validationGate;
    private final PerformanceComparator comparator;
    private final ProductionModelRegistry registry;
    private final RollbackManager rollbackManager;
    private final ModelVersionGenerator versionGenerator;
    private final NotificationService notifications;
    private final RetrainAttemptRepository attempts;
    private final RetrainingSettings settings;
    private final Clock clock;

    /**
     * Runs the attempt for {@code triggerId}. A second call for the same trigger
     * inside the debounce window is a no-op.
     */
    public void run(double severity, String triggerId, String season, String circuit) {
        Optional<RetrainAttempt> claimed;
        try {
            claimed = claim(severity, triggerId);
        } catch (DataAccessException ex) {
            log.error("Retraining skipped, attempt ledger unavailable | triggerId={}", triggerId, ex);
            notifications.emit(NotificationEventType.RETRAINING_SKIPPED,
                               payload("reason", "persistence_failure", "trigger_id", triggerId));
            return;
        }
        if (claimed.isEmpty()) {
            return;
        }

        RetrainAttempt attempt = claimed.get();
        try {
            execute(attempt, severity, triggerId, season, circuit);
        } catch (RuntimeException ex) {
            log.error("Retraining flow crashed | triggerId={} | status={}", triggerId, attempt.getStatus(), ex);
            if (!attempt.getStatus().isTerminal()) {
                finish(attempt, RetrainStatus.FAILED, "unexpected_error", NotificationEventType.RETRAINING_ABORTED,
                       payload("reason", "unexpected_error", "trigger_id", triggerId, "error", ex.getMessage()));
            }
        }
    }

    private void execute(RetrainAttempt attempt, double severity, String triggerId, String season, String circuit) {
        stage(triggerId, FlowStage.TRIGGERED);

        if (!scheduleOptimizer.shouldTrigger(severity, triggerId)) {
            finish(attempt, RetrainStatus.REJECTED, "schedule_constraints", NotificationEventType.RETRAINING_SKIPPED,
                   payload("reason", "schedule_constraints", "trigger_id", triggerId));
            return;
        }
        stage(triggerId, FlowStage.SCHEDULE_APPROVED);

        ReadinessReport readiness = checkReadiness(triggerId);
        if (!readiness.ready()) {
            finish(attempt, RetrainStatus.FAILED, "data_not_ready", NotificationEventType.RETRAINING_ABORTED,
                   payload("reason", "data_not_ready", "trigger_id", triggerId, "details", readiness.details()));
            return;
        }
        stage(triggerId, FlowStage.DATA_READY);

        ModelCandidate candidate;
        try {
            candidate = trainer.train(readiness.sessionIds(), triggerId);
        } catch (RuntimeException ex) {
            log.error("Training failed | triggerId={} | sessions={}", triggerId, readiness.sessionIds().size(), ex);
            finish(attempt, RetrainStatus.FAILED, "training_failed", NotificationEventType.RETRAINING_ABORTED,
                   payload("reason", "training_failed", "trigger_id", triggerId, "error", ex.getMessage()));
            return;
        }
        attempt.setCandidateRunId(candidate.runId());
        stage(triggerId, FlowStage.TRAINED);

        EvaluationSlice holdout;
        EvaluationSlice recent;
        try {
            holdout = evaluationData.holdout();
            recent = evaluationData.recent();
        } catch (RuntimeException ex) {
            log.error("Evaluation data unavailable | triggerId={} | runId={}", triggerId, candidate.runId(), ex);
            finish(attempt, RetrainStatus.FAILED, "evaluation_data_unavailable",
                   NotificationEventType.RETRAINING_ABORTED,
                   payload("reason", "evaluation_data_unavailable", "trigger_id", triggerId,
                           "run_id", candidate.runId(), "error", ex.getMessage()));
            return;
        }

        Verdict validation = validationGate.validate(candidate, holdout, recent);
        if (!validation.accepted()) {
            boolean rolledBack = rollbackManager.attemptRollback("validation_failed");
            finish(attempt, rolledBack ? RetrainStatus.ROLLED_BACK : RetrainStatus.REJECTED, validation.reason(),
                   NotificationEventType.VALIDATION_FAILED,
                   payload("trigger_id", triggerId, "run_id", candidate.runId(), "reason", validation.reason(),
                           "rollback_performed", rolledBack, "details", validation.details()));
            return;
        }
        transition(attempt, RetrainStatus.VALIDATED);
        stage(triggerId, FlowStage.VALIDATED);

        Verdict comparison = comparator.compare(candidate, holdout, recent);
        if (!comparison.accepted()) {
            boolean rolledBack = rollbackManager.attemptRollback("comparison_rejected");
            finish(attempt, rolledBack ? RetrainStatus.ROLLED_BACK : RetrainStatus.REJECTED, comparison.reason(),
                   NotificationEventType.MODEL_ROLLBACK,
                   payload("trigger_id", triggerId, "run_id", candidate.runId(), "reason", comparison.reason(),
                           "rollback_performed", rolledBack, "details", comparison.details()));
            return;
        }
        transition(attempt, RetrainStatus.COMPARED);
        stage(triggerId, FlowStage.COMPARED);

        String version = versionGenerator.generate(season, circuit, TRIGGER_TYPE, triggerId, readiness.dataVersion());
        try {
            registry.promote(candidate.runId(), version);
        } catch (RuntimeException ex) {
            log.error("Promotion failed | triggerId={} | runId={} | version={}",
                      triggerId, candidate.runId(), version, ex);
            boolean rolledBack = rollbackManager.attemptRollback("deployment_failed");
            finish(attempt, rolledBack ? RetrainStatus.ROLLED_BACK : RetrainStatus.FAILED, "deployment_failed",
                   NotificationEventType.MODEL_ROLLBACK,
                   payload("trigger_id", triggerId, "run_id", candidate.runId(), "reason", "deployment_failed",
                           "rollback_performed", rolledBack));
            return;
        }

        boolean stableRecorded = true;
        try {
            rollbackManager.registerStable(candidate.runId(), version);
        } catch (RuntimeException ex) {
            stableRecorded = false;
            log.error("Stable model record not updated | runId={} | version={}", candidate.runId(), version, ex);
        }
        attempt.setModelVersion(version);
        finish(attempt, RetrainStatus.PROMOTED, null, NotificationEventType.MODEL_PROMOTED,
               payload("version", version, "run_id", candidate.runId(), "trigger_id", triggerId,
                       "stable_recorded", stableRecorded));
        stage(triggerId, FlowStage.PROMOTED);
    }

    /**
     * Picks up the attempt queued by the listener, or opens a new one for direct
     * callers. Empty when the trigger already ran inside the debounce window.
     */
    private Optional<RetrainAttempt> claim(double severity, String triggerId) {
        Instant now = Instant.now(clock);
        Optional<RetrainAttempt> latest = attempts.findTopByTriggerIdOrderByEnqueuedAtDesc(triggerId);
        if (latest.isPresent()) {
            RetrainAttempt existing = latest.get();
            if (existing.getStatus() == RetrainStatus.PENDING || existing.getStatus() == RetrainStatus.QUEUED) {
                existing.setStatus(RetrainStatus.RUNNING);
                existing.setUpdatedAt(now);
                return Optional.of(attempts.save(existing));
            }
            if (Duration.between(existing.getEnqueuedAt(), now).compareTo(settings.getDebounceWindow()) < 0) {
                log.info("Retraining run ignored, trigger already handled | triggerId={} | status={}",
                         triggerId, existing.getStatus());
                return Optional.empty();
            }
        }
        return Optional.of(attempts.save(RetrainAttempt.builder()
            .triggerId(triggerId)
            .severity(severity)
            .enqueuedAt(now)
            .status(RetrainStatus.RUNNING)
            .updatedAt(now)
            .build()));
    }

    private ReadinessReport checkReadiness(String triggerId) {
        try {
            ReadinessReport report = readinessChecker.checkLatestData();
            if (report.ready() && report.sessionIds().isEmpty()) {
                return ReadinessReport.notReady("no sessions available");
            }
            return report;
        } catch (RuntimeException ex) {
            log.error("Data readiness check failed | triggerId={}", triggerId, ex);
            return ReadinessReport.notReady("readiness check failed: " + ex.getMessage());
        }
    }

    private void transition(RetrainAttempt attempt, RetrainStatus status) {
        attempt.setStatus(status);
        attempt.setUpdatedAt(Instant.now(clock));
        try {
            attempts.save(attempt);
        } catch (DataAccessException ex) {
            log.error("Attempt status not persisted | triggerId={} | status={}", attempt.getTriggerId(), status, ex);
        }
    }

    private void finish(RetrainAttempt attempt, RetrainStatus status, String reason,
                        NotificationEventType event, Map<String, Object> payload) {
        attempt.setReason(reason);
        transition(attempt, status);
        log.info("Retraining attempt finished | triggerId={} | status={} | reason={}",
                 attempt.getTriggerId(), status, reason);
        if (status == RetrainStatus.ROLLED_BACK) {
            stage(attempt.getTriggerId(), FlowStage.ROLLED_BACK);
        }
        notifications.emit(event, payload);
    }

    private static void stage(String triggerId, FlowStage stage) {
        log.info("Retraining stage reached | triggerId={} | stage={}", triggerId, stage);
    }

    // Map.of rejects null values; collaborator messages may be null.
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
