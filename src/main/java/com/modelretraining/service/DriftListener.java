package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.RetrainAttempt;
import com.modelretraining.entity.TriggerLedgerEntry;
import com.modelretraining.model.DriftAlert;
import com.modelretraining.model.NotificationEventType;
import com.modelretraining.model.RetrainStatus;
import com.modelretraining.model.TrainingJob;
import com.modelretraining.repository.RetrainAttemptRepository;
import com.modelretraining.repository.TriggerLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for drift alerts. Filters out low-severity alerts, repeats of the
 * same trigger inside the debounce window, alert storms inside the global
 * cooldown and alerts arriving while the job queue is full; everything else is
 * turned into a queued retraining job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftListener {

    static final String GLOBAL_KEY = "last_job_timestamp";
    static final String TRIGGER_KEY_PREFIX = "trigger:";

    static final int CRITICAL_PRIORITY = 0;
    static final int REGULAR_PRIORITY = 5;

    private final TriggerLedgerRepository triggerLedger;
    private final RetrainAttemptRepository attempts;
    private final ResourceManager resourceManager;
    private final RetrainingFlow retrainingFlow;
    private final NotificationService notifications;
    private final RetrainingSettings settings;
    private final Clock clock;

    public boolean handleAlert(DriftAlert alert) {
        log.debug("Drift alert received | featureId={} | triggerId={} | severity={} | observedAt={}",
                  alert.featureId(), alert.triggerId(), alert.severity(), alert.observedAt());
        return handleAlert(alert.severity(), alert.triggerId());
    }

    /**
     * Serialized so that two concurrent alerts for one trigger cannot both pass the
     * debounce check.
     *
     * @return {@code true} when a retraining job was queued for this alert
     */
    public synchronized boolean handleAlert(double severity, String triggerId) {
        if (severity < settings.getListenerSeverityThreshold()) {
            log.info("Drift alert ignored, severity below threshold | triggerId={} | severity={} | threshold={}",
                     triggerId, severity, settings.getListenerSeverityThreshold());
            return false;
        }

        Instant now = Instant.now(clock);
        String triggerKey = TRIGGER_KEY_PREFIX + triggerId;
        try {
            Optional<Instant> lastSeen = lastSeen(triggerKey);
            if (lastSeen.isPresent() && within(lastSeen.get(), now, settings.getDebounceWindow())) {
                log.info("Drift alert debounced | triggerId={} | lastSeenAt={}", triggerId, lastSeen.get());
                return false;
            }
            Optional<Instant> lastJob = lastSeen(GLOBAL_KEY);
            if (lastJob.isPresent() && within(lastJob.get(), now, settings.getListenerCooldown())) {
                log.info("Drift alert suppressed, global cooldown active | triggerId={} | lastJobAt={}",
                         triggerId, lastJob.get());
                return false;
            }
        } catch (DataAccessException ex) {
            log.error("Drift alert dropped, trigger ledger unreadable | triggerId={}", triggerId, ex);
            return false;
        }

        if (resourceManager.isAtCapacity()) {
            log.warn("Drift alert dropped, job queue at capacity | triggerId={} | queueDepth={}",
                     triggerId, resourceManager.queueDepth());
            return false;
        }

        // Ledger first: a failed enqueue must still suppress repeats of this trigger.
        RetrainAttempt attempt;
        try {
            triggerLedger.saveAll(List.of(
                new TriggerLedgerEntry(triggerKey, now),
                new TriggerLedgerEntry(GLOBAL_KEY, now)));
            attempt = attempts.save(RetrainAttempt.builder()
                .triggerId(triggerId)
                .severity(severity)
                .enqueuedAt(now)
                .status(RetrainStatus.PENDING)
                .updatedAt(now)
                .build());
        } catch (DataAccessException ex) {
            log.error("Drift alert dropped, trigger ledger unwritable | triggerId={}", triggerId, ex);
            return false;
        }

        int priority = severity >= settings.getCriticalSeverity() ? CRITICAL_PRIORITY : REGULAR_PRIORITY;
        TrainingJob job = TrainingJob.builder()
            .triggerId(triggerId)
            .priority(priority)
            .requirement(settings.defaultRequirement())
            .payload(() -> retrainingFlow.run(severity, triggerId,
                                              settings.getDefaultSeason(), settings.getDefaultCircuit()))
            .containerCommand(settings.isUseIsolatedExecution() ? containerCommand(severity, triggerId) : List.of())
            .build();

        if (!updateAttempt(attempt, RetrainStatus.QUEUED, null)) {
            return false;
        }
        if (!resourceManager.submitJob(job)) {
            updateAttempt(attempt, RetrainStatus.REJECTED, "resource_unavailable");
            notifications.emit(NotificationEventType.RETRAINING_SKIPPED,
                               Map.of("reason", "resource_unavailable", "trigger_id", triggerId));
            return false;
        }

        log.info("Drift alert forwarded | triggerId={} | severity={} | priority={} | jobId={}",
                 triggerId, severity, priority, job.getJobId());
        return true;
    }

    /**
     * The configured container command with job tokens filled in. The container
     * runs the retraining flow against the shared ledger and claims the queued
     * attempt itself.
     */
    List<String> containerCommand(double severity, String triggerId) {
        return settings.getContainerCommand().stream()
            .map(arg -> arg.replace("{trigger_id}", triggerId)
                .replace("{severity}", String.valueOf(severity))
                .replace("{season}", settings.getDefaultSeason())
                .replace("{circuit}", settings.getDefaultCircuit()))
            .toList();
    }

    private Optional<Instant> lastSeen(String key) {
        return triggerLedger.findById(key).map(TriggerLedgerEntry::getLastSeenAt);
    }

    private static boolean within(Instant since, Instant now, Duration window) {
        return Duration.between(since, now).compareTo(window) < 0;
    }

    private boolean updateAttempt(RetrainAttempt attempt, RetrainStatus status, String reason) {
        attempt.setStatus(status);
        attempt.setReason(reason);
        attempt.setUpdatedAt(Instant.now(clock));
        try {
            attempts.save(attempt);
            return true;
        } catch (DataAccessException ex) {
            log.error("Attempt update failed | triggerId={} | status={}", attempt.getTriggerId(), status, ex);
            return false;
        }
    }
}
