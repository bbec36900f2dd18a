package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.RetrainLogEntry;
import com.modelretraining.repository.RetrainLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Business-rule gate applied after the drift listener: severity floor, cooldown
 * since the last recorded retrain, and a cap on retrains in the trailing 24h on
 * high-traffic days. An approval is recorded immediately and keeps counting
 * against the cap even if the attempt is later rejected.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleOptimizer {

    private static final Duration CAP_WINDOW = Duration.ofHours(24);

    private final RetrainLogRepository retrainLog;
    private final RetrainingSettings settings;
    private final Clock clock;

    public boolean shouldTrigger(double severity, String triggerId) {
        if (severity < settings.getOptimizerSeverityThreshold()) {
            log.info("Optimizer rejected, severity too low | triggerId={} | severity={} | floor={}",
                     triggerId, severity, settings.getOptimizerSeverityThreshold());
            return false;
        }
        Instant now = Instant.now(clock);
        try {
            Optional<RetrainLogEntry> last = retrainLog.findTopByOrderByRecordedAtDesc();
            if (last.isPresent()
                    && Duration.between(last.get().getRecordedAt(), now).compareTo(settings.getOptimizerCooldown()) < 0) {
                log.info("Optimizer rejected, cooldown active | triggerId={} | lastRetrainAt={}",
                         triggerId, last.get().getRecordedAt());
                return false;
            }

            DayOfWeek today = LocalDate.ofInstant(now, clock.getZone()).getDayOfWeek();
            if (settings.getWindowDays().contains(today)) {
                long recent = retrainLog.countByRecordedAtAfter(now.minus(CAP_WINDOW));
                if (recent >= settings.getMaxRetrainsPerWindow()) {
                    log.info("Optimizer rejected, high-traffic cap reached | triggerId={} | day={} | recent={} | cap={}",
                             triggerId, today, recent, settings.getMaxRetrainsPerWindow());
                    return false;
                }
            }

            retrainLog.save(RetrainLogEntry.builder().recordedAt(now).triggerId(triggerId).build());
        } catch (DataAccessException ex) {
            log.error("Optimizer rejected, retrain log unavailable | triggerId={}", triggerId, ex);
            return false;
        }
        log.info("Optimizer approved retrain | triggerId={} | severity={}", triggerId, severity);
        return true;
    }
}
