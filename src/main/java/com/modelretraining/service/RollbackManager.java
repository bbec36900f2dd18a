package com.modelretraining.service;

import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.entity.StableModelRecord;
import com.modelretraining.repository.StableModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps the last model confirmed stable in production and re-promotes it on
 * demand. There is at most one stable record; registering a new one overwrites it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackManager {

    private final StableModelRepository repository;
    private final ProductionModelRegistry registry;
    private final Clock clock;

    @Transactional
    public StableModelRecord registerStable(String runId, String version) {
        StableModelRecord record = repository.findById(StableModelRecord.SINGLETON_ID)
            .orElseGet(() -> StableModelRecord.builder().id(StableModelRecord.SINGLETON_ID).build());
        record.setRunId(runId);
        record.setVersion(version);
        record.setRecordedAt(Instant.now(clock));
        StableModelRecord saved = repository.save(record);
        log.info("Stable model registered | runId={} | version={}", runId, version);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<StableModelRecord> getStable() {
        return repository.findById(StableModelRecord.SINGLETON_ID);
    }

    /**
     * Re-applies the stable model as production. Returns {@code false} when no
     * stable model is known; that case needs manual intervention.
     */
    public boolean attemptRollback(String reason) {
        Optional<StableModelRecord> stable;
        try {
            stable = getStable();
        } catch (RuntimeException ex) {
            log.error("Rollback failed, stable record unreadable | reason={}", reason, ex);
            return false;
        }
        if (stable.isEmpty()) {
            log.error("Rollback failed, no stable model recorded | reason={}", reason);
            return false;
        }
        StableModelRecord record = stable.get();
        try {
            registry.promote(record.getRunId(), record.getVersion());
            log.info("Rollback successful | reason={} | runId={} | version={}",
                     reason, record.getRunId(), record.getVersion());
            return true;
        } catch (RuntimeException ex) {
            log.error("Rollback failed | reason={} | version={}", reason, record.getVersion(), ex);
            return false;
        }
    }
}
