package com.modelretraining.repository;

import com.modelretraining.entity.RetrainLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;

public interface RetrainLogRepository extends JpaRepository<RetrainLogEntry, Long> {

    Optional<RetrainLogEntry> findTopByOrderByRecordedAtDesc();

    long countByRecordedAtAfter(Instant cutoff);
}
