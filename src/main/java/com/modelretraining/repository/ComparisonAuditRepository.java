package com.modelretraining.repository;

import com.modelretraining.entity.ComparisonAuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ComparisonAuditRepository extends JpaRepository<ComparisonAuditRecord, Long> {

    List<ComparisonAuditRecord> findByCandidateRunIdOrderByRecordedAtDesc(String candidateRunId);
}
