package com.modelretraining.repository;

import com.modelretraining.entity.JobLedgerEntry;
import com.modelretraining.model.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface JobLedgerRepository extends JpaRepository<JobLedgerEntry, UUID> {

    List<JobLedgerEntry> findByStatusInOrderBySubmittedAtAsc(Collection<JobStatus> statuses);

    @Transactional
    @Modifying
    @Query("""
        UPDATE JobLedgerEntry j
        SET j.status = :status, j.finishedAt = :at, j.message = :message
        WHERE j.jobId = :jobId
    """)
    int updateStatus(@Param("jobId") UUID jobId,
                     @Param("status") JobStatus status,
                     @Param("at") Instant at,
                     @Param("message") String message);
}
