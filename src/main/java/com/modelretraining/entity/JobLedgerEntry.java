package com.modelretraining.entity;

import com.modelretraining.model.JobStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "job_ledger",
    indexes = {
        @Index(name = "idx_job_submitted", columnList = "submitted_at"),
        @Index(name = "idx_job_status",    columnList = "status"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobLedgerEntry {

    @Id
    @Column(name = "job_id", updatable = false, nullable = false)
    private UUID jobId;

    @Column(name = "trigger_id", length = 200)
    private String triggerId;

    private int priority;

    @Column(name = "cpu_cores")
    private int cpuCores;

    @Column(name = "memory_mb")
    private long memoryMb;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(length = 500)
    private String message;
}
