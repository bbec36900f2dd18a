package com.modelretraining.entity;

import com.modelretraining.model.RetrainStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "retrain_attempt",
    indexes = @Index(name = "idx_attempt_trigger", columnList = "trigger_id, enqueued_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrainAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trigger_id", nullable = false, length = 200)
    private String triggerId;

    private double severity;

    @Column(name = "enqueued_at", nullable = false)
    private Instant enqueuedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RetrainStatus status;

    @Column(name = "candidate_run_id", length = 200)
    private String candidateRunId;

    @Column(name = "model_version", length = 200)
    private String modelVersion;

    @Column(length = 1000)
    private String reason;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
