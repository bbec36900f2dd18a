package com.modelretraining.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "comparison_audit")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ComparisonAuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "candidate_run_id", length = 200)
    private String candidateRunId;

    @Column(name = "production_version", length = 200)
    private String productionVersion;

    @Column(nullable = false, length = 20)
    private String decision;

    @Lob
    @Column(name = "deltas_json")
    private String deltasJson;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
