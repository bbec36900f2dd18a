package com.modelretraining.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * The single live stable-model row. Always stored under {@link #SINGLETON_ID}.
 */
@Entity
@Table(name = "stable_model")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StableModelRecord {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    @Column(name = "run_id", nullable = false, length = 200)
    private String runId;

    @Column(nullable = false, length = 200)
    private String version;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
