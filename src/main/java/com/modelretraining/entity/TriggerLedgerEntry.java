package com.modelretraining.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "trigger_ledger")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerLedgerEntry {

    @Id
    @Column(name = "ledger_key", length = 200, nullable = false, updatable = false)
    private String ledgerKey;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;
}
