package com.modelretraining.repository;

import com.modelretraining.entity.TriggerLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TriggerLedgerRepository extends JpaRepository<TriggerLedgerEntry, String> {
}
