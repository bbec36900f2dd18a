package com.modelretraining.repository;

import com.modelretraining.entity.RetrainAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface RetrainAttemptRepository extends JpaRepository<RetrainAttempt, UUID> {

    Optional<RetrainAttempt> findTopByTriggerIdOrderByEnqueuedAtDesc(String triggerId);
}
