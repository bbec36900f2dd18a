package com.modelretraining.repository;

import com.modelretraining.entity.StableModelRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StableModelRepository extends JpaRepository<StableModelRecord, Integer> {
}
