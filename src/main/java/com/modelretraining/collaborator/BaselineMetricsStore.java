package com.modelretraining.collaborator;

import com.modelretraining.model.BaselineSlice;

import java.util.Optional;

public interface BaselineMetricsStore {

    Optional<BaselineSlice> loadBaseline(String sliceName);
}
