package com.modelretraining.model;

import com.modelretraining.collaborator.PredictiveModel;

import java.util.Map;

public record ModelCandidate(String runId, PredictiveModel handle, Map<String, SliceMetrics> metrics) {

    public ModelCandidate {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
