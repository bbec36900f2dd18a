package com.modelretraining.model;

import com.modelretraining.collaborator.PredictiveModel;

public record ProductionModel(String runId, String version, PredictiveModel handle) {
}
