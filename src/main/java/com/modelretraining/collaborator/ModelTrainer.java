package com.modelretraining.collaborator;

import com.modelretraining.model.ModelCandidate;

import java.util.List;

public interface ModelTrainer {

    /**
     * Fits a candidate on the given sessions. Cooperative cancellation of a long
     * running fit is the implementation's responsibility.
     */
    ModelCandidate train(List<String> sessionIds, String triggerId);
}
