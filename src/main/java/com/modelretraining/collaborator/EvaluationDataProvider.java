package com.modelretraining.collaborator;

import com.modelretraining.model.EvaluationSlice;

public interface EvaluationDataProvider {

    EvaluationSlice holdout();

    EvaluationSlice recent();
}
