package com.modelretraining.collaborator;

import com.modelretraining.model.EvaluationSlice;

/**
 * Opaque handle to a fitted model. Returns one prediction per row of the slice.
 */
@FunctionalInterface
public interface PredictiveModel {

    double[] predict(EvaluationSlice slice);
}
