package com.modelretraining.model;

/**
 * Stages of a single retraining attempt, in the order they must be reached.
 */
public enum FlowStage {
    TRIGGERED,
    SCHEDULE_APPROVED,
    DATA_READY,
    TRAINED,
    VALIDATED,
    COMPARED,
    PROMOTED,
    ROLLED_BACK
}
