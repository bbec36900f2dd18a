package com.modelretraining.model;

public enum RetrainStatus {
    PENDING,
    QUEUED,
    REJECTED,
    RUNNING,
    VALIDATED,
    COMPARED,
    PROMOTED,
    ROLLED_BACK,
    FAILED;

    public boolean isTerminal() {
        return this == REJECTED || this == PROMOTED || this == ROLLED_BACK || this == FAILED;
    }
}
