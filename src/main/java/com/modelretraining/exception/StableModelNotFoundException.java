package com.modelretraining.exception;

public class StableModelNotFoundException extends RetrainingException {
    public StableModelNotFoundException() {
        super("STABLE_MODEL_NOT_FOUND", "No stable model has been registered yet.");
    }
}
