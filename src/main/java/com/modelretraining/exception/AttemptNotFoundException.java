package com.modelretraining.exception;

public class AttemptNotFoundException extends RetrainingException {
    public AttemptNotFoundException(String triggerId) {
        super("ATTEMPT_NOT_FOUND", "No retraining attempt recorded for trigger '" + triggerId + "'.");
    }
}
