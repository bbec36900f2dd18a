package com.modelretraining.model;

public enum NotificationEventType {
    RETRAINING_SKIPPED("retraining_skipped"),
    RETRAINING_ABORTED("retraining_aborted"),
    VALIDATION_FAILED("validation_failed"),
    MODEL_PROMOTED("model_promoted"),
    MODEL_ROLLBACK("model_rollback");

    private final String eventName;

    NotificationEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
