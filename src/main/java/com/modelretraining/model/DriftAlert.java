package com.modelretraining.model;

import java.time.Instant;

public record DriftAlert(String featureId, double severity, String triggerId, Instant observedAt) {

    public DriftAlert {
        if (triggerId == null || triggerId.isBlank()) {
            throw new IllegalArgumentException("triggerId must not be blank");
        }
        if (Double.isNaN(severity) || severity < 0.0 || severity > 1.0) {
            throw new IllegalArgumentException("severity must be within [0, 1]: " + severity);
        }
    }
}
