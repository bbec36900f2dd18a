package com.modelretraining.model;

import java.util.List;

public record ReadinessReport(boolean ready, List<String> sessionIds, String dataVersion, String details) {

    public ReadinessReport {
        sessionIds = sessionIds == null ? List.of() : List.copyOf(sessionIds);
    }

    public static ReadinessReport notReady(String details) {
        return new ReadinessReport(false, List.of(), null, details);
    }
}
