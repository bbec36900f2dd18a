package com.modelretraining.config;

import com.modelretraining.model.ResourceRequirement;
import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable configuration shared by the retraining components. Loaded once at
 * start by {@link RetrainingSettingsFactory}; the builder defaults are the safe
 * fallbacks used when a key is missing or malformed.
 */
@Value
@Builder(toBuilder = true)
public class RetrainingSettings {

    @Builder.Default double listenerSeverityThreshold = 0.7;
    @Builder.Default Duration debounceWindow = Duration.ofSeconds(300);
    @Builder.Default Duration listenerCooldown = Duration.ofSeconds(600);

    @Builder.Default double optimizerSeverityThreshold = 0.7;
    @Builder.Default Duration optimizerCooldown = Duration.ofSeconds(600);
    @Builder.Default int maxRetrainsPerWindow = 3;
    @Builder.Default Set<DayOfWeek> windowDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    @Builder.Default int maxQueueSize = 5;
    @Builder.Default int cpuLimit = 2;
    @Builder.Default long memoryLimitMb = 2048;
    @Builder.Default int maxConcurrentJobs = 1;
    @Builder.Default Duration pollTimeout = Duration.ofSeconds(1);
    @Builder.Default Duration shutdownTimeout = Duration.ofSeconds(5);
    @Builder.Default boolean useIsolatedExecution = false;
    @Builder.Default String containerImage = "python:3.11-slim";
    // Tokens {trigger_id}, {severity}, {season} and {circuit} are filled per job.
    @Builder.Default List<String> containerCommand = List.of();
    @Builder.Default double criticalSeverity = 0.9;

    @Builder.Default double significanceLevel = 0.05;
    @Builder.Default double improvementThreshold = 0.01;

    @Builder.Default String notificationLogFile = "logs/notifications.log";
    @Builder.Default String webhookUrl = "";

    @Builder.Default String modelName = "production_model";
    @Builder.Default String defaultSeason = "current";
    @Builder.Default String defaultCircuit = "all";
    @Builder.Default String codeVersion = "";

    public static RetrainingSettings defaults() {
        return RetrainingSettings.builder().build();
    }

    public ResourceRequirement defaultRequirement() {
        return new ResourceRequirement(cpuLimit, memoryLimitMb);
    }

    public boolean webhookEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
