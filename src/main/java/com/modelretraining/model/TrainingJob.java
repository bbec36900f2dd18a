package com.modelretraining.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * A unit of work owned by the resource manager from submission to completion.
 * Lower {@code priority} values are served first. A {@code null} requirement
 * means the configured default applies.
 */
@Value
@Builder
public class TrainingJob {
    @Builder.Default
    UUID jobId = UUID.randomUUID();
    String triggerId;
    @Builder.Default
    int priority = 5;
    ResourceRequirement requirement;
    @NonNull
    TrainingTask payload;
    @Builder.Default
    List<String> containerCommand = List.of();
}
