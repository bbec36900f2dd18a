package com.modelretraining.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.modelretraining.entity.RetrainAttempt;
import com.modelretraining.model.RetrainStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttemptResponse {
    String triggerId;
    double severity;
    RetrainStatus status;
    boolean terminal;
    String candidateRunId;
    String modelVersion;
    String reason;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant enqueuedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;

    public static AttemptResponse from(RetrainAttempt a) {
        return AttemptResponse.builder()
            .triggerId(a.getTriggerId())
            .severity(a.getSeverity())
            .status(a.getStatus())
            .terminal(a.getStatus().isTerminal())
            .candidateRunId(a.getCandidateRunId())
            .modelVersion(a.getModelVersion())
            .reason(a.getReason())
            .enqueuedAt(a.getEnqueuedAt())
            .updatedAt(a.getUpdatedAt())
            .build();
    }
}
