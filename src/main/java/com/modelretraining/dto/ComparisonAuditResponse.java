package com.modelretraining.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.modelretraining.entity.ComparisonAuditRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ComparisonAuditResponse {
    String candidateRunId;
    String productionVersion;
    String decision;
    @JsonRawValue
    String deltas;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;

    public static ComparisonAuditResponse from(ComparisonAuditRecord r) {
        return ComparisonAuditResponse.builder()
            .candidateRunId(r.getCandidateRunId())
            .productionVersion(r.getProductionVersion())
            .decision(r.getDecision())
            .deltas(r.getDeltasJson())
            .recordedAt(r.getRecordedAt())
            .build();
    }
}
