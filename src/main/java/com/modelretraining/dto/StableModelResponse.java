package com.modelretraining.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.modelretraining.entity.StableModelRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StableModelResponse {
    String runId;
    String version;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant recordedAt;

    public static StableModelResponse from(StableModelRecord r) {
        return StableModelResponse.builder()
            .runId(r.getRunId())
            .version(r.getVersion())
            .recordedAt(r.getRecordedAt())
            .build();
    }
}
