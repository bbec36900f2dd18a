package com.modelretraining.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class DriftAlertRequest {

    @Size(max = 200, message = "featureId must be at most 200 characters")
    String featureId;

    @NotNull(message = "severity is required")
    @DecimalMin(value = "0.0", message = "severity must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "severity must be between 0 and 1")
    Double severity;

    @NotBlank(message = "triggerId is required")
    @Size(max = 200, message = "triggerId must be at most 200 characters")
    String triggerId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant observedAt;
}
