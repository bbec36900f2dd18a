package com.modelretraining.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RollbackResponse {
    String reason;
    boolean rolledBack;
}
