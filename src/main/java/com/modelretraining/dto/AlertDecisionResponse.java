package com.modelretraining.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertDecisionResponse {
    String triggerId;
    boolean forwarded;
}
