package com.modelretraining.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record NotificationEvent(
    @JsonProperty("event_name") String eventName,
    Map<String, Object> payload,
    @JsonFormat(shape = JsonFormat.Shape.STRING) Instant timestamp
) {
    public NotificationEvent {
        payload = payload == null ? Map.of() : payload;
    }
}
