package com.modelretraining.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.model.NotificationEvent;
import com.modelretraining.model.NotificationEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome sink: every event is appended as a JSON line to the local notification
 * log and, when a webhook is configured, posted to it. Webhook delivery is
 * best-effort; failures are logged and never propagated to the caller.
 */
@Slf4j
@Service
public class NotificationService {

    private final RetrainingSettings settings;
    private final Clock clock;
    private final WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Object fileLock = new Object();

    public NotificationService(RetrainingSettings settings, Clock clock, WebClient.Builder builder) {
        this.settings = settings;
        this.clock = clock;
        this.webClient = builder.build();
    }

    public NotificationEvent emit(NotificationEventType type, Map<String, Object> payload) {
        NotificationEvent event = new NotificationEvent(type.eventName(), payload, Instant.now(clock));
        appendToLog(event);
        log.info("Notification emitted | event={} | payload={}", event.eventName(), event.payload());
        postWebhook(event);
        return event;
    }

    private void appendToLog(NotificationEvent event) {
        Path file = Paths.get(settings.getNotificationLogFile());
        try {
            String line = mapper.writeValueAsString(event) + System.lineSeparator();
            synchronized (fileLock) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException ex) {
            log.error("Notification log write failed | file={} | event={}", file, event.eventName(), ex);
        }
    }

    private void postWebhook(NotificationEvent event) {
        if (!settings.webhookEnabled()) {
            return;
        }
        webClient.post()
            .uri(settings.getWebhookUrl())
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .timeout(Duration.ofSeconds(5))
            .subscribe(
                r   -> log.info("Webhook notification sent | event={} | status={}", event.eventName(), r.getStatusCode()),
                err -> log.warn("Webhook notification failed | event={} | error={}", event.eventName(), err.getMessage())
            );
    }
}
