package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds {@code {model}_{season}_{circuit}_{utcTimestamp}_{triggerType}_{triggerId}[_{dataVersion}][_{codeVersion}]}.
 */
@Component
@RequiredArgsConstructor
public class ModelVersionGenerator {

    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]+");
    private static final int MAX_LENGTH = 128;

    private final RetrainingSettings settings;
    private final Clock clock;

    public String generate(String season, String circuit, String triggerType, String triggerId, String dataVersion) {
        List<String> parts = new ArrayList<>();
        parts.add(settings.getModelName());
        parts.add(orDefault(season, settings.getDefaultSeason()));
        parts.add(orDefault(circuit, settings.getDefaultCircuit()));
        parts.add(TIMESTAMP.format(clock.instant()));
        parts.add(triggerType);
        parts.add(triggerId);
        if (dataVersion != null && !dataVersion.isBlank()) {
            parts.add(dataVersion);
        }
        if (!settings.getCodeVersion().isBlank()) {
            parts.add(settings.getCodeVersion());
        }
        String version = String.join("_", parts.stream().map(this::sanitize).toList());
        return version.length() > MAX_LENGTH ? version.substring(0, MAX_LENGTH) : version;
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private String sanitize(String part) {
        return UNSAFE.matcher(part.trim()).replaceAll("-");
    }
}
