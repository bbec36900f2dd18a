package com.modelretraining.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

@Slf4j
@Configuration
public class RetrainingSettingsFactory {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetrainingSettings retrainingSettings(Environment env) {
        RetrainingSettings settings = load(env);
        if (settings.isUseIsolatedExecution() && settings.getContainerCommand().isEmpty()) {
            log.warn("Isolated execution enabled without a container command, jobs will fail "
                     + "| key=retraining.resource.container-command");
        }
        log.info("Retraining settings loaded | severityThreshold={} | debounce={} | cooldown={} | maxQueueSize={}"
                + " | windowDays={} | significanceLevel={} | improvementThreshold={} | isolated={}",
            settings.getListenerSeverityThreshold(), settings.getDebounceWindow(), settings.getListenerCooldown(),
            settings.getMaxQueueSize(), settings.getWindowDays(), settings.getSignificanceLevel(),
            settings.getImprovementThreshold(), settings.isUseIsolatedExecution());
        return settings;
    }

    static RetrainingSettings load(Environment env) {
        RetrainingSettings d = RetrainingSettings.defaults();
        return RetrainingSettings.builder()
            .listenerSeverityThreshold(read(env, "retraining.listener.severity-threshold",
                Double::parseDouble, d.getListenerSeverityThreshold(), RetrainingSettingsFactory::isUnitInterval))
            .debounceWindow(seconds(env, "retraining.listener.debounce-seconds", d.getDebounceWindow()))
            .listenerCooldown(seconds(env, "retraining.listener.cooldown-seconds", d.getListenerCooldown()))
            .optimizerSeverityThreshold(read(env, "retraining.optimizer.severity-threshold",
                Double::parseDouble, d.getOptimizerSeverityThreshold(), RetrainingSettingsFactory::isUnitInterval))
            .optimizerCooldown(seconds(env, "retraining.optimizer.cooldown-seconds", d.getOptimizerCooldown()))
            .maxRetrainsPerWindow(read(env, "retraining.optimizer.max-retrains-per-window",
                Integer::parseInt, d.getMaxRetrainsPerWindow(), v -> v >= 0))
            .windowDays(read(env, "retraining.optimizer.window-days",
                RetrainingSettingsFactory::parseDays, d.getWindowDays(), v -> true))
            .maxQueueSize(read(env, "retraining.resource.max-queue-size",
                Integer::parseInt, d.getMaxQueueSize(), v -> v > 0))
            .cpuLimit(read(env, "retraining.resource.cpu-limit",
                Integer::parseInt, d.getCpuLimit(), v -> v >= 0))
            .memoryLimitMb(read(env, "retraining.resource.memory-limit-mb",
                Long::parseLong, d.getMemoryLimitMb(), v -> v >= 0))
            .maxConcurrentJobs(read(env, "retraining.resource.max-concurrent-jobs",
                Integer::parseInt, d.getMaxConcurrentJobs(), v -> v > 0))
            .pollTimeout(read(env, "retraining.resource.poll-timeout-ms",
                s -> Duration.ofMillis(Long.parseLong(s)), d.getPollTimeout(), v -> !v.isNegative() && !v.isZero()))
            .shutdownTimeout(seconds(env, "retraining.resource.shutdown-timeout-seconds", d.getShutdownTimeout()))
            .useIsolatedExecution(read(env, "retraining.resource.use-isolated-execution",
                RetrainingSettingsFactory::parseBoolean, d.isUseIsolatedExecution(), v -> true))
            .containerImage(text(env, "retraining.resource.container-image", d.getContainerImage()))
            .containerCommand(read(env, "retraining.resource.container-command",
                RetrainingSettingsFactory::parseCommand, d.getContainerCommand(), v -> !v.isEmpty()))
            .criticalSeverity(read(env, "retraining.resource.critical-severity",
                Double::parseDouble, d.getCriticalSeverity(), RetrainingSettingsFactory::isUnitInterval))
            .significanceLevel(read(env, "retraining.validation.significance-level",
                Double::parseDouble, d.getSignificanceLevel(), v -> v > 0.0 && v < 1.0))
            .improvementThreshold(read(env, "retraining.comparator.improvement-threshold",
                Double::parseDouble, d.getImprovementThreshold(), v -> v >= 0.0))
            .notificationLogFile(text(env, "retraining.notifications.log-file", d.getNotificationLogFile()))
            .webhookUrl(env.getProperty("retraining.notifications.webhook-url", d.getWebhookUrl()).trim())
            .modelName(text(env, "retraining.model.name", d.getModelName()))
            .defaultSeason(text(env, "retraining.model.season", d.getDefaultSeason()))
            .defaultCircuit(text(env, "retraining.model.circuit", d.getDefaultCircuit()))
            .codeVersion(env.getProperty("retraining.model.code-version", d.getCodeVersion()).trim())
            .build();
    }

    private static <T> T read(Environment env, String key, Function<String, T> parser,
                              T fallback, Predicate<T> valid) {
        String raw = env.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            T value = parser.apply(raw.trim());
            if (!valid.test(value)) {
                log.warn("Config value out of range, using default | key={} | value={} | default={}",
                         key, raw, fallback);
                return fallback;
            }
            return value;
        } catch (RuntimeException ex) {
            log.warn("Malformed config value, using default | key={} | value={} | default={} | error={}",
                     key, raw, fallback, ex.getMessage());
            return fallback;
        }
    }

    private static Duration seconds(Environment env, String key, Duration fallback) {
        return read(env, key, s -> Duration.ofSeconds(Long.parseLong(s)), fallback, v -> !v.isNegative());
    }

    private static String text(Environment env, String key, String fallback) {
        String raw = env.getProperty(key);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static boolean isUnitInterval(double v) {
        return v >= 0.0 && v <= 1.0;
    }

    private static boolean parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw) || "false".equalsIgnoreCase(raw)) {
            return Boolean.parseBoolean(raw);
        }
        throw new IllegalArgumentException("not a boolean: " + raw);
    }

    static List<String> parseCommand(String raw) {
        return Arrays.stream(raw.trim().split("\\s+"))
            .filter(s -> !s.isEmpty())
            .toList();
    }

    // Accepts names (SATURDAY) or ISO numbers (6 = Saturday).
    static Set<DayOfWeek> parseDays(String raw) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(s -> days.add(s.chars().allMatch(Character::isDigit)
                ? DayOfWeek.of(Integer.parseInt(s))
                : DayOfWeek.valueOf(s.toUpperCase(Locale.ROOT))));
        return days;
    }
}
