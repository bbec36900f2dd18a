package com.modelretraining.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.*;

class RetrainingSettingsFactoryTest {

    @Test
    void load_emptyEnvironment_usesDefaults() {
        RetrainingSettings settings = RetrainingSettingsFactory.load(new MockEnvironment());

        assertThat(settings).isEqualTo(RetrainingSettings.defaults());
        assertThat(settings.getListenerSeverityThreshold()).isEqualTo(0.7);
        assertThat(settings.getDebounceWindow()).isEqualTo(Duration.ofSeconds(300));
        assertThat(settings.getWindowDays()).containsExactlyInAnyOrder(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
        assertThat(settings.webhookEnabled()).isFalse();
    }

    @Test
    void load_readsConfiguredValues() {
        MockEnvironment env = new MockEnvironment()
            .withProperty("retraining.listener.severity-threshold", "0.8")
            .withProperty("retraining.listener.debounce-seconds", "60")
            .withProperty("retraining.optimizer.window-days", "MONDAY, 5")
            .withProperty("retraining.resource.max-queue-size", "10")
            .withProperty("retraining.resource.use-isolated-execution", "TRUE")
            .withProperty("retraining.comparator.improvement-threshold", "0.0")
            .withProperty("retraining.notifications.webhook-url", " http://hooks.local/retrain ");

        RetrainingSettings settings = RetrainingSettingsFactory.load(env);

        assertThat(settings.getListenerSeverityThreshold()).isEqualTo(0.8);
        assertThat(settings.getDebounceWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(settings.getWindowDays()).isEqualTo(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
        assertThat(settings.getMaxQueueSize()).isEqualTo(10);
        assertThat(settings.isUseIsolatedExecution()).isTrue();
        assertThat(settings.getImprovementThreshold()).isZero();
        assertThat(settings.getWebhookUrl()).isEqualTo("http://hooks.local/retrain");
        assertThat(settings.webhookEnabled()).isTrue();
    }

    @Test
    void load_malformedValues_fallBackToDefaults() {
        MockEnvironment env = new MockEnvironment()
            .withProperty("retraining.listener.severity-threshold", "high")
            .withProperty("retraining.listener.debounce-seconds", "-5")
            .withProperty("retraining.optimizer.window-days", "FUNDAY")
            .withProperty("retraining.resource.max-queue-size", "0")
            .withProperty("retraining.resource.use-isolated-execution", "yes")
            .withProperty("retraining.validation.significance-level", "1.5");

        RetrainingSettings settings = RetrainingSettingsFactory.load(env);
        RetrainingSettings defaults = RetrainingSettings.defaults();

        assertThat(settings.getListenerSeverityThreshold()).isEqualTo(defaults.getListenerSeverityThreshold());
        assertThat(settings.getDebounceWindow()).isEqualTo(defaults.getDebounceWindow());
        assertThat(settings.getWindowDays()).isEqualTo(defaults.getWindowDays());
        assertThat(settings.getMaxQueueSize()).isEqualTo(defaults.getMaxQueueSize());
        assertThat(settings.isUseIsolatedExecution()).isFalse();
        assertThat(settings.getSignificanceLevel()).isEqualTo(0.05);
    }

    @Test
    void parseDays_rejectsOutOfRangeNumber() {
        assertThatThrownBy(() -> RetrainingSettingsFactory.parseDays("8"))
            .isInstanceOf(java.time.DateTimeException.class);
    }

    @Test
    void load_containerCommand_splitOnWhitespace() {
        MockEnvironment env = new MockEnvironment()
            .withProperty("retraining.resource.container-command",
                          "  python -m retraining.run   --trigger {trigger_id} ");

        RetrainingSettings settings = RetrainingSettingsFactory.load(env);

        assertThat(settings.getContainerCommand())
            .containsExactly("python", "-m", "retraining.run", "--trigger", "{trigger_id}");
        assertThat(RetrainingSettingsFactory.load(new MockEnvironment()
            .withProperty("retraining.resource.container-command", "")).getContainerCommand()).isEmpty();
    }
}
