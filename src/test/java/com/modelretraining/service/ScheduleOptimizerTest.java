package com.modelretraining.service;

import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.RetrainLogEntry;
import com.modelretraining.repository.RetrainLogRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleOptimizerTest {

    private static final Instant SATURDAY = Instant.parse("2026-03-14T10:00:00Z");
    private static final Instant MONDAY = Instant.parse("2026-03-16T10:00:00Z");

    @Mock RetrainLogRepository retrainLog;

    private final RetrainingSettings settings = RetrainingSettings.builder()
        .optimizerCooldown(Duration.ofSeconds(600))
        .maxRetrainsPerWindow(3)
        .build();

    private ScheduleOptimizer optimizerAt(Instant now) {
        return new ScheduleOptimizer(retrainLog, settings, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void shouldTrigger_severityBelowFloor_false() {
        assertThat(optimizerAt(MONDAY).shouldTrigger(0.5, "t1")).isFalse();
        verifyNoInteractions(retrainLog);
    }

    @Test
    void shouldTrigger_withinCooldown_false() {
        when(retrainLog.findTopByOrderByRecordedAtDesc())
            .thenReturn(Optional.of(RetrainLogEntry.builder().recordedAt(MONDAY.minusSeconds(60)).build()));

        assertThat(optimizerAt(MONDAY).shouldTrigger(0.9, "t1")).isFalse();
        verify(retrainLog, never()).save(any());
    }

    @Test
    void shouldTrigger_highTrafficDayCapReached_false() {
        when(retrainLog.findTopByOrderByRecordedAtDesc())
            .thenReturn(Optional.of(RetrainLogEntry.builder().recordedAt(SATURDAY.minusSeconds(3600)).build()));
        when(retrainLog.countByRecordedAtAfter(SATURDAY.minus(Duration.ofHours(24)))).thenReturn(3L);

        assertThat(optimizerAt(SATURDAY).shouldTrigger(0.9, "t1")).isFalse();
        verify(retrainLog, never()).save(any());
    }

    @Test
    void shouldTrigger_highTrafficDayUnderCap_recordsRetrain() {
        when(retrainLog.findTopByOrderByRecordedAtDesc()).thenReturn(Optional.empty());
        when(retrainLog.countByRecordedAtAfter(any())).thenReturn(2L);

        assertThat(optimizerAt(SATURDAY).shouldTrigger(0.9, "t1")).isTrue();

        ArgumentCaptor<RetrainLogEntry> saved = ArgumentCaptor.forClass(RetrainLogEntry.class);
        verify(retrainLog).save(saved.capture());
        assertThat(saved.getValue().getRecordedAt()).isEqualTo(SATURDAY);
        assertThat(saved.getValue().getTriggerId()).isEqualTo("t1");
    }

    @Test
    void shouldTrigger_regularDay_ignoresCap() {
        when(retrainLog.findTopByOrderByRecordedAtDesc())
            .thenReturn(Optional.of(RetrainLogEntry.builder().recordedAt(MONDAY.minusSeconds(601)).build()));

        assertThat(optimizerAt(MONDAY).shouldTrigger(0.7, "t1")).isTrue();
        verify(retrainLog, never()).countByRecordedAtAfter(any());
        verify(retrainLog).save(any());
    }

    @Test
    void shouldTrigger_logUnavailable_failsClosed() {
        when(retrainLog.findTopByOrderByRecordedAtDesc()).thenReturn(Optional.empty());
        when(retrainLog.save(any())).thenThrow(new DataAccessResourceFailureException("read-only"));

        assertThat(optimizerAt(MONDAY).shouldTrigger(0.9, "t1")).isFalse();
    }
}
