package com.modelretraining.service;

import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.ComparisonAuditRecord;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.ProductionModel;
import com.modelretraining.model.Verdict;
import com.modelretraining.repository.ComparisonAuditRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.modelretraining.service.EvaluationFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PerformanceComparatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-16T10:00:00Z"), ZoneOffset.UTC);

    @Mock ProductionModelRegistry registry;
    @Mock ComparisonAuditRepository auditRepository;

    private final EvaluationSlice holdout = slice(EvaluationSlice.HOLDOUT);
    private final EvaluationSlice recent = slice(EvaluationSlice.RECENT);

    private PerformanceComparator comparator(double threshold) {
        RetrainingSettings settings = RetrainingSettings.builder().improvementThreshold(threshold).build();
        return new PerformanceComparator(registry, auditRepository, settings, CLOCK);
    }

    private void production(double offset) {
        when(registry.loadProductionModel())
            .thenReturn(Optional.of(new ProductionModel("run-prod", "v1", returning(shifted(offset)))));
    }

    @Test
    void compare_candidateBetterOnEveryMetric_promotes() {
        production(1.0);

        Verdict verdict = comparator(0.0).compare(candidate("run-new"), holdout, recent);

        assertThat(verdict.accepted()).isTrue();
        assertThat(verdict.details().get("decision")).isEqualTo(PerformanceComparator.PROMOTE);
        ArgumentCaptor<ComparisonAuditRecord> audit = ArgumentCaptor.forClass(ComparisonAuditRecord.class);
        verify(auditRepository).save(audit.capture());
        assertThat(audit.getValue().getDecision()).isEqualTo(PerformanceComparator.PROMOTE);
        assertThat(audit.getValue().getCandidateRunId()).isEqualTo("run-new");
        assertThat(audit.getValue().getProductionVersion()).isEqualTo("v1");
        assertThat(audit.getValue().getDeltasJson()).contains("\"holdout\"", "\"recent\"", "-0.1");
        assertThat(audit.getValue().getRecordedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void compare_improvementBelowThreshold_rejects() {
        production(1.0);

        Verdict verdict = comparator(0.2).compare(candidate("run-new"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.details().get("decision")).isEqualTo(PerformanceComparator.REJECT);
    }

    @Test
    void compare_candidateWorse_rejects() {
        production(0.5);

        assertThat(comparator(0.0).compare(candidate("run-new"), holdout, recent).accepted()).isFalse();
    }

    @Test
    void compare_noProductionModel_failsClosed() {
        when(registry.loadProductionModel()).thenReturn(Optional.empty());

        Verdict verdict = comparator(0.0).compare(candidate("run-new"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).isEqualTo("production model unavailable");
        verify(auditRepository).save(argThat(r -> PerformanceComparator.REJECT.equals(r.getDecision())
            && r.getProductionVersion() == null));
    }

    @Test
    void compare_auditWriteFails_verdictStillReturned() {
        production(1.0);
        when(auditRepository.save(any())).thenThrow(new DataAccessResourceFailureException("audit table locked"));

        assertThat(comparator(0.0).compare(candidate("run-new"), holdout, recent).accepted()).isTrue();
    }
}
