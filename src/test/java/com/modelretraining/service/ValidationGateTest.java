package com.modelretraining.service;

import com.modelretraining.collaborator.BaselineMetricsStore;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.model.BaselineSlice;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.ModelCandidate;
import com.modelretraining.model.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

import static com.modelretraining.service.EvaluationFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ValidationGateTest {

    @Mock BaselineMetricsStore baselineStore;

    private ValidationGate gate;
    private final EvaluationSlice holdout = slice(EvaluationSlice.HOLDOUT);
    private final EvaluationSlice recent = slice(EvaluationSlice.RECENT);

    @BeforeEach
    void setUp() {
        gate = new ValidationGate(baselineStore, RetrainingSettings.defaults());
    }

    private void baseline(double mae, double rmse, double[] predictions) {
        BaselineSlice b = new BaselineSlice(mae, rmse, predictions);
        when(baselineStore.loadBaseline(EvaluationSlice.HOLDOUT)).thenReturn(Optional.of(b));
        when(baselineStore.loadBaseline(EvaluationSlice.RECENT)).thenReturn(Optional.of(b));
    }

    @Test
    void validate_betterAndSignificant_accepted() {
        baseline(1.0, 1.2, baselinePredictions());

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isTrue();
        assertThat(verdict.reason()).isNull();
        Map<?, ?> pValues = (Map<?, ?>) verdict.details().get("p_values");
        assertThat((Double) pValues.get(EvaluationSlice.HOLDOUT)).isLessThan(0.05);
        assertThat((Double) pValues.get(EvaluationSlice.RECENT)).isLessThan(0.05);
        assertThat(verdict.details().get("significant")).isEqualTo(true);
    }

    @Test
    void validate_missingBaseline_rejected() {
        when(baselineStore.loadBaseline(EvaluationSlice.HOLDOUT)).thenReturn(Optional.empty());
        when(baselineStore.loadBaseline(EvaluationSlice.RECENT)).thenReturn(Optional.empty());

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).isEqualTo("baseline metrics unavailable");
    }

    @Test
    void validate_baselineStoreThrows_rejected() {
        when(baselineStore.loadBaseline(anyString())).thenThrow(new IllegalStateException("store offline"));

        assertThat(gate.validate(candidate("run-1"), holdout, recent).accepted()).isFalse();
    }

    @Test
    void validate_baselinePredictionLengthMismatch_rejected() {
        baseline(1.0, 1.2, Arrays.copyOf(baselinePredictions(), 7));

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).startsWith("t-test could not be performed");
    }

    @Test
    void validate_baselinePredictionsMissing_rejected() {
        baseline(1.0, 1.2, null);

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("baseline predictions missing");
    }

    @Test
    void validate_noMaeImprovement_rejected() {
        baseline(0.8, 1.2, baselinePredictions());

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).isEqualTo("candidate does not improve MAE on both slices");
    }

    @Test
    void validate_improvementNotSignificant_rejected() {
        double[] nearCandidate = candidatePredictions();
        for (int i = 0; i < nearCandidate.length; i++) {
            nearCandidate[i] += (i % 2 == 0 ? 0.1 : -0.1);
        }
        baseline(1.0, 1.2, nearCandidate);

        Verdict verdict = gate.validate(candidate("run-1"), holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).startsWith("improvement is not statistically significant");
        assertThat(verdict.details()).containsKey("p_values");
    }

    @Test
    void validate_candidateCannotPredict_rejected() {
        ModelCandidate broken = new ModelCandidate("run-x", slice -> {
            throw new IllegalStateException("model file corrupt");
        }, Map.of());

        Verdict verdict = gate.validate(broken, holdout, recent);

        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("model file corrupt");
        verifyNoInteractions(baselineStore);
    }
}
