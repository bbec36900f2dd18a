package com.modelretraining.service;

import com.modelretraining.collaborator.BaselineMetricsStore;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.model.BaselineSlice;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.ModelCandidate;
import com.modelretraining.model.SliceMetrics;
import com.modelretraining.model.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.stat.inference.TTest;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pre-deployment gate. A candidate passes only when its MAE beats the production
 * baseline on both the hold-out and the recent slice and a paired two-sided
 * t-test between candidate and baseline predictions is significant on both.
 * Anything that prevents the test from being computed is a rejection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationGate {

    private final BaselineMetricsStore baselineStore;
    private final RetrainingSettings settings;
    private final TTest tTest = new TTest();

    public Verdict validate(ModelCandidate candidate, EvaluationSlice holdout, EvaluationSlice recent) {
        double alpha = settings.getSignificanceLevel();

        double[] holdoutPred;
        double[] recentPred;
        SliceMetrics candHoldout;
        SliceMetrics candRecent;
        try {
            holdoutPred = candidate.handle().predict(holdout);
            recentPred = candidate.handle().predict(recent);
            candHoldout = RegressionMetrics.of(holdout.targets(), holdoutPred);
            candRecent = RegressionMetrics.of(recent.targets(), recentPred);
        } catch (RuntimeException ex) {
            log.warn("Validation gate rejected, candidate could not be evaluated | runId={} | error={}",
                     candidate.runId(), ex.getMessage());
            return Verdict.rejected("candidate evaluation failed: " + ex.getMessage());
        }

        Optional<BaselineSlice> baselineHoldout = loadBaseline(EvaluationSlice.HOLDOUT);
        Optional<BaselineSlice> baselineRecent = loadBaseline(EvaluationSlice.RECENT);
        if (baselineHoldout.isEmpty() || baselineRecent.isEmpty()) {
            log.error("Validation gate rejected, baseline metrics unavailable | runId={}", candidate.runId());
            return Verdict.rejected("baseline metrics unavailable");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("candidate", Map.of(EvaluationSlice.HOLDOUT, candHoldout, EvaluationSlice.RECENT, candRecent));
        details.put("baseline", Map.of(
            EvaluationSlice.HOLDOUT, baselineHoldout.get().metrics(),
            EvaluationSlice.RECENT, baselineRecent.get().metrics()));

        double pHoldout;
        double pRecent;
        try {
            pHoldout = pairedPValue(holdoutPred, baselineHoldout.get(), holdout);
            pRecent = pairedPValue(recentPred, baselineRecent.get(), recent);
        } catch (IllegalArgumentException | MathIllegalStateException ex) {
            log.warn("Validation gate rejected, t-test unavailable | runId={} | error={}",
                     candidate.runId(), ex.getMessage());
            return Verdict.rejected("t-test could not be performed: " + ex.getMessage(), details);
        }

        boolean improvementHoldout = candHoldout.mae() < baselineHoldout.get().mae();
        boolean improvementRecent = candRecent.mae() < baselineRecent.get().mae();
        boolean significant = pHoldout < alpha && pRecent < alpha;

        details.put("p_values", Map.of(EvaluationSlice.HOLDOUT, pHoldout, EvaluationSlice.RECENT, pRecent));
        details.put("significant", significant);
        details.put("improvement", Map.of(
            EvaluationSlice.HOLDOUT, improvementHoldout, EvaluationSlice.RECENT, improvementRecent));

        if (improvementHoldout && improvementRecent && significant) {
            log.info("Validation gate passed | runId={} | pHoldout={} | pRecent={} | maeHoldout={} | maeRecent={}",
                     candidate.runId(), pHoldout, pRecent, candHoldout.mae(), candRecent.mae());
            return Verdict.accepted(details);
        }
        String reason = !(improvementHoldout && improvementRecent)
            ? "candidate does not improve MAE on both slices"
            : "improvement is not statistically significant at " + alpha;
        log.warn("Validation gate failed | runId={} | reason={} | details={}", candidate.runId(), reason, details);
        return Verdict.rejected(reason, details);
    }

    private Optional<BaselineSlice> loadBaseline(String slice) {
        try {
            return baselineStore.loadBaseline(slice);
        } catch (RuntimeException ex) {
            log.error("Baseline load failed | slice={} | error={}", slice, ex.getMessage());
            return Optional.empty();
        }
    }

    private double pairedPValue(double[] candidatePred, BaselineSlice baseline, EvaluationSlice slice) {
        double[] baselinePred = baseline.predictions();
        if (baselinePred == null) {
            throw new IllegalArgumentException("baseline predictions missing for slice '" + slice.name() + "'");
        }
        if (baselinePred.length != slice.size() || candidatePred.length != slice.size()) {
            throw new IllegalArgumentException("baseline prediction length mismatch on slice '" + slice.name() + "'");
        }
        double p = tTest.pairedTTest(candidatePred, baselinePred);
        if (Double.isNaN(p)) {
            throw new IllegalArgumentException("p-value undefined on slice '" + slice.name() + "'");
        }
        return p;
    }
}
