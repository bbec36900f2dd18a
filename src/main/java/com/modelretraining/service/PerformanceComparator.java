package com.modelretraining.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.config.RetrainingSettings;
import com.modelretraining.entity.ComparisonAuditRecord;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.ModelCandidate;
import com.modelretraining.model.ProductionModel;
import com.modelretraining.model.SliceMetrics;
import com.modelretraining.model.Verdict;
import com.modelretraining.repository.ComparisonAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Champion/challenger comparison. Promotes only when the candidate beats the
 * production model by more than the improvement threshold on every metric of
 * every slice. Each decision is written to the comparison audit table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceComparator {

    static final String PROMOTE = "promote";
    static final String REJECT = "reject";

    private final ProductionModelRegistry registry;
    private final ComparisonAuditRepository auditRepository;
    private final RetrainingSettings settings;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public Verdict compare(ModelCandidate candidate, EvaluationSlice holdout, EvaluationSlice recent) {
        Optional<ProductionModel> production = loadProduction();
        if (production.isEmpty()) {
            log.warn("Comparison aborted, no production model | runId={}", candidate.runId());
            audit(candidate.runId(), null, REJECT, Map.of("reason", "production model unavailable"));
            return Verdict.rejected("production model unavailable");
        }
        ProductionModel prod = production.get();

        Map<String, SliceMetrics> cand = new LinkedHashMap<>();
        Map<String, SliceMetrics> champ = new LinkedHashMap<>();
        try {
            for (EvaluationSlice slice : new EvaluationSlice[] {holdout, recent}) {
                cand.put(slice.name(), RegressionMetrics.of(slice.targets(), candidate.handle().predict(slice)));
                champ.put(slice.name(), RegressionMetrics.of(slice.targets(), prod.handle().predict(slice)));
            }
        } catch (RuntimeException ex) {
            log.warn("Comparison aborted, evaluation failed | runId={} | prodVersion={} | error={}",
                     candidate.runId(), prod.version(), ex.getMessage());
            audit(candidate.runId(), prod.version(), REJECT, Map.of("reason", "evaluation failed"));
            return Verdict.rejected("evaluation failed: " + ex.getMessage());
        }

        double threshold = settings.getImprovementThreshold();
        Map<String, Map<String, Double>> deltas = new LinkedHashMap<>();
        boolean improvement = true;
        for (String slice : cand.keySet()) {
            double maeDelta = cand.get(slice).mae() - champ.get(slice).mae();
            double rmseDelta = cand.get(slice).rmse() - champ.get(slice).rmse();
            deltas.put(slice, Map.of("mae", RegressionMetrics.round(maeDelta),
                                     "rmse", RegressionMetrics.round(rmseDelta)));
            improvement &= maeDelta < -threshold && rmseDelta < -threshold;
        }

        String decision = improvement ? PROMOTE : REJECT;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("candidate", cand);
        details.put("production", champ);
        details.put("deltas", deltas);
        details.put("decision", decision);
        details.put("production_version", prod.version());

        log.info("Performance comparison | decision={} | runId={} | prodVersion={} | deltas={}",
                 decision, candidate.runId(), prod.version(), deltas);
        audit(candidate.runId(), prod.version(), decision, deltas);

        return improvement
            ? Verdict.accepted(details)
            : Verdict.rejected("candidate does not beat production by more than " + threshold
                + " on every metric", details);
    }

    private Optional<ProductionModel> loadProduction() {
        try {
            return registry.loadProductionModel();
        } catch (RuntimeException ex) {
            log.error("Production model load failed | error={}", ex.getMessage());
            return Optional.empty();
        }
    }

    private void audit(String runId, String prodVersion, String decision, Map<String, ?> deltas) {
        try {
            auditRepository.save(ComparisonAuditRecord.builder()
                .candidateRunId(runId)
                .productionVersion(prodVersion)
                .decision(decision)
                .deltasJson(mapper.writeValueAsString(deltas))
                .recordedAt(Instant.now(clock))
                .build());
        } catch (JsonProcessingException | DataAccessException ex) {
            log.error("Comparison audit write failed | runId={} | decision={}", runId, decision, ex);
        }
    }
}
