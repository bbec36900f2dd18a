package com.modelretraining.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelretraining.collaborator.BaselineMetricsStore;
import com.modelretraining.collaborator.DataReadinessChecker;
import com.modelretraining.collaborator.EvaluationDataProvider;
import com.modelretraining.collaborator.ModelTrainer;
import com.modelretraining.collaborator.PredictiveModel;
import com.modelretraining.collaborator.ProductionModelRegistry;
import com.modelretraining.exception.MlPlatformException;
import com.modelretraining.exception.MlPlatformUnavailableException;
import com.modelretraining.model.BaselineSlice;
import com.modelretraining.model.EvaluationSlice;
import com.modelretraining.model.ModelCandidate;
import com.modelretraining.model.ProductionModel;
import com.modelretraining.model.ReadinessReport;
import com.modelretraining.model.SliceMetrics;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Adapter for the external ML platform that owns data readiness, training,
 * evaluation data and the model registry.
 */
@Slf4j
@Component
public class MlPlatformClient implements DataReadinessChecker, ModelTrainer, ProductionModelRegistry,
        BaselineMetricsStore, EvaluationDataProvider {

    @Value("${ml.platform.base-url}")
    private String baseUrl;

    @Value("${ml.platform.timeout-seconds:10}")
    private int timeoutSeconds;

    @Value("${ml.platform.training-timeout-minutes:120}")
    private int trainingTimeoutMinutes;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler((int) TimeUnit.MINUTES.toSeconds(trainingTimeoutMinutes), TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
        log.info("MlPlatformClient initialised → {}", baseUrl);
    }

    @Override
    public ReadinessReport checkLatestData() {
        JsonNode json = get("/data/readiness", shortTimeout())
            .orElseThrow(() -> new MlPlatformException("Readiness endpoint returned no body"));
        boolean ready = json.path("ready").asBoolean(false);
        List<String> sessions = new ArrayList<>();
        json.path("session_ids").forEach(n -> sessions.add(n.asText()));
        String dataVersion = json.hasNonNull("data_version") ? json.get("data_version").asText() : null;
        String details = json.path("details").asText("");
        return new ReadinessReport(ready, sessions, dataVersion, details);
    }

    @Override
    public ModelCandidate train(List<String> sessionIds, String triggerId) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode sessions = body.putArray("session_ids");
        sessionIds.forEach(sessions::add);
        body.put("trigger_id", triggerId);
        body.put("warm_start", true);

        JsonNode json = post("/train", body, Duration.ofMinutes(trainingTimeoutMinutes))
            .orElseThrow(() -> new MlPlatformException("Training endpoint returned no body"));
        if (!json.hasNonNull("run_id")) {
            throw new MlPlatformException("Training response missing 'run_id': " + json);
        }
        String runId = json.get("run_id").asText();
        Map<String, SliceMetrics> metrics = new LinkedHashMap<>();
        json.path("metrics").fields().forEachRemaining(e -> metrics.put(e.getKey(),
            new SliceMetrics(e.getValue().path("mae").asDouble(), e.getValue().path("rmse").asDouble())));
        log.info("Candidate trained | runId={} | sessions={} | triggerId={}", runId, sessionIds.size(), triggerId);
        return new ModelCandidate(runId, remoteModel(runId), metrics);
    }

    @Override
    public Optional<ProductionModel> loadProductionModel() {
        return get("/models/production", shortTimeout())
            .filter(json -> json.hasNonNull("run_id") && json.hasNonNull("version"))
            .map(json -> {
                String runId = json.get("run_id").asText();
                return new ProductionModel(runId, json.get("version").asText(), remoteModel(runId));
            });
    }

    @Override
    public void promote(String runId, String version) {
        ObjectNode body = mapper.createObjectNode();
        body.put("run_id", runId);
        body.put("version", version);
        post("/models/production", body, shortTimeout());
        log.info("Production model updated | runId={} | version={}", runId, version);
    }

    @Override
    public Optional<BaselineSlice> loadBaseline(String sliceName) {
        return get("/baselines/" + sliceName, shortTimeout())
            .filter(json -> json.hasNonNull("mae") && json.hasNonNull("rmse"))
            .map(json -> new BaselineSlice(
                json.get("mae").asDouble(),
                json.get("rmse").asDouble(),
                json.hasNonNull("predictions") ? toDoubleArray(json.get("predictions")) : null));
    }

    @Override
    public EvaluationSlice holdout() {
        return evaluationSlice(EvaluationSlice.HOLDOUT);
    }

    @Override
    public EvaluationSlice recent() {
        return evaluationSlice(EvaluationSlice.RECENT);
    }

    private EvaluationSlice evaluationSlice(String name) {
        JsonNode json = get("/evaluation/" + name, shortTimeout())
            .orElseThrow(() -> new MlPlatformException("Evaluation slice '" + name + "' not found"));
        JsonNode rows = json.path("features");
        double[][] features = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            features[i] = toDoubleArray(rows.get(i));
        }
        try {
            return new EvaluationSlice(name, features, toDoubleArray(json.path("targets")));
        } catch (IllegalArgumentException ex) {
            throw new MlPlatformException("Malformed evaluation slice '" + name + "'", ex);
        }
    }

    private PredictiveModel remoteModel(String runId) {
        return slice -> {
            ObjectNode body = mapper.createObjectNode();
            body.put("slice", slice.name());
            ArrayNode rows = body.putArray("features");
            for (double[] row : slice.features()) {
                ArrayNode r = rows.addArray();
                for (double v : row) {
                    r.add(v);
                }
            }
            JsonNode json = post("/models/" + runId + "/predict", body, shortTimeout())
                .orElseThrow(() -> new MlPlatformException("Prediction endpoint returned no body"));
            if (!json.has("predictions")) {
                throw new MlPlatformException("Prediction response missing 'predictions': " + json);
            }
            return toDoubleArray(json.get("predictions"));
        };
    }

    private Optional<JsonNode> get(String uri, Duration timeout) {
        return Optional.ofNullable(webClient.get().uri(uri)
            .exchangeToMono(this::readBody)
            .retryWhen(connectionRetry())
            .onErrorMap(this::translate)
            .block(timeout));
    }

    private Optional<JsonNode> post(String uri, JsonNode body, Duration timeout) {
        return Optional.ofNullable(webClient.post().uri(uri)
            .bodyValue(body)
            .exchangeToMono(this::readBody)
            .retryWhen(connectionRetry())
            .onErrorMap(this::translate)
            .block(timeout));
    }

    // 404 means "nothing there" and maps to an empty result rather than an error.
    private Mono<JsonNode> readBody(ClientResponse response) {
        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return response.releaseBody().then(Mono.empty());
        }
        if (response.statusCode().isError()) {
            return response.createException().flatMap(Mono::error);
        }
        return response.bodyToMono(JsonNode.class);
    }

    private Retry connectionRetry() {
        return Retry.backoff(2, Duration.ofMillis(300))
            .filter(ex -> ex instanceof WebClientRequestException)
            .onRetryExhaustedThrow((retrySpec, sig) -> new MlPlatformUnavailableException(sig.failure()));
    }

    private Throwable translate(Throwable ex) {
        if (ex instanceof MlPlatformException || ex instanceof MlPlatformUnavailableException) {
            return ex;
        }
        if (ex instanceof WebClientResponseException wre) {
            if (wre.getStatusCode().is5xxServerError()) {
                return new MlPlatformUnavailableException(wre);
            }
            return new MlPlatformException("ML platform rejected request (" + wre.getStatusCode().value()
                + "): " + wre.getResponseBodyAsString(), wre);
        }
        if (ex instanceof WebClientRequestException) {
            return new MlPlatformUnavailableException(ex);
        }
        return new MlPlatformException("ML platform call failed: " + ex.getMessage(), ex);
    }

    private Duration shortTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    private double[] toDoubleArray(JsonNode node) {
        double[] values = new double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            values[i] = node.get(i).asDouble();
        }
        return values;
    }
}
