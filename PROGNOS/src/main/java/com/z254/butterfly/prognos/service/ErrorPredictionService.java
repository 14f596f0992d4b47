package com.z254.butterfly.prognos.service;

import com.z254.butterfly.prognos.cache.PredictionCache;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AccuracyReport;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.PredictionConfidence;
import com.z254.butterfly.prognos.domain.model.PredictionOptions;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.model.PredictionResult.BusinessImpactPrediction;
import com.z254.butterfly.prognos.domain.model.PredictionResult.ErrorCountPrediction;
import com.z254.butterfly.prognos.domain.model.PredictionResult.ErrorRatePrediction;
import com.z254.butterfly.prognos.domain.model.PredictionResult.HealthState;
import com.z254.butterfly.prognos.domain.model.PredictionResult.LayerHealth;
import com.z254.butterfly.prognos.domain.model.PredictionResult.PredictionMetadata;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Predictions;
import com.z254.butterfly.prognos.domain.model.PredictionResult.SystemHealthPrediction;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionOutcome;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.domain.model.TrainingJob;
import com.z254.butterfly.prognos.domain.model.TrainingOptions;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.event.EventBus;
import com.z254.butterfly.prognos.event.EventTopics;
import com.z254.butterfly.prognos.exception.ModelUnavailableException;
import com.z254.butterfly.prognos.exception.PredictionValidationException;
import com.z254.butterfly.prognos.feature.FeatureEngineeringPipeline;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.PredictionEventType;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.StrategyEventType;
import com.z254.butterfly.prognos.prediction.ensemble.CombinedForecast;
import com.z254.butterfly.prognos.prediction.ensemble.EnsembleOutput;
import com.z254.butterfly.prognos.prediction.ensemble.EnsemblePredictionEngine;
import com.z254.butterfly.prognos.anomaly.AnomalyFusionEngine;
import com.z254.butterfly.prognos.strategy.PreventionStrategyCatalog;
import com.z254.butterfly.prognos.strategy.PreventionStrategySelector;
import com.z254.butterfly.prognos.strategy.execution.StrategyExecutor;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import com.z254.butterfly.prognos.training.PredictionAccuracyTracker;
import com.z254.butterfly.prognos.training.TrainingJobManager;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the engine.
 * <p>
 * A prediction cycle validates the window, consults the cache, snapshots the buffer,
 * engineers features, runs the ensemble alongside anomaly fusion, selects prevention
 * strategies and publishes the assembled result. Only successful results are cached.
 */
@Slf4j
@Service
public class ErrorPredictionService {

    static final double DEGRADED_PROBABILITY = 0.05;
    static final double CRITICAL_PROBABILITY = 0.15;
    static final double EMERGENCY_PROBABILITY = 0.5;

    private final TelemetryBuffer buffer;
    private final FeatureEngineeringPipeline pipeline;
    private final EnsemblePredictionEngine ensembleEngine;
    private final AnomalyFusionEngine fusionEngine;
    private final PreventionStrategySelector strategySelector;
    private final PreventionStrategyCatalog strategyCatalog;
    private final StrategyExecutor strategyExecutor;
    private final PredictionCache cache;
    private final ModelRegistry modelRegistry;
    private final TrainingJobManager trainingJobManager;
    private final PredictionAccuracyTracker accuracyTracker;
    private final EventBus eventBus;
    private final PrognosMetrics metrics;
    private final PrognosStructuredLogger structuredLogger;
    private final Clock clock;
    private final double errorRateThreshold;

    public ErrorPredictionService(TelemetryBuffer buffer,
                                  FeatureEngineeringPipeline pipeline,
                                  EnsemblePredictionEngine ensembleEngine,
                                  AnomalyFusionEngine fusionEngine,
                                  PreventionStrategySelector strategySelector,
                                  PreventionStrategyCatalog strategyCatalog,
                                  StrategyExecutor strategyExecutor,
                                  PredictionCache cache,
                                  ModelRegistry modelRegistry,
                                  TrainingJobManager trainingJobManager,
                                  PredictionAccuracyTracker accuracyTracker,
                                  EventBus eventBus,
                                  PrognosMetrics metrics,
                                  PrognosStructuredLogger structuredLogger,
                                  Clock clock,
                                  PrognosProperties properties) {
        this.buffer = buffer;
        this.pipeline = pipeline;
        this.ensembleEngine = ensembleEngine;
        this.fusionEngine = fusionEngine;
        this.strategySelector = strategySelector;
        this.strategyCatalog = strategyCatalog;
        this.strategyExecutor = strategyExecutor;
        this.cache = cache;
        this.modelRegistry = modelRegistry;
        this.trainingJobManager = trainingJobManager;
        this.accuracyTracker = accuracyTracker;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.errorRateThreshold = properties.getPrediction().getErrorRateThreshold();
    }

    // ========== Telemetry ==========

    /**
     * Buffers one observation.
     *
     * @throws PredictionValidationException when the point has no timestamp, a non-finite
     *                                       signal or an error rate outside [0, 1]
     */
    public void addDataPoint(TelemetryDataPoint point) {
        try {
            validate(point);
        } catch (PredictionValidationException e) {
            metrics.recordDataPointRejected();
            log.warn("Rejected telemetry data point: {}", e.getMessage());
            throw e;
        }
        TelemetryDataPoint evicted = buffer.append(point);
        metrics.recordDataPointIngested(buffer.size(), evicted != null);
    }

    private static void validate(TelemetryDataPoint point) {
        if (point == null) {
            throw new PredictionValidationException("Telemetry data point is required");
        }
        if (point.getTimestamp() == null) {
            throw new PredictionValidationException("Telemetry data point has no timestamp");
        }
        for (Signal signal : Signal.values()) {
            if (!Double.isFinite(point.signal(signal))) {
                throw new PredictionValidationException(
                        "Telemetry signal " + signal.metricName() + " is not finite at " + point.getTimestamp());
            }
        }
        if (point.getErrorRate() < 0.0 || point.getErrorRate() > 1.0) {
            throw new PredictionValidationException(
                    "Error rate " + point.getErrorRate() + " outside [0, 1] at " + point.getTimestamp());
        }
    }

    // ========== Prediction ==========

    public Mono<PredictionResult> generatePredictions(PredictionWindow window) {
        return generatePredictions(window, null, null);
    }

    /**
     * Run a full prediction cycle.
     *
     * @param layer restricts features to one layer, or null for all layers
     * @param options null means {@link PredictionOptions#defaults()}
     */
    public Mono<PredictionResult> generatePredictions(PredictionWindow window, SystemLayer layer,
                                                      PredictionOptions options) {
        return Mono.defer(() -> {
            FeatureEngineeringPipeline.validateWindow(window);
            PredictionOptions effective = options != null ? options : PredictionOptions.defaults();

            String cacheKey = PredictionCache.key(window, layer, effective);
            Optional<PredictionResult> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                structuredLogger.logPredictionEvent(cached.get().getPredictionId(), PredictionEventType.CACHE_HIT,
                        "Serving cached prediction", Map.of("window", window.toString()));
                return Mono.just(cached.get());
            }

            String predictionId = "pred_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);
            Timer.Sample sample = metrics.startPredictionTimer();
            long startedNanos = System.nanoTime();
            structuredLogger.logPredictionEvent(predictionId, PredictionEventType.STARTED,
                    "Prediction cycle started", Map.of(
                            "window", window.toString(),
                            "layer", layer != null ? layer.name() : "ALL"));

            return Mono.fromCallable(() -> pipeline.engineer(buffer.snapshot(), window, layer))
                    .flatMap(features -> {
                        List<ModelConfig> models = selectModels(effective);
                        Mono<List<AnomalyDetectionResult>> anomalies = effective.isIncludeAnomalies()
                                ? fusionEngine.detect(features)
                                : Mono.just(List.of());
                        return Mono.zip(ensembleEngine.predict(features, models, effective.getEnsembleMethod()),
                                        anomalies)
                                .map(tuple -> assembleAndPublish(predictionId, cacheKey, features, tuple.getT1(),
                                        tuple.getT2(), effective, sample, startedNanos));
                    })
                    .doOnError(error -> {
                        metrics.recordPredictionFailed(sample);
                        structuredLogger.logPredictionEvent(predictionId, PredictionEventType.FAILED,
                                "Prediction cycle failed", Map.of(
                                        "error", String.valueOf(error.getMessage()),
                                        "type", error.getClass().getSimpleName()));
                    });
        });
    }

    private PredictionResult assembleAndPublish(String predictionId, String cacheKey, FeatureSet features,
                                                EnsembleOutput ensemble, List<AnomalyDetectionResult> anomalies,
                                                PredictionOptions options, Timer.Sample sample, long startedNanos) {
        long elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000;
        PredictionResult result = assemble(predictionId, features, ensemble, anomalies, options, elapsedMs);
        cache.put(cacheKey, result);
        accuracyTracker.record(result, ensemble.getModelErrorRates());
        metrics.recordPredictionCompleted(sample, result.getPredictions().getErrorCount().getConfidenceScore());
        eventBus.publish(EventTopics.PREDICTION_GENERATED, result);
        structuredLogger.logPredictionEvent(predictionId, PredictionEventType.GENERATED,
                "Prediction generated", Map.of(
                        "errorRate", result.getPredictions().getErrorRate().getValue(),
                        "businessImpact", result.getPredictions().getBusinessImpact().getLevel().name(),
                        "models", ensemble.getModelsUsed().size(),
                        "anomalies", result.getAnomalies().size(),
                        "strategies", result.getPreventionStrategies().size(),
                        "executionTimeMs", elapsedMs));
        return result;
    }

    private List<ModelConfig> selectModels(PredictionOptions options) {
        List<ModelConfig> active = modelRegistry.listActive();
        if (options.getModelIds().isEmpty()) {
            return active;
        }
        List<ModelConfig> selected = active.stream()
                .filter(config -> options.getModelIds().contains(config.getModelId()))
                .toList();
        if (selected.isEmpty()) {
            throw new ModelUnavailableException("None of the requested models is active: " + options.getModelIds());
        }
        return selected;
    }

    private PredictionResult assemble(String predictionId, FeatureSet features, EnsembleOutput ensemble,
                                      List<AnomalyDetectionResult> anomalies, PredictionOptions options,
                                      long elapsedMs) {
        CombinedForecast forecast = ensemble.getForecast();
        PredictionConfidence confidence = PredictionConfidence.fromScore(forecast.getConfidence());

        Predictions predictions = Predictions.builder()
                .errorCount(ErrorCountPrediction.builder()
                        .value(forecast.getErrorCount())
                        .confidenceScore(forecast.getConfidence())
                        .confidence(confidence)
                        .trend(ensemble.getTrend())
                        .build())
                .errorRate(ErrorRatePrediction.builder()
                        .value(forecast.getErrorRate())
                        .confidenceScore(forecast.getConfidence())
                        .confidence(confidence)
                        .threshold(errorRateThreshold)
                        .build())
                .businessImpact(BusinessImpactPrediction.builder()
                        .level(forecast.getBusinessImpact())
                        .confidenceScore(forecast.getImpactConfidence())
                        .confidence(PredictionConfidence.fromScore(forecast.getImpactConfidence()))
                        .revenueAtRisk(forecast.getRevenueAtRisk())
                        .customersAffected(forecast.getCustomersAffected())
                        .build())
                .systemHealth(systemHealth(forecast, features))
                .build();

        List<PreventionStrategy> strategies = List.of();
        if (options.isIncludePreventionStrategies()) {
            strategies = strategySelector.select(predictionId, predictions, features, anomalies);
            metrics.recordStrategiesSelected(strategies.size());
            for (PreventionStrategy strategy : strategies) {
                structuredLogger.logStrategyEvent(strategy.getStrategyId(), StrategyEventType.SELECTED,
                        "Prevention strategy selected", Map.of(
                                "predictionId", predictionId,
                                "roi", strategy.getBusinessJustification().getRoi(),
                                "priority", strategy.getPriority().name()));
            }
        }

        return PredictionResult.builder()
                .predictionId(predictionId)
                .generatedAt(clock.instant())
                .window(features.getWindow())
                .systemLayer(features.getSystemLayer())
                .predictions(predictions)
                .anomalies(anomalies)
                .preventionStrategies(strategies)
                .modelContributions(ensemble.getContributions())
                .metadata(PredictionMetadata.builder()
                        .modelsUsed(ensemble.getModelsUsed())
                        .executionTimeMs(elapsedMs)
                        .featureImportance(features.getFeatureImportance())
                        .dataQuality(features.getDataQuality())
                        .ensembleMethod(ensemble.getMethod())
                        .warnings(ensemble.getWarnings())
                        .sampleCount(features.sampleCount())
                        .build())
                .build();
    }

    /**
     * Per-layer error probability is the predicted error rate weighted by the layer's
     * share of observed errors.
     */
    SystemHealthPrediction systemHealth(CombinedForecast forecast, FeatureSet features) {
        Map<SystemLayer, Double> shares = features.getLayerErrorShares();
        if (shares.isEmpty()) {
            shares = Map.of(features.getSystemLayer() != null ? features.getSystemLayer() : SystemLayer.API, 1.0);
        }
        PredictionConfidence confidence = PredictionConfidence.fromScore(forecast.getConfidence());
        Map<SystemLayer, LayerHealth> layers = new EnumMap<>(SystemLayer.class);
        HealthState worst = HealthState.HEALTHY;
        boolean emergency = false;
        for (Map.Entry<SystemLayer, Double> entry : shares.entrySet()) {
            double probability = Math.min(1.0, forecast.getErrorRate() * entry.getValue());
            HealthState state = layerState(probability);
            layers.put(entry.getKey(), LayerHealth.builder()
                    .health(state)
                    .errorProbability(probability)
                    .confidenceScore(forecast.getConfidence())
                    .confidence(confidence)
                    .build());
            emergency |= probability >= EMERGENCY_PROBABILITY;
            if (state.ordinal() > worst.ordinal()) {
                worst = state;
            }
        }
        return SystemHealthPrediction.builder()
                .overall(emergency ? HealthState.EMERGENCY : worst)
                .confidenceScore(forecast.getConfidence())
                .confidence(confidence)
                .layers(layers)
                .build();
    }

    static HealthState layerState(double probability) {
        if (probability >= CRITICAL_PROBABILITY) {
            return HealthState.CRITICAL;
        }
        if (probability >= DEGRADED_PROBABILITY) {
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    // ========== Anomaly scans ==========

    /**
     * Run anomaly fusion over an explicit slice of telemetry, outside a prediction cycle.
     */
    public Mono<List<AnomalyDetectionResult>> detectAnomalies(List<TelemetryDataPoint> slice) {
        return Mono.defer(() -> {
            if (slice.isEmpty()) {
                return Mono.just(List.<AnomalyDetectionResult>of());
            }
            PredictionWindow window = PredictionWindow.of(slice.get(0).getTimestamp(),
                    slice.get(slice.size() - 1).getTimestamp().plusSeconds(1));
            return fusionEngine.detect(pipeline.engineer(slice, window, null));
        });
    }

    // ========== Training ==========

    public String trainModel(String modelId, List<TelemetryDataPoint> data, TrainingOptions options) {
        return trainingJobManager.submit(modelId, data, options);
    }

    public Optional<TrainingJob> getTrainingStatus(String jobId) {
        return trainingJobManager.getJob(jobId);
    }

    public AccuracyReport getPredictionAccuracy() {
        return accuracyTracker.report();
    }

    // ========== Prevention strategies ==========

    /**
     * Execute a template or a recently selected strategy.
     * <p>
     * An unknown id fails with {@link PredictionValidationException}; executor failures
     * complete with a not-executed outcome instead of an error.
     */
    public Mono<StrategyExecutionOutcome> executePreventionStrategy(String strategyId,
                                                                    StrategyExecutionContext context) {
        return Mono.defer(() -> {
            PreventionStrategy strategy = strategyCatalog.resolve(strategyId).orElseThrow(() -> {
                structuredLogger.logStrategyEvent(strategyId, StrategyEventType.REJECTED,
                        "Unknown prevention strategy", null);
                return new PredictionValidationException("Unknown prevention strategy: " + strategyId);
            });
            StrategyExecutionContext effective = context != null
                    ? context : StrategyExecutionContext.builder().triggeredBy("api").build();

            return strategyExecutor.execute(strategy, effective)
                    .onErrorResume(error -> {
                        log.error("Strategy executor failed for {}: {}", strategyId, error.getMessage());
                        return Mono.just(StrategyExecutionOutcome.notExecuted(strategyId,
                                "Executor failure: " + error.getMessage(), clock.instant()));
                    })
                    .doOnNext(outcome -> {
                        metrics.recordStrategyExecuted(outcome.isExecuted() && outcome.isSuccess());
                        eventBus.publish(EventTopics.PREVENTION_STRATEGY_EXECUTED, outcome);
                        structuredLogger.logStrategyEvent(strategyId,
                                outcome.isExecuted() ? StrategyEventType.EXECUTED : StrategyEventType.EXECUTION_FAILED,
                                outcome.isExecuted() ? "Prevention strategy executed" : "Prevention strategy not executed",
                                Map.of(
                                        "triggeredBy", String.valueOf(effective.getTriggeredBy()),
                                        "success", outcome.isSuccess(),
                                        "costSavings", outcome.getCostSavings(),
                                        "message", String.valueOf(outcome.getMessage())));
                    });
        });
    }

    public boolean isCriticalImpact(PredictionResult result) {
        return result.getPredictions().getBusinessImpact().getLevel().isAtLeast(BusinessImpact.CRITICAL);
    }
}
