package com.z254.butterfly.prognos.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.anomaly.AnomalyFusionEngine;
import com.z254.butterfly.prognos.anomaly.detector.ZScoreAnomalyDetector;
import com.z254.butterfly.prognos.cache.PredictionCache;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import com.z254.butterfly.prognos.domain.model.PredictionOptions;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.model.PredictionResult.BusinessImpactPrediction;
import com.z254.butterfly.prognos.domain.model.PredictionResult.HealthState;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Predictions;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.repository.InMemoryModelRegistry;
import com.z254.butterfly.prognos.domain.repository.InMemoryTrainingJobRepository;
import com.z254.butterfly.prognos.domain.repository.ModelRegistry;
import com.z254.butterfly.prognos.event.EngineEvent;
import com.z254.butterfly.prognos.event.EventTopics;
import com.z254.butterfly.prognos.event.ReactorEventBus;
import com.z254.butterfly.prognos.exception.ModelUnavailableException;
import com.z254.butterfly.prognos.exception.PredictionValidationException;
import com.z254.butterfly.prognos.feature.FeatureEngineeringPipeline;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.PredictionEventType;
import com.z254.butterfly.prognos.observability.PrognosStructuredLogger.StrategyEventType;
import com.z254.butterfly.prognos.prediction.ConfidenceCalibrator;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.PredictionModelFactory;
import com.z254.butterfly.prognos.prediction.ensemble.BusinessLogicCorrector;
import com.z254.butterfly.prognos.prediction.ensemble.CombinedForecast;
import com.z254.butterfly.prognos.prediction.ensemble.EnsemblePredictionEngine;
import com.z254.butterfly.prognos.prediction.ensemble.LinearMetaAdjuster;
import com.z254.butterfly.prognos.prediction.ensemble.StackingCombiner;
import com.z254.butterfly.prognos.prediction.ensemble.VotingCombiner;
import com.z254.butterfly.prognos.prediction.ensemble.WeightedAverageCombiner;
import com.z254.butterfly.prognos.strategy.PreventionStrategyCatalog;
import com.z254.butterfly.prognos.strategy.PreventionStrategySelector;
import com.z254.butterfly.prognos.strategy.execution.DryRunStrategyExecutor;
import com.z254.butterfly.prognos.strategy.execution.StrategyExecutor;
import com.z254.butterfly.prognos.telemetry.TelemetryBuffer;
import com.z254.butterfly.prognos.training.DegradationMonitor;
import com.z254.butterfly.prognos.training.ModelTrainer;
import com.z254.butterfly.prognos.training.PredictionAccuracyTracker;
import com.z254.butterfly.prognos.training.TrainingJobManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.z254.butterfly.prognos.EngineFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ErrorPredictionServiceTest {

    private static final PredictionWindow NEXT_HOUR = PredictionWindow.starting(NOW, Duration.ofHours(1));

    private PrognosProperties properties;
    private TelemetryBuffer buffer;
    private ModelRegistry registry;
    private PrognosMetrics metrics;
    private ReactorEventBus eventBus;
    private PredictionAccuracyTracker tracker;
    private FeatureEngineeringPipeline pipeline;
    private EnsemblePredictionEngine ensembleEngine;
    private PredictionCache cache;
    private StrategyExecutor executor;
    private PrognosStructuredLogger structuredLogger;

    @BeforeEach
    void setUp() {
        properties = EngineFixtures.properties();
        buffer = new TelemetryBuffer(1_000);
        registry = new InMemoryModelRegistry();
        metrics = new PrognosMetrics(new SimpleMeterRegistry());
        eventBus = new ReactorEventBus(EngineFixtures.fixedClock());
        tracker = new PredictionAccuracyTracker(new DegradationMonitor(properties), properties);
        pipeline = new FeatureEngineeringPipeline(properties);
        WeightedAverageCombiner weightedAverage = new WeightedAverageCombiner();
        ensembleEngine = spy(new EnsemblePredictionEngine(
                new PredictionModelFactory(new ImpactEstimator(properties)), new ConfidenceCalibrator(),
                new BusinessLogicCorrector(properties),
                List.of(weightedAverage, new VotingCombiner(),
                        new StackingCombiner(weightedAverage, new LinearMetaAdjuster())),
                metrics, EngineFixtures.immediateSchedulers(), EngineFixtures.fixedClock(), properties));
        cache = new PredictionCache(Caffeine.newBuilder().<String, PredictionResult>build(), metrics);
        executor = new DryRunStrategyExecutor(EngineFixtures.fixedClock());
        structuredLogger = spy(new PrognosStructuredLogger());

        registry.upsert(EngineFixtures.model("error_count_prophet", ModelKind.TIME_SERIES, 0.87));
        registry.upsert(EngineFixtures.model("error_rate_holt", ModelKind.REGRESSION, 0.84));
        registry.upsert(EngineFixtures.model("anomaly_isolation_forest", ModelKind.ANOMALY, 0.8));
        registry.upsert(EngineFixtures.model("severity_gradient_boost", ModelKind.CLASSIFICATION, 0.82));
    }

    private ErrorPredictionService service() {
        PreventionStrategyCatalog catalog = new PreventionStrategyCatalog(properties);
        AnomalyFusionEngine fusionEngine = new AnomalyFusionEngine(List.of(new ZScoreAnomalyDetector(properties)),
                metrics, structuredLogger, EngineFixtures.immediateSchedulers(), properties);
        TrainingJobManager trainingJobManager = new TrainingJobManager(registry, new InMemoryTrainingJobRepository(),
                mock(ModelTrainer.class), buffer, new DegradationMonitor(properties), metrics, structuredLogger,
                EngineFixtures.immediateSchedulers(), EngineFixtures.fixedClock());
        return new ErrorPredictionService(buffer, pipeline, ensembleEngine, fusionEngine,
                new PreventionStrategySelector(catalog, properties), catalog, executor, cache, registry,
                trainingJobManager, tracker, eventBus, metrics, structuredLogger, EngineFixtures.fixedClock(),
                properties);
    }

    private void fillBuffer(ErrorPredictionService service, int samples) {
        EngineFixtures.steadySeries(samples).forEach(service::addDataPoint);
    }

    @Nested
    @DisplayName("Prediction cycle")
    class PredictionCycleTests {

        @Test
        @DisplayName("should assemble, cache, track and publish a prediction")
        void fullCycle() {
            ErrorPredictionService service = service();
            fillBuffer(service, 60);
            List<EngineEvent> published = new ArrayList<>();
            eventBus.subscribe(EventTopics.PREDICTION_GENERATED, published::add);

            StepVerifier.create(service.generatePredictions(NEXT_HOUR))
                    .assertNext(result -> {
                        assertThat(result.getPredictionId()).startsWith("pred_");
                        assertThat(result.getWindow()).isEqualTo(NEXT_HOUR);
                        assertThat(result.getGeneratedAt()).isEqualTo(NOW);
                        assertThat(result.getMetadata().getModelsUsed()).hasSize(4);
                        assertThat(result.getMetadata().getSampleCount()).isEqualTo(60);
                        assertThat(result.getModelContributions()).hasSize(4);
                        assertThat(result.getPredictions().getErrorRate().getThreshold())
                                .isEqualTo(properties.getPrediction().getErrorRateThreshold());
                        assertThat(result.getPredictions().getSystemHealth().getLayers())
                                .containsOnlyKeys(SystemLayer.API);
                    })
                    .verifyComplete();

            assertThat(published).hasSize(1);
            assertThat(cache.size()).isEqualTo(1);
            assertThat(tracker.pendingCount()).isEqualTo(1);
            assertThat(metrics.getPredictionsGenerated().count()).isEqualTo(1.0);
            assertThat(metrics.getDataPointsIngested().count()).isEqualTo(60.0);
        }

        @Test
        @DisplayName("should log the cycle start and every selected strategy")
        void logsStartAndSelection() {
            ErrorPredictionService service = service();
            EngineFixtures.series(60, Duration.ofMinutes(1), i -> 10.0 + i, i -> 0.01 + 0.003 * i)
                    .forEach(service::addDataPoint);

            PredictionResult result = service.generatePredictions(NEXT_HOUR).block();

            assertThat(result).isNotNull();
            assertThat(result.getPreventionStrategies()).isNotEmpty();
            verify(structuredLogger).logPredictionEvent(eq(result.getPredictionId()),
                    eq(PredictionEventType.STARTED), anyString(), anyMap());
            result.getPreventionStrategies().forEach(strategy -> verify(structuredLogger)
                    .logStrategyEvent(eq(strategy.getStrategyId()), eq(StrategyEventType.SELECTED),
                            anyString(), anyMap()));
        }

        @Test
        @DisplayName("an identical request should be served from the cache without running the ensemble")
        void cacheHit() {
            ErrorPredictionService service = service();
            fillBuffer(service, 60);

            PredictionResult first = service.generatePredictions(NEXT_HOUR).block();
            PredictionResult second = service.generatePredictions(NEXT_HOUR, null, PredictionOptions.defaults()).block();

            assertThat(second).isSameAs(first);
            verify(ensembleEngine).predict(any(), any(), any());
            assertThat(metrics.getCacheHits().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a cached result should be served even when the buffer has since emptied")
        void cachedResultSkipsPipeline() {
            PredictionResult cached = PredictionResult.builder().predictionId("pred_cached").build();
            cache.put(PredictionCache.key(NEXT_HOUR, null, PredictionOptions.defaults()), cached);

            StepVerifier.create(service().generatePredictions(NEXT_HOUR))
                    .expectNext(cached)
                    .verifyComplete();
            verify(ensembleEngine, never()).predict(any(), any(), any());
        }

        @Test
        @DisplayName("a failing cache should not stop the prediction")
        @SuppressWarnings("unchecked")
        void failingCache() {
            Cache<String, PredictionResult> broken = mock(Cache.class);
            when(broken.getIfPresent(anyString())).thenThrow(new IllegalStateException("cache offline"));
            doThrow(new IllegalStateException("cache offline"))
                    .when(broken).put(anyString(), any());
            cache = new PredictionCache(broken, metrics);
            ErrorPredictionService service = service();
            fillBuffer(service, 60);

            StepVerifier.create(service.generatePredictions(NEXT_HOUR))
                    .assertNext(result -> assertThat(result.getPredictionId()).startsWith("pred_"))
                    .verifyComplete();
            assertThat(metrics.getCacheErrors().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("options should be honoured")
        void options() {
            ErrorPredictionService service = service();
            fillBuffer(service, 60);
            PredictionOptions options = PredictionOptions.builder()
                    .includeAnomalies(false)
                    .includePreventionStrategies(false)
                    .modelId("error_rate_holt")
                    .build();

            StepVerifier.create(service.generatePredictions(NEXT_HOUR, null, options))
                    .assertNext(result -> {
                        assertThat(result.getMetadata().getModelsUsed()).containsExactly("error_rate_holt");
                        assertThat(result.getAnomalies()).isEmpty();
                        assertThat(result.getPreventionStrategies()).isEmpty();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Telemetry ingestion")
    class IngestionTests {

        @Test
        @DisplayName("malformed points should be refused without touching the buffer")
        void rejectsMalformedPoints() {
            ErrorPredictionService service = service();
            TelemetryDataPoint valid = EngineFixtures.point(NOW, 1.0, 0.01);

            assertThatThrownBy(() -> service.addDataPoint(valid.toBuilder().timestamp(null).build()))
                    .isInstanceOf(PredictionValidationException.class)
                    .hasMessageContaining("timestamp");
            assertThatThrownBy(() -> service.addDataPoint(valid.toBuilder().responseTime(Double.NaN).build()))
                    .isInstanceOf(PredictionValidationException.class)
                    .hasMessageContaining("responseTime");
            assertThatThrownBy(() -> service.addDataPoint(valid.toBuilder().errorRate(1.5).build()))
                    .isInstanceOf(PredictionValidationException.class);
            assertThatThrownBy(() -> service.addDataPoint(null))
                    .isInstanceOf(PredictionValidationException.class);

            assertThat(buffer.size()).isZero();
            assertThat(metrics.getDataPointsRejected().count()).isEqualTo(4.0);
            assertThat(metrics.getDataPointsIngested().count()).isZero();
        }

        @Test
        @DisplayName("a refused point should not break later prediction cycles")
        void laterCyclesUnaffected() {
            ErrorPredictionService service = service();
            fillBuffer(service, 30);
            assertThatThrownBy(() -> service.addDataPoint(TelemetryDataPoint.builder()
                    .errorCount(1.0)
                    .errorRate(0.01)
                    .build()))
                    .isInstanceOf(PredictionValidationException.class);
            EngineFixtures.steadySeries(30).forEach(point ->
                    service.addDataPoint(point.toBuilder().timestamp(point.getTimestamp().plusSeconds(30)).build()));

            assertThat(buffer.size()).isEqualTo(60);
            StepVerifier.create(service.generatePredictions(NEXT_HOUR))
                    .assertNext(result -> assertThat(result.getPredictions()).isNotNull())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Prediction failures")
    class FailureTests {

        @Test
        @DisplayName("no active models should fail and cache nothing")
        void noModels() {
            registry = new InMemoryModelRegistry();
            ErrorPredictionService service = service();
            fillBuffer(service, 60);

            StepVerifier.create(service.generatePredictions(NEXT_HOUR))
                    .expectError(ModelUnavailableException.class)
                    .verify();
            assertThat(cache.size()).isZero();
            assertThat(metrics.getPredictionsFailed().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("requesting only inactive models should fail")
        void unknownRequestedModels() {
            ErrorPredictionService service = service();
            fillBuffer(service, 60);

            StepVerifier.create(service.generatePredictions(NEXT_HOUR, null,
                            PredictionOptions.builder().modelId("retired").build()))
                    .expectError(ModelUnavailableException.class)
                    .verify();
            assertThat(metrics.getPredictionsFailed().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an inverted window should be rejected")
        void invertedWindow() {
            StepVerifier.create(service().generatePredictions(PredictionWindow.of(NOW, NOW.minusSeconds(60))))
                    .expectError(PredictionValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("an empty buffer should be rejected")
        void emptyBuffer() {
            StepVerifier.create(service().generatePredictions(NEXT_HOUR))
                    .expectError(PredictionValidationException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("System health")
    class SystemHealthTests {

        @Test
        @DisplayName("layer state should follow the probability thresholds")
        void layerStates() {
            assertThat(ErrorPredictionService.layerState(0.01)).isEqualTo(HealthState.HEALTHY);
            assertThat(ErrorPredictionService.layerState(0.05)).isEqualTo(HealthState.DEGRADED);
            assertThat(ErrorPredictionService.layerState(0.15)).isEqualTo(HealthState.CRITICAL);
        }

        @Test
        @DisplayName("any layer at or above the emergency probability should make the system EMERGENCY")
        void emergency() {
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), NEXT_HOUR, null);
            CombinedForecast forecast = CombinedForecast.builder().errorRate(0.6).confidence(0.8).build();

            var health = service().systemHealth(forecast, features);

            assertThat(health.getOverall()).isEqualTo(HealthState.EMERGENCY);
            assertThat(health.getLayers().get(SystemLayer.API).getHealth()).isEqualTo(HealthState.CRITICAL);
        }

        @Test
        @DisplayName("a low error rate should leave the system healthy")
        void healthy() {
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), NEXT_HOUR, null);
            CombinedForecast forecast = CombinedForecast.builder().errorRate(0.01).confidence(0.8).build();

            assertThat(service().systemHealth(forecast, features).getOverall()).isEqualTo(HealthState.HEALTHY);
        }
    }

    @Nested
    @DisplayName("Strategy execution")
    class StrategyExecutionTests {

        @Test
        @DisplayName("a template should execute through the executor and be published")
        void executesTemplate() {
            List<EngineEvent> published = new ArrayList<>();
            eventBus.subscribe(EventTopics.PREVENTION_STRATEGY_EXECUTED, published::add);

            StepVerifier.create(service().executePreventionStrategy(PreventionStrategyCatalog.CIRCUIT_BREAKER,
                            StrategyExecutionContext.builder().triggeredBy("operator").build()))
                    .assertNext(outcome -> {
                        assertThat(outcome.isExecuted()).isTrue();
                        assertThat(outcome.isSuccess()).isTrue();
                        assertThat(outcome.getCostSavings()).isEqualTo(25_000 * 0.92);
                    })
                    .verifyComplete();
            assertThat(published).hasSize(1);
            assertThat(metrics.getStrategiesExecuted().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("an unknown strategy should be rejected")
        void unknownStrategy() {
            StepVerifier.create(service().executePreventionStrategy("does_not_exist", null))
                    .expectError(PredictionValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("an executor failure should complete with a not-executed outcome")
        void executorFailure() {
            executor = (strategy, context) -> Mono.error(new IllegalStateException("orchestrator unreachable"));

            StepVerifier.create(service().executePreventionStrategy(PreventionStrategyCatalog.AUTO_SCALING, null))
                    .assertNext(outcome -> {
                        assertThat(outcome.isExecuted()).isFalse();
                        assertThat(outcome.isSuccess()).isFalse();
                        assertThat(outcome.getMessage()).contains("orchestrator unreachable");
                        assertThat(outcome.getExecutedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();
            assertThat(metrics.getStrategyExecutionsFailed().count()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("critical impact should start at CRITICAL")
    void criticalImpact() {
        ErrorPredictionService service = service();

        assertThat(service.isCriticalImpact(withImpact(BusinessImpact.HIGH))).isFalse();
        assertThat(service.isCriticalImpact(withImpact(BusinessImpact.CRITICAL))).isTrue();
        assertThat(service.isCriticalImpact(withImpact(BusinessImpact.REVENUE_BLOCKING))).isTrue();
    }

    private static PredictionResult withImpact(BusinessImpact impact) {
        return PredictionResult.builder()
                .predictions(Predictions.builder()
                        .businessImpact(BusinessImpactPrediction.builder().level(impact).build())
                        .build())
                .build();
    }
}
