package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Trend;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.exception.ModelUnavailableException;
import com.z254.butterfly.prognos.feature.FeatureEngineeringPipeline;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.prediction.ConfidenceCalibrator;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;
import com.z254.butterfly.prognos.prediction.PredictionModelFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.z254.butterfly.prognos.EngineFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnsemblePredictionEngineTest {

    private PrognosProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private FeatureEngineeringPipeline pipeline;
    private PredictionWindow nextHour;

    @BeforeEach
    void setUp() {
        properties = EngineFixtures.properties();
        meterRegistry = new SimpleMeterRegistry();
        pipeline = new FeatureEngineeringPipeline(properties);
        nextHour = PredictionWindow.starting(NOW, Duration.ofHours(1));
    }

    private EnsemblePredictionEngine engine(PredictionModelFactory factory) {
        WeightedAverageCombiner weightedAverage = new WeightedAverageCombiner();
        return new EnsemblePredictionEngine(factory, new ConfidenceCalibrator(),
                new BusinessLogicCorrector(properties),
                List.of(weightedAverage, new VotingCombiner(),
                        new StackingCombiner(weightedAverage, new LinearMetaAdjuster())),
                new PrognosMetrics(meterRegistry), EngineFixtures.immediateSchedulers(),
                EngineFixtures.fixedClock(), properties);
    }

    private static PredictionModel fixed(String id, double count, double rate) {
        return new PredictionModel() {
            @Override
            public String modelId() {
                return id;
            }

            @Override
            public ModelOutput predict(FeatureSet features) {
                return ModelOutput.builder()
                        .modelId(id)
                        .errorCount(count)
                        .errorRate(rate)
                        .businessImpact(BusinessImpact.LOW)
                        .confidence(0.8)
                        .build();
            }
        };
    }

    private static PredictionModel failing(String id) {
        return new PredictionModel() {
            @Override
            public String modelId() {
                return id;
            }

            @Override
            public ModelOutput predict(FeatureSet features) {
                throw new IllegalStateException("model crashed");
            }
        };
    }

    @Nested
    @DisplayName("Model failures")
    class ModelFailureTests {

        @Test
        @DisplayName("should exclude a failing model and record a warning")
        void excludesFailingModel() {
            ModelConfig good = EngineFixtures.model("good", ModelKind.REGRESSION, 0.9);
            ModelConfig bad = EngineFixtures.model("bad", ModelKind.REGRESSION, 0.9);
            PredictionModelFactory factory = mock(PredictionModelFactory.class);
            when(factory.create(any())).thenAnswer(inv -> {
                ModelConfig config = inv.getArgument(0);
                return config.getModelId().equals("bad") ? failing("bad") : fixed("good", 12.0, 0.03);
            });
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), nextHour, null);

            StepVerifier.create(engine(factory).predict(features, List.of(good, bad), EnsembleMethod.WEIGHTED_AVERAGE))
                    .assertNext(output -> {
                        assertThat(output.getModelsUsed()).containsExactly("good");
                        assertThat(output.getWarnings()).singleElement().asString().contains("bad");
                        assertThat(output.getForecast().getErrorCount()).isCloseTo(12.0, within(1e-9));
                        assertThat(output.getContributions()).containsOnlyKeys("good");
                    })
                    .verifyComplete();

            assertThat(meterRegistry.get("prognos.models.failures").tag("model", "bad").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail with ModelUnavailableException when every model fails")
        void allModelsFail() {
            PredictionModelFactory factory = mock(PredictionModelFactory.class);
            when(factory.create(any())).thenReturn(failing("x"));
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), nextHour, null);

            StepVerifier.create(engine(factory).predict(features,
                            List.of(EngineFixtures.model("x", ModelKind.REGRESSION, 0.9)), EnsembleMethod.STACKING))
                    .expectError(ModelUnavailableException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail with ModelUnavailableException when no model is active")
        void noModels() {
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), nextHour, null);

            StepVerifier.create(engine(mock(PredictionModelFactory.class))
                            .predict(features, List.of(), EnsembleMethod.STACKING))
                    .expectError(ModelUnavailableException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Weighting")
    class WeightingTests {

        @Test
        @DisplayName("recency should decay from 1 to the floor over the horizon")
        void recencyDecay() {
            EnsemblePredictionEngine engine = engine(mock(PredictionModelFactory.class));
            ModelConfig fresh = EngineFixtures.model("a", ModelKind.REGRESSION, 0.9).toBuilder()
                    .lastTrained(NOW).build();
            ModelConfig stale = fresh.toBuilder().lastTrained(NOW.minus(Duration.ofDays(30))).build();
            ModelConfig untrained = fresh.toBuilder().lastTrained(null).build();

            assertThat(engine.recency(fresh, NOW)).isEqualTo(1.0);
            assertThat(engine.recency(stale, NOW)).isEqualTo(0.1);
            assertThat(engine.recency(untrained, NOW)).isEqualTo(0.1);
        }

        @Test
        @DisplayName("should order contributions by weight, most accurate first")
        void contributionOrder() {
            ModelConfig strong = EngineFixtures.model("strong", ModelKind.REGRESSION, 0.95);
            ModelConfig weak = EngineFixtures.model("weak", ModelKind.REGRESSION, 0.40);
            PredictionModelFactory factory = mock(PredictionModelFactory.class);
            when(factory.create(any())).thenAnswer(inv -> {
                ModelConfig config = inv.getArgument(0);
                return fixed(config.getModelId(), 10.0, 0.02);
            });
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), nextHour, null);

            StepVerifier.create(engine(factory).predict(features, List.of(weak, strong), EnsembleMethod.VOTING))
                    .assertNext(output -> {
                        assertThat(output.getModelsUsed()).containsExactly("strong", "weak");
                        assertThat(output.getContributions().get("strong"))
                                .isGreaterThan(output.getContributions().get("weak"));
                        assertThat(output.getContributions().values().stream().mapToDouble(Double::doubleValue).sum())
                                .isCloseTo(1.0, within(1e-9));
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Trend")
    class TrendTests {

        @Test
        @DisplayName("90 days of rising daily errors should forecast an increasing trend")
        void risingDailySeries() {
            List<TelemetryDataPoint> daily = EngineFixtures.series(90, Duration.ofDays(1),
                    i -> 100.0 + 2.0 * i, i -> 0.01 + 0.0002 * i);
            ModelConfig timeSeries = EngineFixtures.model("error_count_prophet", ModelKind.TIME_SERIES, 0.87);
            PredictionModelFactory factory = new PredictionModelFactory(new ImpactEstimator(properties));
            FeatureSet features = pipeline.engineer(daily, nextHour, null);

            StepVerifier.create(engine(factory).predict(features, List.of(timeSeries), EnsembleMethod.WEIGHTED_AVERAGE))
                    .assertNext(output -> {
                        assertThat(output.getTrend()).isEqualTo(Trend.INCREASING);
                        assertThat(output.getUncorrectedErrorCount()).isGreaterThan(daily.get(89).getErrorCount());
                        assertThat(output.getModelsUsed()).containsExactly("error_count_prophet");
                    })
                    .verifyComplete();
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(EnsembleMethod.class)
        @DisplayName("a week-ahead forecast over 90 weekend-dampened days should follow the injected slope")
        void weekAheadFollowsSlope(EnsembleMethod method) {
            PredictionModelFactory factory = new PredictionModelFactory(new ImpactEstimator(properties));
            List<ModelConfig> models = List.of(
                    EngineFixtures.model("error_count_prophet", ModelKind.TIME_SERIES, 0.87),
                    EngineFixtures.model("error_rate_holt", ModelKind.REGRESSION, 0.84));
            PredictionWindow nextWeek = PredictionWindow.starting(NOW, Duration.ofDays(7));
            EnsemblePredictionEngine engine = engine(factory);

            assertThat(weekAheadTrend(engine, models, nextWeek, method, 2.0)).isEqualTo(Trend.INCREASING);
            assertThat(weekAheadTrend(engine, models, nextWeek, method, -0.8)).isEqualTo(Trend.DECREASING);
            assertThat(weekAheadTrend(engine, models, nextWeek, method, 0.0)).isEqualTo(Trend.STABLE);
        }

        private Trend weekAheadTrend(EnsemblePredictionEngine engine, List<ModelConfig> models,
                                     PredictionWindow window, EnsembleMethod method, double slope) {
            List<TelemetryDataPoint> daily = EngineFixtures.series(90, Duration.ofDays(1),
                    i -> 100.0 + slope * i, i -> 0.02);
            List<TelemetryDataPoint> dampened = daily.stream()
                    .map(p -> FeatureEngineeringPipeline.isWeekend(p.getTimestamp())
                            ? p.toBuilder().errorCount(p.getErrorCount() * 0.8).build()
                            : p)
                    .toList();
            FeatureSet features = pipeline.engineer(dampened, window, null);
            EnsembleOutput output = engine.predict(features, models, method).block();
            assertThat(output).isNotNull();
            return output.getTrend();
        }

        @Test
        @DisplayName("a forecast near the deseasonalised mean should be stable")
        void stableWithinTolerance() {
            EnsemblePredictionEngine engine = engine(mock(PredictionModelFactory.class));
            FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), nextHour, null);
            double baseline = features.get("error_count_deseasonalized_mean");

            assertThat(engine.trend(baseline * 1.02, features)).isEqualTo(Trend.STABLE);
            assertThat(engine.trend(baseline * 1.2, features)).isEqualTo(Trend.INCREASING);
            assertThat(engine.trend(baseline * 0.8, features)).isEqualTo(Trend.DECREASING);
        }
    }

    @Test
    @DisplayName("weekend windows should be dampened after combination")
    void weekendCorrection() {
        PredictionModelFactory factory = mock(PredictionModelFactory.class);
        when(factory.create(any())).thenReturn(fixed("m", 100.0, 0.1));
        PredictionWindow saturdayMorning = PredictionWindow.starting(Instant.parse("2024-03-09T06:00:00Z"),
                Duration.ofHours(1));
        FeatureSet features = pipeline.engineer(EngineFixtures.steadySeries(30), saturdayMorning, null);

        StepVerifier.create(engine(factory).predict(features,
                        List.of(EngineFixtures.model("m", ModelKind.REGRESSION, 0.9)), EnsembleMethod.WEIGHTED_AVERAGE))
                .assertNext(output -> {
                    assertThat(output.getUncorrectedErrorCount()).isCloseTo(100.0, within(1e-9));
                    assertThat(output.getForecast().getErrorCount()).isCloseTo(80.0, within(1e-9));
                    assertThat(output.getForecast().getErrorRate()).isCloseTo(0.08, within(1e-12));
                })
                .verifyComplete();
    }
}
