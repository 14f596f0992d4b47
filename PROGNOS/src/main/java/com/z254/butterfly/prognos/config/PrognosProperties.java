package com.z254.butterfly.prognos.config;

import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.ModelKind;
import com.z254.butterfly.prognos.domain.model.PerformanceMetrics;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the PROGNOS engine.
 * <p>
 * Provides static configuration for:
 * <ul>
 *     <li>Telemetry buffer and feature engineering</li>
 *     <li>Ensemble inference, anomaly fusion and strategy selection thresholds</li>
 *     <li>Periodic loops, training and the prediction cache</li>
 *     <li>Model registry seeds and prevention strategy templates</li>
 * </ul>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "prognos")
public class PrognosProperties {

    private final Buffer buffer = new Buffer();
    private final Features features = new Features();
    private final Prediction prediction = new Prediction();
    private final Anomaly anomaly = new Anomaly();
    private final Strategy strategy = new Strategy();
    private final Training training = new Training();
    private final Cache cache = new Cache();
    private final Loops loops = new Loops();
    private final Execution execution = new Execution();
    private final Kafka kafka = new Kafka();

    /** Model registry seed data */
    private List<ModelSeed> models = new ArrayList<>();

    @Data
    public static class Buffer {
        /** Maximum buffered data points; oldest are evicted first */
        @Positive
        private int capacity = 10_000;
    }

    @Data
    public static class Features {
        /** Minimum samples required after layer filtering */
        @Min(2)
        private int minSamples = 2;

        /** Rolling window sizes, in samples */
        private List<Integer> windows = new ArrayList<>(List.of(5, 15, 60));

        /** Lag offsets, in samples */
        private List<Integer> lags = new ArrayList<>(List.of(1, 5));

        /** Samples used for correlation features */
        private int correlationWindow = 30;

        private int businessHoursStart = 9;
        private int businessHoursEnd = 17;
        private int peakHoursStart = 10;
        private int peakHoursEnd = 14;
    }

    /**
     * Ensemble inference configuration.
     */
    @Data
    public static class Prediction {
        /** Soft deadline for each model call */
        private Duration inferenceDeadline = Duration.ofMillis(200);

        private EnsembleMethod defaultEnsembleMethod = EnsembleMethod.STACKING;

        /** Horizon predicted by the prediction loop */
        private Duration loopHorizon = Duration.ofHours(1);

        /** Error-rate alerting threshold reported with each forecast */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double errorRateThreshold = 0.05;

        /** Revenue at risk per predicted error, scaled by impact weight */
        private double revenuePerError = 50.0;

        /** Age after which a model's recency weight bottoms out */
        private Duration recencyHorizon = Duration.ofDays(7);

        /** Relative band within which the error-count trend is stable */
        private double trendTolerance = 0.05;

        private double weekendFactor = 0.8;
        private double peakFactor = 1.2;
    }

    /**
     * Anomaly detection and fusion configuration.
     */
    @Data
    public static class Anomaly {
        /** Results must score strictly above this value */
        private double fusionCutoff = 0.6;

        private int topN = 10;

        /** Trailing samples evaluated per scan; earlier samples form the baseline */
        private int evaluationSize = 10;

        private Duration detectorDeadline = Duration.ofMillis(200);

        private final ZScore zscore = new ZScore();
        private final IsolationForest isolationForest = new IsolationForest();
        private final OneClass oneClass = new OneClass();
        private final Reconstruction reconstruction = new Reconstruction();

        @Data
        public static class ZScore {
            private double threshold = 3.0;
            private int windowSize = 100;
        }

        @Data
        public static class IsolationForest {
            private boolean enabled = true;
            private int trees = 100;
            private int sampleSize = 64;
            private long seed = 42L;
        }

        @Data
        public static class OneClass {
            private boolean enabled = true;
            /** Baseline distance percentile defining the boundary radius */
            private double boundaryPercentile = 0.95;
        }

        @Data
        public static class Reconstruction {
            private boolean enabled = true;
            /** Moving-average window used to reconstruct each signal */
            private int window = 5;
            /** Normalised reconstruction error at which the score reaches 1 - 1/e */
            private double threshold = 4.0;
        }
    }

    /**
     * Prevention strategy selection.
     */
    @Data
    public static class Strategy {
        /** Predicted error rate must exceed the recent baseline by this fraction */
        private double relativeThreshold = 0.25;

        /** Absolute error-rate floor for circuit-breaker proposals */
        private double absoluteFloor = 0.01;

        private int topN = 5;

        /** How long selected strategies stay resolvable for execution */
        private Duration issuedRetention = Duration.ofHours(1);

        private List<PreventionStrategy.Template> templates = new ArrayList<>();
    }

    @Data
    public static class Training {
        /** Rolling accuracy below this value triggers retraining */
        private double degradationThreshold = 0.7;

        private int accuracyWindow = 10;

        private int minObservations = 3;

        /** Minimum samples a training run needs */
        private int minTrainingSamples = 10;

        /** Pending prediction evaluations older than this are discarded */
        private Duration evaluationRetention = Duration.ofHours(24);
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofSeconds(300);
        private long maximumSize = 1_000;
    }

    /**
     * Periodic loop configuration. A loop timeout defaults to its interval.
     */
    @Data
    public static class Loops {
        private boolean enabled = true;
        private final Loop prediction = new Loop(Duration.ofMinutes(5));
        private final Loop anomaly = new Loop(Duration.ofMinutes(1));
        private final Loop retraining = new Loop(Duration.ofHours(1));

        /** Anomaly scans are skipped below this many buffered samples */
        private int anomalyMinSamples = 50;

        /** Number of most recent samples an anomaly scan inspects */
        private int anomalyScanSize = 100;

        @Data
        public static class Loop {
            private Duration interval;
            private Duration timeout;

            public Loop() {
            }

            public Loop(Duration interval) {
                this.interval = interval;
            }

            public Duration effectiveTimeout() {
                return timeout != null ? timeout : interval;
            }
        }
    }

    @Data
    public static class Execution {
        private ExecutionMode mode = ExecutionMode.DRY_RUN;
        private final Orchestrator orchestrator = new Orchestrator();

        @Data
        public static class Orchestrator {
            @NotBlank
            private String baseUrl = "http://localhost:8090";
            private String executePath = "/api/v1/strategies/execute";
            private Duration timeout = Duration.ofSeconds(10);
        }
    }

    public enum ExecutionMode {
        DRY_RUN,
        REMOTE
    }

    /**
     * Optional Kafka relay of engine events.
     */
    @Data
    public static class Kafka {
        private boolean enabled = false;

        /** Engine topic to Kafka topic mapping */
        private Map<String, String> topics = new LinkedHashMap<>(Map.of(
                "predictionGenerated", "prognos.predictions.generated",
                "anomaliesDetected", "prognos.anomalies.detected",
                "criticalPredictionAlert", "prognos.alerts.critical",
                "criticalAnomaly", "prognos.anomalies.critical",
                "preventionStrategyExecuted", "prognos.strategies.executed"));
    }

    /**
     * Seed definition of a registered model.
     */
    @Data
    public static class ModelSeed {
        @NotBlank
        private String id;
        private String name;
        private String description;
        private ModelKind kind = ModelKind.TIME_SERIES;
        private String targetVariable = "errorRate";
        private List<String> features = new ArrayList<>();
        private Map<String, Double> hyperparameters = new HashMap<>();
        private Duration trainingWindow = Duration.ofHours(168);
        private Duration retrainInterval = Duration.ofHours(24);
        private double validationSplit = 0.2;
        private double accuracy;
        private double precision;
        private double recall;
        private double f1Score;
        private boolean active = true;

        /**
         * Build the initial registry entry, treating start-up as the last training time.
         */
        public ModelConfig toModelConfig(Instant now) {
            return ModelConfig.builder()
                    .modelId(id)
                    .name(name != null ? name : id)
                    .description(description)
                    .kind(kind)
                    .targetVariable(targetVariable)
                    .features(features)
                    .hyperparameters(hyperparameters)
                    .trainingWindow(trainingWindow)
                    .retrainInterval(retrainInterval)
                    .validationSplit(validationSplit)
                    .lastTrained(now)
                    .nextRetraining(now.plus(retrainInterval))
                    .performance(PerformanceMetrics.builder()
                            .accuracy(accuracy)
                            .precision(precision)
                            .recall(recall)
                            .f1Score(f1Score)
                            .build())
                    .active(active)
                    .build();
        }
    }
}
