package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of one prediction cycle. Immutable; cached and published as built.
 */
@Value
@Builder(toBuilder = true)
public class PredictionResult {

    String predictionId;

    Instant generatedAt;

    PredictionWindow window;

    /** Layer filter the prediction was generated for, null for all layers */
    SystemLayer systemLayer;

    Predictions predictions;

    @Singular
    List<AnomalyDetectionResult> anomalies;

    @Singular
    List<PreventionStrategy> preventionStrategies;

    /** Normalised ensemble weight per contributing model */
    @Singular
    Map<String, Double> modelContributions;

    PredictionMetadata metadata;

    /**
     * Per-target forecasts.
     */
    @Value
    @Builder(toBuilder = true)
    public static class Predictions {
        ErrorCountPrediction errorCount;
        ErrorRatePrediction errorRate;
        BusinessImpactPrediction businessImpact;
        SystemHealthPrediction systemHealth;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ErrorCountPrediction {
        double value;
        double confidenceScore;
        PredictionConfidence confidence;
        Trend trend;
    }

    @Value
    @Builder(toBuilder = true)
    public static class ErrorRatePrediction {
        double value;
        double confidenceScore;
        PredictionConfidence confidence;
        /** Alerting threshold the forecast is compared against */
        double threshold;
    }

    @Value
    @Builder(toBuilder = true)
    public static class BusinessImpactPrediction {
        BusinessImpact level;
        double confidenceScore;
        PredictionConfidence confidence;
        double revenueAtRisk;
        long customersAffected;
    }

    @Value
    @Builder(toBuilder = true)
    public static class SystemHealthPrediction {
        HealthState overall;
        double confidenceScore;
        PredictionConfidence confidence;
        @Singular
        Map<SystemLayer, LayerHealth> layers;
    }

    @Value
    @Builder
    public static class LayerHealth {
        HealthState health;
        double errorProbability;
        double confidenceScore;
        PredictionConfidence confidence;
    }

    public enum Trend {
        INCREASING,
        DECREASING,
        STABLE
    }

    public enum HealthState {
        HEALTHY,
        DEGRADED,
        CRITICAL,
        EMERGENCY
    }

    @Value
    @Builder(toBuilder = true)
    public static class PredictionMetadata {
        @Singular("modelUsed")
        List<String> modelsUsed;
        long executionTimeMs;
        @Singular("featureImportance")
        Map<String, Double> featureImportance;
        double dataQuality;
        EnsembleMethod ensembleMethod;
        @Singular
        List<String> warnings;
        /** Number of buffered samples the features were engineered from */
        int sampleCount;
    }
}
