package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A single anomaly reported by a detector. Never mutated after creation.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyDetectionResult {

    String anomalyId;

    Instant timestamp;

    AnomalyAlgorithm algorithm;

    /** Anomaly score in [0, 1] */
    double anomalyScore;

    AnomalySeverity severity;

    String description;

    @Singular
    List<String> affectedMetrics;

    BusinessImpact businessImpact;

    PredictionConfidence confidence;

    @Singular
    List<String> suggestedActions;

    AnomalyContext context;

    public boolean isCritical() {
        return severity == AnomalySeverity.CRITICAL;
    }
}
