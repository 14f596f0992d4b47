package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Observed accuracy of past predictions against actual telemetry.
 */
@Value
@Builder
public class AccuracyReport {
    double overallAccuracy;
    @Singular("modelAccuracy")
    Map<String, Double> modelAccuracy;
    AccuracyTrend trend;
    int evaluatedPredictions;

    public enum AccuracyTrend {
        IMPROVING,
        STABLE,
        DECLINING
    }
}
