package com.z254.butterfly.prognos.anomaly;

import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyContext;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.AnomalySeverity;
import com.z254.butterfly.prognos.domain.model.PredictionConfidence;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Builds anomaly results with consistent ids and suggested actions.
 */
public final class AnomalyResults {

    private AnomalyResults() {
    }

    /**
     * Deterministic id: the same point, metric and algorithm always yield the same id.
     */
    public static String anomalyId(AnomalyAlgorithm algorithm, TelemetryDataPoint point, String metric) {
        return "anom_" + algorithm.name().toLowerCase(Locale.ROOT) + "_" + metric + "_" + point.getTimestamp().toEpochMilli();
    }

    public static AnomalyDetectionResult of(AnomalyAlgorithm algorithm, TelemetryDataPoint point,
                                            Signal signal, double score, AnomalySeverity severity,
                                            String description) {
        return AnomalyDetectionResult.builder()
                .anomalyId(anomalyId(algorithm, point, signal.metricName()))
                .timestamp(point.getTimestamp())
                .algorithm(algorithm)
                .anomalyScore(score)
                .severity(severity)
                .description(description)
                .affectedMetric(signal.metricName())
                .businessImpact(point.getBusinessImpact())
                .confidence(PredictionConfidence.fromScore(score))
                .suggestedActions(suggestedActions(signal, severity))
                .context(AnomalyContext.builder()
                        .systemLayer(point.getSystemLayer())
                        .component(point.getMetadata().getOrDefault("component", point.getSystemLayer().name()))
                        .build())
                .build();
    }

    static List<String> suggestedActions(Signal signal, AnomalySeverity severity) {
        List<String> actions = switch (signal) {
            case ERROR_COUNT, ERROR_RATE -> List.of(
                    "Inspect recent deployments and error logs",
                    "Consider enabling a circuit breaker on failing dependencies");
            case RESPONSE_TIME -> List.of(
                    "Check downstream latency and connection pools",
                    "Review slow queries and cache hit rates");
            case SYSTEM_LOAD -> List.of(
                    "Scale out the affected tier",
                    "Check for runaway background jobs");
            case ACTIVE_USERS -> List.of(
                    "Verify traffic source and rate limits",
                    "Pre-scale capacity for the traffic change");
        };
        if (severity == AnomalySeverity.CRITICAL) {
            return concat(List.of("Page the on-call engineer"), actions);
        }
        return actions;
    }

    private static List<String> concat(List<String> first, List<String> second) {
        return Stream.concat(first.stream(), second.stream()).toList();
    }
}
