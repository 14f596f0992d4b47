package com.z254.butterfly.prognos.anomaly.detector;

import com.z254.butterfly.prognos.anomaly.AnomalyDetector;
import com.z254.butterfly.prognos.anomaly.AnomalyResults;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.AnomalySeverity;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One-class boundary: a hypersphere around the baseline centroid whose radius is a
 * percentile of baseline distances. Samples outside score by how far they overshoot it.
 */
@Component
public class OneClassBoundaryDetector implements AnomalyDetector {

    private static final int MIN_BASELINE = 5;

    private final PrognosProperties.Anomaly.OneClass config;
    private final int evaluationSize;

    public OneClassBoundaryDetector(PrognosProperties properties) {
        this.config = properties.getAnomaly().getOneClass();
        this.evaluationSize = properties.getAnomaly().getEvaluationSize();
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.ONE_CLASS_BOUNDARY;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public List<AnomalyDetectionResult> detect(FeatureSet features) {
        List<TelemetryDataPoint> samples = features.getSamples();
        int firstEvaluated = Math.max(0, samples.size() - evaluationSize);
        List<TelemetryDataPoint> baseline = samples.subList(0, firstEvaluated);
        if (baseline.size() < MIN_BASELINE) {
            return List.of();
        }
        SignalVectors vectors = SignalVectors.fit(baseline);
        double[] distances = baseline.stream()
                .mapToDouble(p -> SignalVectors.norm(vectors.standardise(p)))
                .toArray();
        double radius = RollingStatistics.percentile(distances, config.getBoundaryPercentile());
        if (radius <= 0.0) {
            return List.of();
        }

        List<AnomalyDetectionResult> results = new ArrayList<>();
        for (int i = firstEvaluated; i < samples.size(); i++) {
            double[] vector = vectors.standardise(samples.get(i));
            double ratio = SignalVectors.norm(vector) / radius;
            if (ratio <= 1.0) {
                continue;
            }
            double score = 1.0 - 1.0 / ratio;
            var signal = SignalVectors.dominant(vector);
            results.add(AnomalyResults.of(algorithm(), samples.get(i), signal, score, severity(ratio),
                    String.format("Sample lies %.1fx outside the normal operating boundary, dominated by %s",
                            ratio, signal.metricName())));
        }
        return results;
    }

    private AnomalySeverity severity(double ratio) {
        if (ratio >= 5.0) return AnomalySeverity.CRITICAL;
        if (ratio >= 3.0) return AnomalySeverity.HIGH;
        if (ratio >= 2.0) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }
}
