package com.z254.butterfly.prognos.anomaly.detector;

import com.z254.butterfly.prognos.anomaly.AnomalyDetector;
import com.z254.butterfly.prognos.anomaly.AnomalyResults;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.AnomalySeverity;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Statistical z-score detector, always enabled.
 * <p>
 * Each of the trailing evaluation samples is scored against the mean and deviation of
 * the samples before it (up to the configured window). A deviation of {@code z} maps to
 * score {@code 1 - exp(-z / threshold)}, so the threshold itself scores about 0.63.
 */
@Component
public class ZScoreAnomalyDetector implements AnomalyDetector {

    private static final double MAX_Z_FACTOR = 10.0;

    private final double threshold;
    private final int windowSize;
    private final int evaluationSize;

    public ZScoreAnomalyDetector(PrognosProperties properties) {
        this.threshold = properties.getAnomaly().getZscore().getThreshold();
        this.windowSize = properties.getAnomaly().getZscore().getWindowSize();
        this.evaluationSize = properties.getAnomaly().getEvaluationSize();
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.STATISTICAL_ZSCORE;
    }

    @Override
    public List<AnomalyDetectionResult> detect(FeatureSet features) {
        List<TelemetryDataPoint> samples = features.getSamples();
        int n = samples.size();
        int firstEvaluated = Math.max(2, n - evaluationSize);
        List<AnomalyDetectionResult> results = new ArrayList<>();

        for (Signal signal : Signal.values()) {
            double[] values = features.series(signal);
            for (int i = firstEvaluated; i < n; i++) {
                int from = Math.max(0, i - windowSize);
                double[] baseline = Arrays.copyOfRange(values, from, i);
                double mean = RollingStatistics.mean(baseline);
                double std = RollingStatistics.std(baseline);
                double deviation = Math.abs(values[i] - mean);
                if (deviation == 0.0) {
                    continue;
                }
                double z = std > 0.0 ? deviation / std : threshold * MAX_Z_FACTOR;
                z = Math.min(z, threshold * MAX_Z_FACTOR);
                if (z < threshold) {
                    continue;
                }
                double score = 1.0 - Math.exp(-z / threshold);
                results.add(AnomalyResults.of(algorithm(), samples.get(i), signal, score, severity(z),
                        String.format("%s deviates %.1f standard deviations from its recent mean (%.4f vs %.4f)",
                                signal.metricName(), z, values[i], mean)));
            }
        }
        return results;
    }

    private AnomalySeverity severity(double z) {
        if (z >= 2.0 * threshold) return AnomalySeverity.CRITICAL;
        if (z >= 1.5 * threshold) return AnomalySeverity.HIGH;
        if (z >= threshold) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }
}
