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
 * Reconstructs each signal from a trailing moving average and flags samples whose
 * reconstruction error is large relative to the baseline's robust error scale.
 */
@Component
public class ReconstructionErrorDetector implements AnomalyDetector {

    private final PrognosProperties.Anomaly.Reconstruction config;
    private final int evaluationSize;

    public ReconstructionErrorDetector(PrognosProperties properties) {
        this.config = properties.getAnomaly().getReconstruction();
        this.evaluationSize = properties.getAnomaly().getEvaluationSize();
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.RECONSTRUCTION_ERROR;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public List<AnomalyDetectionResult> detect(FeatureSet features) {
        List<TelemetryDataPoint> samples = features.getSamples();
        int n = samples.size();
        int window = config.getWindow();
        int firstEvaluated = Math.max(window, n - evaluationSize);
        if (firstEvaluated - window < window) {
            return List.of();
        }
        double threshold = config.getThreshold();
        List<AnomalyDetectionResult> results = new ArrayList<>();

        for (Signal signal : Signal.values()) {
            double[] values = features.series(signal);
            double[] errors = new double[n];
            for (int i = window; i < n; i++) {
                double reconstructed = RollingStatistics.mean(Arrays.copyOfRange(values, i - window, i));
                errors[i] = Math.abs(values[i] - reconstructed);
            }
            double[] baselineErrors = Arrays.copyOfRange(errors, window, firstEvaluated);
            double scale = 1.4826 * RollingStatistics.median(baselineErrors);
            if (scale <= 0.0) {
                scale = RollingStatistics.mean(baselineErrors);
            }
            for (int i = firstEvaluated; i < n; i++) {
                if (errors[i] == 0.0) {
                    continue;
                }
                double normalised = scale > 0.0 ? errors[i] / scale : threshold * 3.0;
                if (normalised < threshold) {
                    continue;
                }
                double score = 1.0 - Math.exp(-normalised / threshold);
                results.add(AnomalyResults.of(algorithm(), samples.get(i), signal, score, severity(normalised),
                        String.format("%s reconstruction error is %.1fx its baseline scale",
                                signal.metricName(), normalised)));
            }
        }
        return results;
    }

    private AnomalySeverity severity(double normalised) {
        double threshold = config.getThreshold();
        if (normalised >= 2.0 * threshold) return AnomalySeverity.CRITICAL;
        if (normalised >= 1.5 * threshold) return AnomalySeverity.HIGH;
        if (normalised >= threshold) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }
}
