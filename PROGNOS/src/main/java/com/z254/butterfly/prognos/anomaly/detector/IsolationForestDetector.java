package com.z254.butterfly.prognos.anomaly.detector;

import com.amazon.randomcutforest.parkservices.AnomalyDescriptor;
import com.amazon.randomcutforest.parkservices.ThresholdedRandomCutForest;
import com.z254.butterfly.prognos.anomaly.AnomalyDetector;
import com.z254.butterfly.prognos.anomaly.AnomalyResults;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.AnomalySeverity;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.feature.FeatureSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Isolation-based detector backed by a thresholded random cut forest.
 * <p>
 * A fresh forest is built per scan with a fixed seed: the slice streams through it in
 * time order, and the trailing evaluation points are scored before they are absorbed.
 * The reported score is the forest's anomaly grade.
 */
@Component
public class IsolationForestDetector implements AnomalyDetector {

    static final int MIN_SAMPLES = 40;
    private static final int WARM_UP = 32;

    private final PrognosProperties.Anomaly.IsolationForest config;
    private final int evaluationSize;

    public IsolationForestDetector(PrognosProperties properties) {
        this.config = properties.getAnomaly().getIsolationForest();
        this.evaluationSize = properties.getAnomaly().getEvaluationSize();
    }

    @Override
    public AnomalyAlgorithm algorithm() {
        return AnomalyAlgorithm.ISOLATION_FOREST;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public List<AnomalyDetectionResult> detect(FeatureSet features) {
        List<TelemetryDataPoint> samples = features.getSamples();
        int n = samples.size();
        if (n < MIN_SAMPLES) {
            return List.of();
        }
        int evaluateFrom = Math.max(WARM_UP, n - evaluationSize);
        SignalVectors vectors = SignalVectors.fit(samples.subList(0, evaluateFrom));
        ThresholdedRandomCutForest forest = newForest();

        List<AnomalyDetectionResult> results = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double[] point = vectors.standardise(samples.get(i));
            // 0 is a placeholder timestamp; ordering comes from the slice
            AnomalyDescriptor descriptor = forest.process(point, 0L);
            if (i < evaluateFrom || descriptor.getAnomalyGrade() <= 0.0) {
                continue;
            }
            double grade = Math.min(1.0, descriptor.getAnomalyGrade());
            var signal = SignalVectors.dominant(point);
            results.add(AnomalyResults.of(algorithm(), samples.get(i), signal, grade, severity(grade),
                    String.format("Sample isolated by the forest (rcf score %.2f, grade %.2f), dominated by %s",
                            descriptor.getRCFScore(), grade, signal.metricName())));
        }
        return results;
    }

    private ThresholdedRandomCutForest newForest() {
        return new ThresholdedRandomCutForest(ThresholdedRandomCutForest.builder()
                .dimensions(SignalVectors.SIGNALS.length)
                .numberOfTrees(config.getTrees())
                .sampleSize(config.getSampleSize())
                .outputAfter(Math.min(WARM_UP, config.getSampleSize()))
                .randomSeed(config.getSeed())
                .parallelExecutionEnabled(false));
    }

    private AnomalySeverity severity(double grade) {
        if (grade >= 0.8) return AnomalySeverity.CRITICAL;
        if (grade >= 0.7) return AnomalySeverity.HIGH;
        if (grade >= 0.6) return AnomalySeverity.MEDIUM;
        return AnomalySeverity.LOW;
    }
}
