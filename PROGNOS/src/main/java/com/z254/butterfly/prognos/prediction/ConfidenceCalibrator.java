package com.z254.butterfly.prognos.prediction;

import com.z254.butterfly.prognos.feature.RollingStatistics;
import org.springframework.stereotype.Component;

/**
 * Combines a model's raw inference confidence with its trained accuracy.
 * <p>
 * The two are distinct statistics: accuracy is measured at training time against held-out
 * data, confidence is reported per inference from fit quality. The calibrated value is their
 * geometric mean, so a confident but historically inaccurate model is discounted and an
 * untrained model (accuracy 0) contributes no confidence.
 */
@Component
public class ConfidenceCalibrator {

    public double calibrate(double rawConfidence, double trainedAccuracy) {
        double raw = RollingStatistics.clamp(rawConfidence, 0.0, 1.0);
        double accuracy = RollingStatistics.clamp(trainedAccuracy, 0.0, 1.0);
        return Math.sqrt(raw * accuracy);
    }
}
