package com.z254.butterfly.prognos.anomaly;

import com.z254.butterfly.prognos.domain.model.AnomalyAlgorithm;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.feature.FeatureSet;

import java.util.List;

/**
 * A pluggable anomaly detection algorithm.
 * <p>
 * Detectors are read-only over the feature set and run concurrently within a scan.
 */
public interface AnomalyDetector {

    AnomalyAlgorithm algorithm();

    default boolean isEnabled() {
        return true;
    }

    List<AnomalyDetectionResult> detect(FeatureSet features);
}
