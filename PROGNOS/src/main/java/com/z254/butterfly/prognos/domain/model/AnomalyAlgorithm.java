package com.z254.butterfly.prognos.domain.model;

/**
 * Detector family that produced an anomaly.
 */
public enum AnomalyAlgorithm {
    STATISTICAL_ZSCORE,
    ISOLATION_FOREST,
    ONE_CLASS_BOUNDARY,
    RECONSTRUCTION_ERROR
}
