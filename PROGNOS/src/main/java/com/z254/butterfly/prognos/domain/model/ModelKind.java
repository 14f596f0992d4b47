package com.z254.butterfly.prognos.domain.model;

/**
 * Algorithm family of a registered prediction model.
 */
public enum ModelKind {
    TIME_SERIES,
    ANOMALY,
    CLASSIFICATION,
    REGRESSION,
    ENSEMBLE_VOTER
}
