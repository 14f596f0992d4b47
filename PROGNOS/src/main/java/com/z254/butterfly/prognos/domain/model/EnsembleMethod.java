package com.z254.butterfly.prognos.domain.model;

/**
 * Policy for combining model outputs into one forecast.
 */
public enum EnsembleMethod {
    WEIGHTED_AVERAGE,
    VOTING,
    STACKING
}
