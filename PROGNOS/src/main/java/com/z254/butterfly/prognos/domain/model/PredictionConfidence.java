package com.z254.butterfly.prognos.domain.model;

/**
 * Confidence category derived from a numeric confidence score.
 */
public enum PredictionConfidence {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    public static PredictionConfidence fromScore(double score) {
        if (score >= 0.9) return VERY_HIGH;
        if (score >= 0.8) return HIGH;
        if (score >= 0.7) return MEDIUM;
        if (score >= 0.6) return LOW;
        return VERY_LOW;
    }

    public boolean isAtLeast(PredictionConfidence other) {
        return compareTo(other) >= 0;
    }
}
