package com.z254.butterfly.prognos.domain.model;

/**
 * Business impact classification attached to telemetry, anomalies and predictions.
 * <p>
 * Ordered from least to most severe; {@link #rank()} and {@link #weight()} are used
 * by feature engineering, anomaly ranking and strategy ROI estimation.
 */
public enum BusinessImpact {
    LOW(0.4),
    MEDIUM(0.6),
    HIGH(0.8),
    CRITICAL(0.9),
    REVENUE_BLOCKING(1.0);

    private final double weight;

    BusinessImpact(double weight) {
        this.weight = weight;
    }

    /** Weight in (0, 1] used as a business-context feature. */
    public double weight() {
        return weight;
    }

    /** 1-based severity rank (LOW = 1). */
    public int rank() {
        return ordinal() + 1;
    }

    public boolean isAtLeast(BusinessImpact other) {
        return compareTo(other) >= 0;
    }

    /**
     * Map a weighted impact score back to a level.
     */
    public static BusinessImpact fromScore(double score) {
        if (score >= 0.95) return REVENUE_BLOCKING;
        if (score >= 0.8) return CRITICAL;
        if (score >= 0.6) return HIGH;
        if (score >= 0.4) return MEDIUM;
        return LOW;
    }
}
