package com.z254.butterfly.prognos.domain.model;

public enum StrategyPriority {
    LOW(0.3),
    MEDIUM(0.5),
    HIGH(0.8),
    CRITICAL(1.0);

    private final double weight;

    StrategyPriority(double weight) {
        this.weight = weight;
    }

    /** Weight used by strategy ranking. */
    public double weight() {
        return weight;
    }
}
