package com.z254.butterfly.prognos.domain.model;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** 1-based rank (LOW = 1). */
    public int rank() {
        return ordinal() + 1;
    }
}
