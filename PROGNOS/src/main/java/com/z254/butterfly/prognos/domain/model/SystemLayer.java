package com.z254.butterfly.prognos.domain.model;

/**
 * Architectural tiers telemetry is reported from.
 */
public enum SystemLayer {
    PRESENTATION(0.1),
    API(0.8),
    BUSINESS_LOGIC(0.7),
    DATA_ACCESS(0.9),
    EXTERNAL_SERVICES(0.6),
    INFRASTRUCTURE(0.5),
    SECURITY(1.0),
    MONITORING(0.4),
    AI_ML(0.2),
    SERVICE_MESH(0.3);

    private final double priority;

    SystemLayer(double priority) {
        this.priority = priority;
    }

    /** Relative priority of the layer in (0, 1]. */
    public double priority() {
        return priority;
    }
}
