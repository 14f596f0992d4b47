package com.z254.butterfly.prognos.event;

/**
 * Engine event topic names.
 */
public final class EventTopics {

    public static final String PREDICTION_GENERATED = "predictionGenerated";
    public static final String ANOMALIES_DETECTED = "anomaliesDetected";
    public static final String CRITICAL_PREDICTION_ALERT = "criticalPredictionAlert";
    public static final String CRITICAL_ANOMALY = "criticalAnomaly";
    public static final String PREVENTION_STRATEGY_EXECUTED = "preventionStrategyExecuted";

    private EventTopics() {
    }
}
