package com.z254.butterfly.prognos.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for the PROGNOS engine.
 * <p>
 * Emits {@code message | data={...}} lines with MDC context for prediction, anomaly,
 * strategy and training events.
 */
@Slf4j
@Component
public class PrognosStructuredLogger {

    // MDC keys
    public static final String MDC_PREDICTION_ID = "predictionId";
    public static final String MDC_MODEL_ID = "modelId";
    public static final String MDC_JOB_ID = "trainingJobId";
    public static final String MDC_STRATEGY_ID = "strategyId";
    public static final String MDC_LOOP = "loop";

    /**
     * Log a prediction cycle event.
     */
    public void logPredictionEvent(String predictionId, PredictionEventType eventType,
                                   String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_PREDICTION_ID, nullSafe(predictionId)))) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            logData.put("predictionId", predictionId);

            switch (eventType) {
                case GENERATED, CACHE_HIT -> log.info("{} | data={}", message, formatLogData(logData));
                case CRITICAL_ALERT, FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log an anomaly scan event.
     */
    public void logAnomalyEvent(AnomalyEventType eventType, String message, Map<String, Object> details) {
        Map<String, Object> logData = eventData(eventType.name(), details);
        switch (eventType) {
            case CRITICAL_ANOMALY, DETECTOR_FAILED -> log.warn("{} | data={}", message, formatLogData(logData));
            case DETECTED -> log.info("{} | data={}", message, formatLogData(logData));
            default -> log.debug("{} | data={}", message, formatLogData(logData));
        }
    }

    /**
     * Log a prevention strategy event.
     */
    public void logStrategyEvent(String strategyId, StrategyEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(MDC_STRATEGY_ID, nullSafe(strategyId)))) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            logData.put("strategyId", strategyId);

            switch (eventType) {
                case EXECUTED, AUTO_EXECUTED -> log.info("{} | data={}", message, formatLogData(logData));
                case EXECUTION_FAILED, REJECTED -> log.error("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Log a training job event.
     */
    public void logTrainingEvent(String jobId, String modelId, TrainingEventType eventType,
                                 String message, Map<String, Object> details) {
        try (var scope = withContext(Map.of(
                MDC_JOB_ID, nullSafe(jobId),
                MDC_MODEL_ID, nullSafe(modelId)))) {
            Map<String, Object> logData = eventData(eventType.name(), details);
            logData.put("jobId", jobId);
            logData.put("modelId", modelId);

            switch (eventType) {
                case SUBMITTED, STARTED, MODEL_SWAPPED ->
                        log.info("{} | data={}", message, formatLogData(logData));
                case FAILED -> log.error("{} | data={}", message, formatLogData(logData));
                case DEGRADATION_DETECTED -> log.warn("{} | data={}", message, formatLogData(logData));
                default -> log.debug("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    public MDCScope withLoop(String loop) {
        MDC.put(MDC_LOOP, loop);
        return new MDCScope(MDC_LOOP);
    }

    private Map<String, Object> eventData(String event, Map<String, Object> details) {
        Map<String, Object> logData = new LinkedHashMap<>();
        logData.put("event", event);
        if (details != null) {
            logData.putAll(details);
        }
        return logData;
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }

    String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    // ========== Event Type Enums ==========

    public enum PredictionEventType {
        STARTED, GENERATED, CACHE_HIT, CRITICAL_ALERT, FAILED
    }

    public enum AnomalyEventType {
        SCAN_STARTED, DETECTED, CRITICAL_ANOMALY, DETECTOR_FAILED, SCAN_SKIPPED
    }

    public enum StrategyEventType {
        SELECTED, EXECUTED, AUTO_EXECUTED, EXECUTION_FAILED, REJECTED
    }

    public enum TrainingEventType {
        SUBMITTED, STARTED, FAILED, MODEL_SWAPPED, DEGRADATION_DETECTED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
