package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single operational telemetry sample pushed by the business layer.
 * <p>
 * Immutable once built; owned by the telemetry buffer after ingestion.
 */
@Value
@Builder(toBuilder = true)
public class TelemetryDataPoint {

    /** Sample timestamp */
    Instant timestamp;

    /** Errors observed in the sampling interval */
    double errorCount;

    /** Error ratio (0.0 to 1.0) */
    double errorRate;

    /** System load (0.0 to 1.0) */
    double systemLoad;

    /** Mean response time in milliseconds */
    double responseTime;

    /** Active users during the interval */
    double activeUsers;

    @Builder.Default
    BusinessImpact businessImpact = BusinessImpact.LOW;

    @Builder.Default
    SystemLayer systemLayer = SystemLayer.API;

    /** Freeform numeric features supplied by the reporter */
    @Singular
    Map<String, Double> features;

    /** Freeform metadata */
    @Singular("metadataEntry")
    Map<String, String> metadata;

    /**
     * Read one of the numeric signals by name.
     */
    public double signal(Signal signal) {
        return switch (signal) {
            case ERROR_COUNT -> errorCount;
            case ERROR_RATE -> errorRate;
            case SYSTEM_LOAD -> systemLoad;
            case RESPONSE_TIME -> responseTime;
            case ACTIVE_USERS -> activeUsers;
        };
    }

    /**
     * Numeric signals carried by every data point.
     */
    public enum Signal {
        ERROR_COUNT("errorCount"),
        ERROR_RATE("errorRate"),
        SYSTEM_LOAD("systemLoad"),
        RESPONSE_TIME("responseTime"),
        ACTIVE_USERS("activeUsers");

        private final String metricName;

        Signal(String metricName) {
            this.metricName = metricName;
        }

        public String metricName() {
            return metricName;
        }
    }
}
