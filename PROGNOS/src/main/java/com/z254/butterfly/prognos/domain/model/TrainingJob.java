package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Asynchronous (re)training job. Each state change produces a new instance.
 */
@Value
@Builder(toBuilder = true)
public class TrainingJob {

    String jobId;

    String modelId;

    @Builder.Default
    TrainingStatus status = TrainingStatus.PENDING;

    Instant submittedAt;

    Instant startedAt;

    Instant completedAt;

    /** Progress percentage, 0 to 100 */
    double progress;

    long samplesProcessed;

    long totalSamples;

    PerformanceMetrics performance;

    String errorMessage;

    /** Why the job was submitted, e.g. MANUAL, SCHEDULED, DEGRADED */
    String trigger;

    public boolean isActive() {
        return !status.isTerminal();
    }
}
