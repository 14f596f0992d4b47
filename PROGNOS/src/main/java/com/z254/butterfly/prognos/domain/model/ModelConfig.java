package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Versioned configuration of a registered prediction model.
 * <p>
 * Instances are never mutated: training completion builds a replacement through
 * {@link #toBuilder()} and swaps it into the registry in one step.
 */
@Value
@Builder(toBuilder = true)
public class ModelConfig {

    String modelId;

    String name;

    String description;

    ModelKind kind;

    /** Variable the model is trained against */
    String targetVariable;

    @Singular
    List<String> features;

    @Singular
    Map<String, Double> hyperparameters;

    /** Training data window */
    @Builder.Default
    Duration trainingWindow = Duration.ofHours(168);

    @Builder.Default
    Duration retrainInterval = Duration.ofHours(24);

    /** Fraction of the training window held out for validation */
    @Builder.Default
    double validationSplit = 0.2;

    Instant lastTrained;

    Instant nextRetraining;

    PerformanceMetrics performance;

    @Builder.Default
    boolean active = true;

    /** Monotonic version, bumped on every swap-in */
    @Builder.Default
    long version = 1;

    public double accuracy() {
        return performance != null ? performance.getAccuracy() : 0.0;
    }

    public double hyperparameter(String key, double defaultValue) {
        Double value = hyperparameters.get(key);
        return value != null ? value : defaultValue;
    }

    public boolean isRetrainDue(Instant now) {
        return nextRetraining != null && !now.isBefore(nextRetraining);
    }
}
