package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;
import java.util.TreeSet;

/**
 * Caller options for a prediction request. Part of the cache key.
 */
@Value
@Builder(toBuilder = true)
public class PredictionOptions {

    @Builder.Default
    boolean includeAnomalies = true;

    @Builder.Default
    boolean includePreventionStrategies = true;

    /** Restrict the ensemble to these models; empty means all active models */
    @Singular
    Set<String> modelIds;

    @Builder.Default
    EnsembleMethod ensembleMethod = EnsembleMethod.STACKING;

    public static PredictionOptions defaults() {
        return PredictionOptions.builder().build();
    }

    /**
     * Canonical, order-independent representation used for cache keys.
     */
    public String canonical() {
        return "anomalies=" + includeAnomalies
                + ";strategies=" + includePreventionStrategies
                + ";models=" + new TreeSet<>(modelIds)
                + ";method=" + ensembleMethod;
    }
}
