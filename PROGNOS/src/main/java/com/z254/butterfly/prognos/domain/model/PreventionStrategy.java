package com.z254.butterfly.prognos.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A mitigation recommendation.
 * <p>
 * Templates are registered once at start-up; the selector derives a fresh instance
 * per prediction cycle with its own parameters and a freshly computed ROI.
 */
@Value
@Builder(toBuilder = true)
public class PreventionStrategy {

    String strategyId;

    /** Template this strategy was derived from, equal to strategyId for templates */
    String templateId;

    String name;

    String description;

    StrategyPriority priority;

    boolean automatable;

    /** Estimated effectiveness in [0, 1] */
    double estimatedEffectiveness;

    Implementation implementation;

    Triggers triggers;

    BusinessJustification businessJustification;

    /**
     * Automatable critical strategies may be executed without an operator.
     */
    public boolean isAutoExecutable() {
        return automatable && priority == StrategyPriority.CRITICAL;
    }

    @Value
    @Builder(toBuilder = true)
    public static class Implementation {
        ImplementationType type;
        @Singular
        Map<String, Object> parameters;
        double estimatedCost;
        int implementationTimeMinutes;
    }

    @Value
    @Builder(toBuilder = true)
    public static class Triggers {
        @Singular
        List<String> conditions;
        @Singular
        Map<String, Double> thresholds;
    }

    @Value
    @Builder
    public static class BusinessJustification {
        double preventedLoss;
        double implementationCost;
        double roi;

        /**
         * ROI is always derived from the two inputs; a zero cost yields zero ROI.
         */
        public static BusinessJustification of(double preventedLoss, double implementationCost) {
            double roi = implementationCost > 0 ? preventedLoss / implementationCost : 0.0;
            return new BusinessJustification(preventedLoss, implementationCost, roi);
        }
    }

    public enum ImplementationType {
        SCALING,
        CIRCUIT_BREAKER,
        RATE_LIMITING,
        CACHING,
        FAILOVER,
        MANUAL
    }

    /**
     * Mutable template definition bound from configuration.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Template {
        private String id;
        private String name;
        private String description;
        @Builder.Default
        private StrategyPriority priority = StrategyPriority.MEDIUM;
        private boolean automatable;
        private double effectiveness;
        @Builder.Default
        private ImplementationType type = ImplementationType.MANUAL;
        @Builder.Default
        private Map<String, Object> parameters = new HashMap<>();
        private double estimatedCost;
        private int implementationTimeMinutes;
        private double preventedLoss;
        private double implementationCost;

        public PreventionStrategy toStrategy() {
            return PreventionStrategy.builder()
                    .strategyId(id)
                    .templateId(id)
                    .name(name)
                    .description(description)
                    .priority(priority)
                    .automatable(automatable)
                    .estimatedEffectiveness(effectiveness)
                    .implementation(Implementation.builder()
                            .type(type)
                            .parameters(parameters)
                            .estimatedCost(estimatedCost)
                            .implementationTimeMinutes(implementationTimeMinutes)
                            .build())
                    .triggers(Triggers.builder().build())
                    .businessJustification(BusinessJustification.of(preventedLoss, implementationCost))
                    .build();
        }
    }
}
