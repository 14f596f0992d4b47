package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class StrategyExecutionContext {
    /** Who or what asked for execution, e.g. "prediction-loop" or an operator id */
    String triggeredBy;
    AnomalySeverity severity;
    BusinessImpact businessImpact;
    String predictionId;
    @Singular
    Map<String, Object> attributes;
}
