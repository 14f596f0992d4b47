package com.z254.butterfly.prognos.prediction;

import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import lombok.Builder;
import lombok.Value;

/**
 * Point estimates produced by a single model.
 */
@Value
@Builder(toBuilder = true)
public class ModelOutput {

    String modelId;

    double errorCount;

    double errorRate;

    BusinessImpact businessImpact;

    double revenueAtRisk;

    long customersAffected;

    /** Raw inference confidence in [0, 1], before calibration against training accuracy */
    double confidence;
}
