package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import lombok.Builder;
import lombok.Value;

/**
 * Ensemble point estimates before they are assembled into a prediction result.
 */
@Value
@Builder(toBuilder = true)
public class CombinedForecast {
    double errorCount;
    double errorRate;
    BusinessImpact businessImpact;
    double revenueAtRisk;
    long customersAffected;
    /** Combined calibrated confidence */
    double confidence;
    /** Confidence discounted by how strongly the models agree on the impact class */
    double impactConfidence;
}
