package com.z254.butterfly.prognos.prediction;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import org.springframework.stereotype.Component;

/**
 * Translates an error forecast into business impact, revenue at risk and affected customers.
 */
@Component
public class ImpactEstimator {

    private final double errorRateThreshold;
    private final double revenuePerError;

    public ImpactEstimator(PrognosProperties properties) {
        this.errorRateThreshold = properties.getPrediction().getErrorRateThreshold();
        this.revenuePerError = properties.getPrediction().getRevenuePerError();
    }

    /**
     * Weighted impact score: 40% recent business impact, 40% error-rate severity
     * (saturating at four times the alert threshold), 20% layer priority.
     */
    public double impactScore(FeatureSet features, double errorRate) {
        double severity = RollingStatistics.clamp(errorRate / (4.0 * errorRateThreshold), 0.0, 1.0);
        return 0.4 * features.get("business_impact_weight")
                + 0.4 * severity
                + 0.2 * features.get("system_layer_priority");
    }

    public BusinessImpact classify(FeatureSet features, double errorRate) {
        return BusinessImpact.fromScore(impactScore(features, errorRate));
    }

    public double revenueAtRisk(double errorCount, BusinessImpact impact) {
        return Math.max(0.0, errorCount) * revenuePerError * impact.weight();
    }

    public long customersAffected(FeatureSet features, double errorRate) {
        return Math.round(Math.max(0.0, errorRate) * features.get("activeUsers_mean_15"));
    }

    /**
     * Complete an output from its error forecast using the shared impact rules.
     */
    public ModelOutput output(String modelId, FeatureSet features, double errorCount,
                              double errorRate, double confidence) {
        double count = Math.max(0.0, errorCount);
        double rate = RollingStatistics.clamp(errorRate, 0.0, 1.0);
        BusinessImpact impact = classify(features, rate);
        return withImpact(modelId, features, count, rate, impact, confidence);
    }

    public ModelOutput withImpact(String modelId, FeatureSet features, double errorCount,
                                  double errorRate, BusinessImpact impact, double confidence) {
        return ModelOutput.builder()
                .modelId(modelId)
                .errorCount(errorCount)
                .errorRate(errorRate)
                .businessImpact(impact)
                .revenueAtRisk(revenueAtRisk(errorCount, impact))
                .customersAffected(customersAffected(features, errorRate))
                .confidence(RollingStatistics.clamp(confidence, 0.0, 1.0))
                .build();
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }
}
