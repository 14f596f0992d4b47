package com.z254.butterfly.prognos.prediction.model;

import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies business impact by an error-weighted vote over recent samples.
 * <p>
 * Error forecasts are the short-window means; the impact class is the heavier of the
 * vote winner and the rule-based estimate, escalated one level when the current error
 * rate runs well above its longer baseline.
 */
public class ImpactClassifierModel implements PredictionModel {

    private final ModelConfig config;
    private final ImpactEstimator impactEstimator;

    public ImpactClassifierModel(ModelConfig config, ImpactEstimator impactEstimator) {
        this.config = config;
        this.impactEstimator = impactEstimator;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public ModelOutput predict(FeatureSet features) {
        int lookback = (int) config.hyperparameter("lookback", 15.0);
        double escalationRatio = config.hyperparameter("escalationRatio", 1.5);

        List<TelemetryDataPoint> samples = features.getSamples();
        List<TelemetryDataPoint> recent = samples.subList(Math.max(0, samples.size() - lookback), samples.size());

        Map<BusinessImpact, Double> votes = new EnumMap<>(BusinessImpact.class);
        double total = 0.0;
        for (TelemetryDataPoint point : recent) {
            double weight = point.getErrorRate() + 0.01;
            votes.merge(point.getBusinessImpact(), weight, Double::sum);
            total += weight;
        }
        BusinessImpact winner = BusinessImpact.LOW;
        double best = -1.0;
        for (Map.Entry<BusinessImpact, Double> vote : votes.entrySet()) {
            if (vote.getValue() > best) {
                best = vote.getValue();
                winner = vote.getKey();
            }
        }

        double errorCount = features.get("errorCount_mean_15");
        double errorRate = features.get("errorRate_mean_15");

        BusinessImpact estimated = impactEstimator.classify(features, errorRate);
        BusinessImpact impact = winner.isAtLeast(estimated) ? winner : estimated;
        double baseline = features.get("errorRate_mean_60");
        if (baseline > 0.0 && features.get("errorRate_current") > baseline * escalationRatio
                && impact != BusinessImpact.REVENUE_BLOCKING) {
            impact = BusinessImpact.values()[impact.ordinal() + 1];
        }

        double confidence = total > 0.0 ? best / total : 0.5;
        return impactEstimator.withImpact(modelId(), features, Math.max(0.0, errorCount),
                Math.min(1.0, Math.max(0.0, errorRate)), impact, confidence);
    }
}
