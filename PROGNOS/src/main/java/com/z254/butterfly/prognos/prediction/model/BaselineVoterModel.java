package com.z254.butterfly.prognos.prediction.model;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;

/**
 * Median of three naive forecasts: last value, short mean and long mean.
 */
public class BaselineVoterModel implements PredictionModel {

    private final ModelConfig config;
    private final ImpactEstimator impactEstimator;

    public BaselineVoterModel(ModelConfig config, ImpactEstimator impactEstimator) {
        this.config = config;
        this.impactEstimator = impactEstimator;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public ModelOutput predict(FeatureSet features) {
        double errorCount = vote(features, "errorCount");
        double errorRate = vote(features, "errorRate");
        double confidence = Math.max(0.1, 1.0 - features.get("errorCount_volatility_15"));
        return impactEstimator.output(modelId(), features, errorCount, errorRate, confidence);
    }

    private double vote(FeatureSet features, String signal) {
        return RollingStatistics.median(new double[]{
                features.get(signal + "_current"),
                features.get(signal + "_mean_15"),
                features.get(signal + "_mean_60")});
    }
}
