package com.z254.butterfly.prognos.prediction.model;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import com.z254.butterfly.prognos.feature.SeasonalRegression;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;

/**
 * Linear trend with a weekend indicator, extrapolated to the window midpoint.
 * <p>
 * The forecast is deseasonalised: weekend dampening is applied afterwards by the
 * ensemble's business-logic correction, not by the model.
 */
public class SeasonalTrendModel implements PredictionModel {

    private final ModelConfig config;
    private final ImpactEstimator impactEstimator;

    public SeasonalTrendModel(ModelConfig config, ImpactEstimator impactEstimator) {
        this.config = config;
        this.impactEstimator = impactEstimator;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public ModelOutput predict(FeatureSet features) {
        SeasonalRegression.Fit countFit = features.getErrorCountFit();
        SeasonalRegression.Fit rateFit = features.getErrorRateFit();
        double horizon = features.getHorizonHours();

        double errorCount = countFit.predict(horizon, false);
        double errorRate = rateFit.predict(horizon, false);

        // Fit quality, discounted for short histories
        double coverage = Math.min(1.0, features.sampleCount() / config.hyperparameter("fullConfidenceSamples", 48.0));
        double fit = (countFit.r2() + rateFit.r2()) / 2.0;
        double confidence = RollingStatistics.clamp((0.4 + 0.6 * fit) * (0.5 + 0.5 * coverage), 0.0, 1.0);

        return impactEstimator.output(modelId(), features, errorCount, errorRate, confidence);
    }
}
