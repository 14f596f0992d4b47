package com.z254.butterfly.prognos.prediction.model;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;

import java.time.Duration;

/**
 * Holt double exponential smoothing (level + trend) over the sample sequence.
 * <p>
 * Hyperparameters: {@code alpha} (level, default 0.5), {@code beta} (trend, default 0.3).
 */
public class HoltLinearModel implements PredictionModel {

    private final ModelConfig config;
    private final ImpactEstimator impactEstimator;

    public HoltLinearModel(ModelConfig config, ImpactEstimator impactEstimator) {
        this.config = config;
        this.impactEstimator = impactEstimator;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public ModelOutput predict(FeatureSet features) {
        double alpha = config.hyperparameter("alpha", 0.5);
        double beta = config.hyperparameter("beta", 0.3);
        int steps = stepsAhead(features);

        Smoothed count = smooth(features.series(Signal.ERROR_COUNT), alpha, beta);
        Smoothed rate = smooth(features.series(Signal.ERROR_RATE), alpha, beta);

        double confidence = (count.fitQuality() + rate.fitQuality()) / 2.0;
        return impactEstimator.output(modelId(), features,
                count.forecast(steps), rate.forecast(steps), confidence);
    }

    /**
     * Number of sample intervals between the last sample and the window midpoint, capped
     * at the history length.
     */
    private int stepsAhead(FeatureSet features) {
        int n = features.sampleCount();
        if (n < 2) {
            return 1;
        }
        Duration span = Duration.between(features.getSamples().get(0).getTimestamp(),
                features.latest().getTimestamp());
        long intervalMillis = Math.max(1L, span.toMillis() / (n - 1));
        long aheadMillis = Duration.between(features.latest().getTimestamp(),
                features.getWindow().midpoint()).toMillis();
        long steps = Math.max(1L, Math.round((double) aheadMillis / intervalMillis));
        return (int) Math.min(steps, n);
    }

    private Smoothed smooth(double[] values, double alpha, double beta) {
        double level = values[0];
        double trend = values.length > 1 ? values[1] - values[0] : 0.0;
        double absError = 0.0;
        double absValue = 0.0;
        for (int i = 1; i < values.length; i++) {
            double predicted = level + trend;
            absError += Math.abs(values[i] - predicted);
            absValue += Math.abs(values[i]);
            double previousLevel = level;
            level = alpha * values[i] + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
        }
        double quality = absValue > 0.0
                ? RollingStatistics.clamp(1.0 - absError / absValue, 0.0, 1.0)
                : 0.5;
        return new Smoothed(level, trend, quality);
    }

    private record Smoothed(double level, double trend, double fitQuality) {
        double forecast(int steps) {
            return level + steps * trend;
        }
    }
}
