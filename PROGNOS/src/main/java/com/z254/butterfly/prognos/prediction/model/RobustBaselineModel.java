package com.z254.butterfly.prognos.prediction.model;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import com.z254.butterfly.prognos.prediction.ImpactEstimator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;

/**
 * Median baseline that ignores outliers; confidence falls with the median absolute deviation.
 */
public class RobustBaselineModel implements PredictionModel {

    private final ModelConfig config;
    private final ImpactEstimator impactEstimator;

    public RobustBaselineModel(ModelConfig config, ImpactEstimator impactEstimator) {
        this.config = config;
        this.impactEstimator = impactEstimator;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public ModelOutput predict(FeatureSet features) {
        int window = (int) config.hyperparameter("window", 60.0);
        double[] counts = RollingStatistics.tail(features.series(Signal.ERROR_COUNT), window);
        double[] rates = RollingStatistics.tail(features.series(Signal.ERROR_RATE), window);

        double countMedian = RollingStatistics.median(counts);
        double rateMedian = RollingStatistics.median(rates);
        double confidence = countMedian > 0.0
                ? RollingStatistics.clamp(1.0 - RollingStatistics.mad(counts) / countMedian, 0.0, 1.0)
                : 0.5;

        return impactEstimator.output(modelId(), features, countMedian, rateMedian, confidence);
    }
}
