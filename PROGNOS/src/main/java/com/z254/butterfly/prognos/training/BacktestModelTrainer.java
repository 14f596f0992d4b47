package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.PerformanceMetrics;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.exception.TrainingFailureException;
import com.z254.butterfly.prognos.feature.FeatureEngineeringPipeline;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModel;
import com.z254.butterfly.prognos.prediction.PredictionModelFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Walk-forward backtest over the validation tail of the training slice.
 * <p>
 * Each validation sample is forecast from the samples before it; the error-rate forecast
 * is scored for accuracy (1 - relative error), MSE and MAE, and classified against the
 * alert threshold for precision, recall and F1.
 */
@Slf4j
@Component
public class BacktestModelTrainer implements ModelTrainer {

    private static final double RELATIVE_ERROR_FLOOR = 0.01;

    private final FeatureEngineeringPipeline pipeline;
    private final PredictionModelFactory modelFactory;
    private final int minTrainingSamples;
    private final double alertThreshold;

    public BacktestModelTrainer(FeatureEngineeringPipeline pipeline,
                                PredictionModelFactory modelFactory,
                                PrognosProperties properties) {
        this.pipeline = pipeline;
        this.modelFactory = modelFactory;
        this.minTrainingSamples = properties.getTraining().getMinTrainingSamples();
        this.alertThreshold = properties.getPrediction().getErrorRateThreshold();
    }

    @Override
    public PerformanceMetrics train(ModelConfig config, List<TelemetryDataPoint> data,
                                    double validationSplit, ProgressListener progress) {
        if (data.size() < minTrainingSamples) {
            throw new TrainingFailureException(String.format(
                    "Insufficient training data for %s: %d < %d samples",
                    config.getModelId(), data.size(), minTrainingSamples));
        }
        int splitIndex = Math.max(2, (int) Math.floor(data.size() * (1.0 - validationSplit)));
        if (splitIndex >= data.size()) {
            throw new TrainingFailureException("Validation split leaves no samples to validate: " + validationSplit);
        }

        PredictionModel model = modelFactory.create(config);
        long total = data.size() - splitIndex;
        double accuracySum = 0.0;
        double squaredError = 0.0;
        double absoluteError = 0.0;
        int truePositives = 0;
        int falsePositives = 0;
        int falseNegatives = 0;

        for (int i = splitIndex; i < data.size(); i++) {
            TelemetryDataPoint actual = data.get(i);
            FeatureSet features = pipeline.engineer(data.subList(0, i), windowFor(data, i), null);
            ModelOutput output = model.predict(features);

            double error = output.getErrorRate() - actual.getErrorRate();
            squaredError += error * error;
            absoluteError += Math.abs(error);
            accuracySum += Math.max(0.0,
                    1.0 - Math.abs(error) / Math.max(actual.getErrorRate(), RELATIVE_ERROR_FLOOR));

            boolean predictedHigh = output.getErrorRate() > alertThreshold;
            boolean actualHigh = actual.getErrorRate() > alertThreshold;
            if (predictedHigh && actualHigh) truePositives++;
            else if (predictedHigh) falsePositives++;
            else if (actualHigh) falseNegatives++;

            progress.onProgress(i - splitIndex + 1, total);
        }

        double precision = truePositives + falsePositives > 0
                ? (double) truePositives / (truePositives + falsePositives) : 1.0;
        double recall = truePositives + falseNegatives > 0
                ? (double) truePositives / (truePositives + falseNegatives) : 1.0;
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .accuracy(accuracySum / total)
                .precision(precision)
                .recall(recall)
                .f1Score(f1)
                .mse(squaredError / total)
                .mae(absoluteError / total)
                .build();
        log.debug("Backtest of {} over {} validation samples: {}", config.getModelId(), total, metrics);
        return metrics;
    }

    /**
     * The window covering sample {@code i}, one sampling interval long.
     */
    private PredictionWindow windowFor(List<TelemetryDataPoint> data, int i) {
        Instant at = data.get(i).getTimestamp();
        Duration interval = Duration.between(data.get(i - 1).getTimestamp(), at);
        if (interval.isNegative() || interval.isZero()) {
            interval = Duration.ofMinutes(1);
        }
        return PredictionWindow.starting(at, interval);
    }
}
