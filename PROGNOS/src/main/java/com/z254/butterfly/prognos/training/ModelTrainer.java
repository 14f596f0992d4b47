package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.PerformanceMetrics;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;

import java.util.List;

/**
 * Evaluates a model over historical telemetry and reports its performance snapshot.
 */
public interface ModelTrainer {

    /**
     * @throws com.z254.butterfly.prognos.exception.TrainingFailureException when training cannot complete
     */
    PerformanceMetrics train(ModelConfig config, List<TelemetryDataPoint> data,
                             double validationSplit, ProgressListener progress);

    @FunctionalInterface
    interface ProgressListener {
        void onProgress(long processed, long total);
    }
}
