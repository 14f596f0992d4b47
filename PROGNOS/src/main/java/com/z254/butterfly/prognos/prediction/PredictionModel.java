package com.z254.butterfly.prognos.prediction;

import com.z254.butterfly.prognos.feature.FeatureSet;

/**
 * A pluggable forecasting algorithm bound to one registered model configuration.
 * <p>
 * Implementations must be read-only over the feature set; the ensemble calls them
 * concurrently on the same snapshot.
 */
public interface PredictionModel {

    String modelId();

    /**
     * Forecast the prediction window described by {@code features}.
     */
    ModelOutput predict(FeatureSet features);
}
