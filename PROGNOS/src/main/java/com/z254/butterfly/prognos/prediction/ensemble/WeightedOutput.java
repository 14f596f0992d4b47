package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import lombok.Value;

/**
 * A successful model output with its ensemble weight and calibrated confidence.
 */
@Value
public class WeightedOutput {
    ModelConfig config;
    ModelOutput output;
    double weight;
    double recency;
    double confidence;

    public String modelId() {
        return config.getModelId();
    }
}
