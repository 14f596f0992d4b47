package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Trend;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of one ensemble run.
 */
@Value
@Builder
public class EnsembleOutput {

    /** Combined forecast after business-logic correction */
    CombinedForecast forecast;

    /** Error-count forecast before business-logic correction */
    double uncorrectedErrorCount;

    Trend trend;

    EnsembleMethod method;

    /** Normalised weight per contributing model, in combination order */
    @Singular
    Map<String, Double> contributions;

    @Singular("modelUsed")
    List<String> modelsUsed;

    @Singular
    List<String> warnings;

    /** Each contributing model's own error-rate forecast, for accuracy tracking */
    @Singular
    Map<String, Double> modelErrorRates;
}
