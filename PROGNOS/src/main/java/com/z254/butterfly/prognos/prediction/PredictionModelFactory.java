package com.z254.butterfly.prognos.prediction;

import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.prediction.model.BaselineVoterModel;
import com.z254.butterfly.prognos.prediction.model.HoltLinearModel;
import com.z254.butterfly.prognos.prediction.model.ImpactClassifierModel;
import com.z254.butterfly.prognos.prediction.model.RobustBaselineModel;
import com.z254.butterfly.prognos.prediction.model.SeasonalTrendModel;
import org.springframework.stereotype.Component;

/**
 * Binds registered model configurations to their built-in algorithm.
 */
@Component
public class PredictionModelFactory {

    private final ImpactEstimator impactEstimator;

    public PredictionModelFactory(ImpactEstimator impactEstimator) {
        this.impactEstimator = impactEstimator;
    }

    public PredictionModel create(ModelConfig config) {
        return switch (config.getKind()) {
            case TIME_SERIES -> new SeasonalTrendModel(config, impactEstimator);
            case REGRESSION -> new HoltLinearModel(config, impactEstimator);
            case CLASSIFICATION -> new ImpactClassifierModel(config, impactEstimator);
            case ANOMALY -> new RobustBaselineModel(config, impactEstimator);
            case ENSEMBLE_VOTER -> new BaselineVoterModel(config, impactEstimator);
        };
    }
}
