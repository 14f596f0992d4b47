package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.EnsembleMethod;

import java.util.List;

/**
 * Combination policy for model outputs.
 * <p>
 * Outputs arrive ordered by descending weight, then most recently trained first;
 * combiners use that order to break ties.
 */
public interface EnsembleCombiner {

    EnsembleMethod method();

    CombinedForecast combine(List<WeightedOutput> outputs);
}
