package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.EnsembleMethod;

import java.util.List;

/**
 * Weighted average followed by a meta adjustment.
 */
public class StackingCombiner implements EnsembleCombiner {

    private final WeightedAverageCombiner levelOne;
    private final MetaAdjuster metaAdjuster;

    public StackingCombiner(WeightedAverageCombiner levelOne, MetaAdjuster metaAdjuster) {
        this.levelOne = levelOne;
        this.metaAdjuster = metaAdjuster;
    }

    @Override
    public EnsembleMethod method() {
        return EnsembleMethod.STACKING;
    }

    @Override
    public CombinedForecast combine(List<WeightedOutput> outputs) {
        return metaAdjuster.adjust(levelOne.combine(outputs), outputs);
    }
}
