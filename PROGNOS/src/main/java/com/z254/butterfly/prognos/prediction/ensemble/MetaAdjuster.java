package com.z254.butterfly.prognos.prediction.ensemble;

import java.util.List;

/**
 * Second-level correction applied by stacking on top of the weighted average.
 * A trained meta-model can replace the default linear rules by providing a bean.
 */
public interface MetaAdjuster {

    CombinedForecast adjust(CombinedForecast levelOne, List<WeightedOutput> outputs);
}
