package com.z254.butterfly.prognos.prediction.ensemble;

import java.util.List;

/**
 * Fixed linear correction driven by mean confidence and weight dispersion.
 */
public class LinearMetaAdjuster implements MetaAdjuster {

    @Override
    public CombinedForecast adjust(CombinedForecast levelOne, List<WeightedOutput> outputs) {
        double meanConfidence = outputs.stream().mapToDouble(WeightedOutput::getConfidence).average().orElse(0.0);
        double meanWeight = outputs.stream().mapToDouble(WeightedOutput::getWeight).average().orElse(0.0);
        double weightVariance = outputs.stream()
                .mapToDouble(wo -> (wo.getWeight() - meanWeight) * (wo.getWeight() - meanWeight))
                .average().orElse(0.0);

        double countFactor = meanConfidence > 0.9 ? 1.02 : 0.98;
        double rateFactor = weightVariance < 0.1 ? 1.01 : 0.99;
        double businessFactor = meanConfidence > 0.85 ? 1.0 : 0.95;

        return levelOne.toBuilder()
                .errorCount(levelOne.getErrorCount() * countFactor)
                .errorRate(Math.min(1.0, levelOne.getErrorRate() * rateFactor))
                .revenueAtRisk(levelOne.getRevenueAtRisk() * businessFactor)
                .customersAffected(Math.round(levelOne.getCustomersAffected() * businessFactor))
                .build();
    }
}
