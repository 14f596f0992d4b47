package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted mean of numeric outputs; impact class by heaviest summed weight.
 */
@Component
public class WeightedAverageCombiner implements EnsembleCombiner {

    @Override
    public EnsembleMethod method() {
        return EnsembleMethod.WEIGHTED_AVERAGE;
    }

    @Override
    public CombinedForecast combine(List<WeightedOutput> outputs) {
        double[] weights = effectiveWeights(outputs);
        double count = 0.0;
        double rate = 0.0;
        double revenue = 0.0;
        double customers = 0.0;
        double confidence = 0.0;
        Map<BusinessImpact, Double> impactWeights = new LinkedHashMap<>();
        for (int i = 0; i < outputs.size(); i++) {
            WeightedOutput wo = outputs.get(i);
            double w = weights[i];
            count += w * wo.getOutput().getErrorCount();
            rate += w * wo.getOutput().getErrorRate();
            revenue += w * wo.getOutput().getRevenueAtRisk();
            customers += w * wo.getOutput().getCustomersAffected();
            confidence += w * wo.getConfidence();
            impactWeights.merge(wo.getOutput().getBusinessImpact(), w, Double::sum);
        }

        BusinessImpact impact = null;
        double best = -1.0;
        for (Map.Entry<BusinessImpact, Double> entry : impactWeights.entrySet()) {
            // Strict comparison keeps the earliest (heaviest, most recent) model's class on ties
            if (entry.getValue() > best) {
                best = entry.getValue();
                impact = entry.getKey();
            }
        }

        return CombinedForecast.builder()
                .errorCount(count)
                .errorRate(rate)
                .businessImpact(impact)
                .revenueAtRisk(revenue)
                .customersAffected(Math.round(customers))
                .confidence(confidence)
                .impactConfidence(confidence * best)
                .build();
    }

    /**
     * Weights normalised to sum 1; equal weights when every weight is zero.
     */
    static double[] effectiveWeights(List<WeightedOutput> outputs) {
        double total = outputs.stream().mapToDouble(WeightedOutput::getWeight).sum();
        double[] weights = new double[outputs.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = total > 0.0 ? outputs.get(i).getWeight() / total : 1.0 / weights.length;
        }
        return weights;
    }
}
