package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Median of numeric outputs, majority vote on the impact class.
 */
@Component
public class VotingCombiner implements EnsembleCombiner {

    @Override
    public EnsembleMethod method() {
        return EnsembleMethod.VOTING;
    }

    @Override
    public CombinedForecast combine(List<WeightedOutput> outputs) {
        Map<BusinessImpact, Integer> votes = new LinkedHashMap<>();
        for (WeightedOutput wo : outputs) {
            votes.merge(wo.getOutput().getBusinessImpact(), 1, Integer::sum);
        }
        BusinessImpact impact = null;
        int best = -1;
        for (Map.Entry<BusinessImpact, Integer> vote : votes.entrySet()) {
            if (vote.getValue() > best) {
                best = vote.getValue();
                impact = vote.getKey();
            }
        }

        double confidence = median(outputs, WeightedOutput::getConfidence);
        return CombinedForecast.builder()
                .errorCount(median(outputs, wo -> wo.getOutput().getErrorCount()))
                .errorRate(median(outputs, wo -> wo.getOutput().getErrorRate()))
                .businessImpact(impact)
                .revenueAtRisk(median(outputs, wo -> wo.getOutput().getRevenueAtRisk()))
                .customersAffected(Math.round(median(outputs, wo -> wo.getOutput().getCustomersAffected())))
                .confidence(confidence)
                .impactConfidence(confidence * best / outputs.size())
                .build();
    }

    private static double median(List<WeightedOutput> outputs, ToDoubleFunction<WeightedOutput> value) {
        return RollingStatistics.median(outputs.stream().mapToDouble(value).toArray());
    }
}
