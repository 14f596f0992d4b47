package com.z254.butterfly.prognos.strategy;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AnomalyDetectionResult;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Predictions;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy.BusinessJustification;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy.Template;
import com.z254.butterfly.prognos.feature.FeatureSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a forecast and its anomalies to a ranked list of prevention strategies.
 * <p>
 * Candidate rules:
 * <ul>
 *     <li>predicted error rate above its recent baseline by the relative threshold, and above
 *         the absolute floor: circuit breaker parameterised by that threshold</li>
 *     <li>predicted business impact HIGH or worse: auto-scaling</li>
 *     <li>each CRITICAL anomaly: an anomaly response</li>
 * </ul>
 * Every candidate gets a freshly computed ROI. Candidates are ranked by
 * {@code 0.4 * effectiveness + 0.3 * ROI + 0.2 * priorityWeight + 0.1 * automatableBonus};
 * equal scores keep template registration order.
 */
@Slf4j
@Component
public class PreventionStrategySelector {

    private final PreventionStrategyCatalog catalog;
    private final PrognosProperties.Strategy config;

    public PreventionStrategySelector(PreventionStrategyCatalog catalog, PrognosProperties properties) {
        this.catalog = catalog;
        this.config = properties.getStrategy();
    }

    public List<PreventionStrategy> select(String predictionId, Predictions predictions,
                                           FeatureSet features, List<AnomalyDetectionResult> anomalies) {
        List<PreventionStrategy> candidates = new ArrayList<>();
        double revenueAtRisk = predictions.getBusinessImpact().getRevenueAtRisk();

        double baseline = features.get("errorRate_mean_60");
        double threshold = baseline * (1.0 + config.getRelativeThreshold());
        double predictedRate = predictions.getErrorRate().getValue();
        if (predictedRate > threshold && predictedRate > config.getAbsoluteFloor()) {
            catalog.template(PreventionStrategyCatalog.CIRCUIT_BREAKER).ifPresent(template ->
                    candidates.add(circuitBreaker(template, predictionId, threshold, predictedRate, revenueAtRisk)));
        }

        if (predictions.getBusinessImpact().getLevel().isAtLeast(BusinessImpact.HIGH)) {
            catalog.template(PreventionStrategyCatalog.AUTO_SCALING).ifPresent(template ->
                    candidates.add(autoScaling(template, predictionId, predictions, features, revenueAtRisk)));
        }

        catalog.template(PreventionStrategyCatalog.ANOMALY_RESPONSE).ifPresent(template ->
                anomalies.stream()
                        .filter(AnomalyDetectionResult::isCritical)
                        .forEach(anomaly -> candidates.add(anomalyResponse(template, anomaly))));

        List<PreventionStrategy> ranked = rank(candidates);
        catalog.recordIssued(ranked);
        log.debug("Selected {} of {} candidate strategies for prediction {}",
                ranked.size(), candidates.size(), predictionId);
        return ranked;
    }

    /**
     * Stable ranking: registration order first, then descending composite score.
     */
    List<PreventionStrategy> rank(List<PreventionStrategy> candidates) {
        List<PreventionStrategy> ordered = new ArrayList<>(candidates);
        ordered.sort(Comparator.comparingInt(s -> catalog.registrationIndex(s.getTemplateId())));
        ordered.sort(Comparator.comparingDouble(PreventionStrategySelector::rankScore).reversed());
        return ordered.stream().limit(config.getTopN()).toList();
    }

    public static double rankScore(PreventionStrategy strategy) {
        return 0.4 * strategy.getEstimatedEffectiveness()
                + 0.3 * strategy.getBusinessJustification().getRoi()
                + 0.2 * strategy.getPriority().weight()
                + 0.1 * (strategy.isAutomatable() ? 1.0 : 0.0);
    }

    private PreventionStrategy circuitBreaker(Template template, String predictionId, double threshold,
                                              double predictedRate, double revenueAtRisk) {
        Map<String, Object> parameters = new LinkedHashMap<>(template.getParameters());
        parameters.put("errorThreshold", threshold);
        return derive(template, template.getId() + "_" + predictionId, template.getName(), parameters,
                List.of("errorRate > " + String.format("%.4f", threshold)),
                Map.of("errorRate", threshold, "predictedErrorRate", predictedRate),
                revenueAtRisk * 0.7, template.isAutomatable());
    }

    private PreventionStrategy autoScaling(Template template, String predictionId, Predictions predictions,
                                           FeatureSet features, double revenueAtRisk) {
        Map<String, Object> parameters = new LinkedHashMap<>(template.getParameters());
        parameters.put("targetImpact", predictions.getBusinessImpact().getLevel().name());
        return derive(template, template.getId() + "_" + predictionId, template.getName(), parameters,
                List.of("businessImpact >= HIGH"),
                Map.of("systemLoad", features.get("systemLoad_p95_15")),
                revenueAtRisk, template.isAutomatable());
    }

    private PreventionStrategy anomalyResponse(Template template, AnomalyDetectionResult anomaly) {
        Map<String, Object> parameters = new LinkedHashMap<>(template.getParameters());
        parameters.put("anomalyId", anomaly.getAnomalyId());
        parameters.put("algorithm", anomaly.getAlgorithm().name());
        parameters.put("suggestedActions", anomaly.getSuggestedActions());
        return derive(template, template.getId() + "_" + anomaly.getAnomalyId(),
                template.getName() + ": " + String.join(", ", anomaly.getAffectedMetrics()),
                parameters,
                List.of(anomaly.getDescription()),
                Map.of("anomalyScore", anomaly.getAnomalyScore()),
                anomaly.getBusinessImpact().weight() * 25_000,
                template.isAutomatable() && anomaly.isCritical());
    }

    private PreventionStrategy derive(Template template, String strategyId, String name,
                                      Map<String, Object> parameters, List<String> conditions,
                                      Map<String, Double> thresholds, double preventedLoss, boolean automatable) {
        PreventionStrategy base = template.toStrategy();
        return base.toBuilder()
                .strategyId(strategyId)
                .name(name)
                .automatable(automatable)
                .implementation(base.getImplementation().toBuilder()
                        .clearParameters()
                        .parameters(parameters)
                        .build())
                .triggers(PreventionStrategy.Triggers.builder()
                        .conditions(conditions)
                        .thresholds(thresholds)
                        .build())
                .businessJustification(BusinessJustification.of(preventedLoss, template.getImplementationCost()))
                .build();
    }
}
