package com.z254.butterfly.prognos.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy.ImplementationType;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy.Template;
import com.z254.butterfly.prognos.domain.model.StrategyPriority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of prevention strategy templates plus the strategies recently recommended
 * from them.
 * <p>
 * Templates come from configuration; when none are configured the built-in circuit
 * breaker, auto-scaling and anomaly response templates are registered. Recommended
 * strategies stay resolvable for execution for the configured retention.
 */
@Slf4j
@Component
public class PreventionStrategyCatalog {

    public static final String CIRCUIT_BREAKER = "circuit_breaker";
    public static final String AUTO_SCALING = "auto_scaling";
    public static final String ANOMALY_RESPONSE = "anomaly_response";

    private final Map<String, Template> templates = new LinkedHashMap<>();
    private final Cache<String, PreventionStrategy> issued;

    public PreventionStrategyCatalog(PrognosProperties properties) {
        this.issued = Caffeine.newBuilder()
                .expireAfterWrite(properties.getStrategy().getIssuedRetention())
                .maximumSize(10_000)
                .build();
        List<Template> configured = properties.getStrategy().getTemplates();
        if (configured.isEmpty()) {
            initializeDefaultTemplates();
        } else {
            configured.forEach(this::registerTemplate);
        }
        log.info("Registered {} prevention strategy templates: {}", templates.size(), templates.keySet());
    }

    public synchronized void registerTemplate(Template template) {
        templates.put(template.getId(), template);
    }

    public synchronized Optional<Template> template(String templateId) {
        return Optional.ofNullable(templates.get(templateId));
    }

    public synchronized List<Template> templates() {
        return new ArrayList<>(templates.values());
    }

    /**
     * Position of a template in registration order, used to keep ranking stable.
     */
    public synchronized int registrationIndex(String templateId) {
        int index = 0;
        for (String id : templates.keySet()) {
            if (id.equals(templateId)) {
                return index;
            }
            index++;
        }
        return Integer.MAX_VALUE;
    }

    public void recordIssued(List<PreventionStrategy> strategies) {
        strategies.forEach(s -> issued.put(s.getStrategyId(), s));
    }

    /**
     * Resolve a recommended strategy, falling back to the template with that id.
     */
    public Optional<PreventionStrategy> resolve(String strategyId) {
        PreventionStrategy recent = issued.getIfPresent(strategyId);
        if (recent != null) {
            return Optional.of(recent);
        }
        return template(strategyId).map(Template::toStrategy);
    }

    private void initializeDefaultTemplates() {
        registerTemplate(Template.builder()
                .id(CIRCUIT_BREAKER)
                .name("Dynamic Circuit Breaker")
                .description("Open a circuit breaker on the failing dependency before the error rate cascades")
                .priority(StrategyPriority.HIGH)
                .automatable(true)
                .effectiveness(0.92)
                .type(ImplementationType.CIRCUIT_BREAKER)
                .parameters(new LinkedHashMap<>(Map.of(
                        "timeWindowSeconds", 300,
                        "recoveryTimeSeconds", 60,
                        "halfOpenRequests", 5)))
                .estimatedCost(50)
                .implementationTimeMinutes(2)
                .preventedLoss(25_000)
                .implementationCost(500)
                .build());

        registerTemplate(Template.builder()
                .id(AUTO_SCALING)
                .name("Predictive Auto-Scaling")
                .description("Scale out ahead of the predicted load to protect revenue-bearing traffic")
                .priority(StrategyPriority.CRITICAL)
                .automatable(true)
                .effectiveness(0.88)
                .type(ImplementationType.SCALING)
                .parameters(new LinkedHashMap<>(Map.of(
                        "scaleUpFactor", 1.5,
                        "cooldownSeconds", 300,
                        "maxInstances", 20)))
                .estimatedCost(200)
                .implementationTimeMinutes(5)
                .preventedLoss(50_000)
                .implementationCost(2_000)
                .build());

        registerTemplate(Template.builder()
                .id(ANOMALY_RESPONSE)
                .name("Anomaly Response")
                .description("Investigate and contain a critical anomaly")
                .priority(StrategyPriority.CRITICAL)
                .automatable(true)
                .effectiveness(0.85)
                .type(ImplementationType.MANUAL)
                .estimatedCost(100)
                .implementationTimeMinutes(10)
                .preventedLoss(25_000)
                .implementationCost(1_000)
                .build());
    }
}
