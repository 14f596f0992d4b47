package com.z254.butterfly.prognos.strategy.execution;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionOutcome;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Delegates execution to the external orchestrator over HTTP.
 * <p>
 * Calls are guarded by a circuit breaker and retry; when the orchestrator stays
 * unavailable the fallback reports the strategy as not executed instead of failing.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "prognos.execution", name = "mode", havingValue = "REMOTE")
public class OrchestratorStrategyExecutor implements StrategyExecutor {

    static final String CLIENT_NAME = "strategy-orchestrator";

    private final WebClient webClient;
    private final PrognosProperties.Execution.Orchestrator config;
    private final Clock clock;

    public OrchestratorStrategyExecutor(WebClient.Builder webClientBuilder,
                                        PrognosProperties properties,
                                        Clock clock) {
        this.config = properties.getExecution().getOrchestrator();
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    @CircuitBreaker(name = CLIENT_NAME, fallbackMethod = "executeFallback")
    @Retry(name = CLIENT_NAME)
    public Mono<StrategyExecutionOutcome> execute(PreventionStrategy strategy, StrategyExecutionContext context) {
        log.info("Executing strategy via orchestrator: strategyId={}, type={}",
                strategy.getStrategyId(), strategy.getImplementation().getType());
        Instant started = clock.instant();

        return webClient.post()
                .uri(config.getExecutePath())
                .bodyValue(buildRequest(strategy, context))
                .retrieve()
                .bodyToMono(OrchestratorResponse.class)
                .timeout(config.getTimeout())
                .map(response -> StrategyExecutionOutcome.builder()
                        .executionId(response.getExecutionId())
                        .strategyId(strategy.getStrategyId())
                        .executed(true)
                        .success(response.isSuccess())
                        .message(response.getMessage())
                        .preventedErrors(response.getPreventedErrors())
                        .costSavings(response.getCostSavings())
                        .executionTimeMs(Duration.between(started, clock.instant()).toMillis())
                        .executedAt(started)
                        .build())
                .doOnSuccess(outcome -> log.info("Orchestrator result: strategyId={}, success={}",
                        strategy.getStrategyId(), outcome.isSuccess()))
                .doOnError(error -> log.error("Orchestrator call failed: strategyId={}, error={}",
                        strategy.getStrategyId(), error.getMessage()));
    }

    /**
     * Fallback when the orchestrator is unavailable.
     */
    public Mono<StrategyExecutionOutcome> executeFallback(PreventionStrategy strategy,
                                                          StrategyExecutionContext context,
                                                          Throwable throwable) {
        log.warn("Orchestrator unavailable, strategy {} not executed: {}",
                strategy.getStrategyId(), throwable.getMessage());
        return Mono.just(StrategyExecutionOutcome.notExecuted(strategy.getStrategyId(),
                "Orchestrator unavailable: " + throwable.getMessage(), clock.instant()));
    }

    Map<String, Object> buildRequest(PreventionStrategy strategy, StrategyExecutionContext context) {
        Map<String, Object> request = new HashMap<>();
        request.put("strategyId", strategy.getStrategyId());
        request.put("templateId", strategy.getTemplateId());
        request.put("type", strategy.getImplementation().getType().name());
        request.put("parameters", strategy.getImplementation().getParameters());
        request.put("priority", strategy.getPriority().name());
        request.put("triggeredBy", context.getTriggeredBy());
        request.put("predictionId", context.getPredictionId());
        request.put("idempotencyKey", strategy.getStrategyId() + ":" + context.getPredictionId());
        if (context.getBusinessImpact() != null) {
            request.put("businessImpact", context.getBusinessImpact().name());
        }
        return request;
    }

    @Data
    @NoArgsConstructor
    static class OrchestratorResponse {
        private String executionId;
        private boolean success;
        private String message;
        private long preventedErrors;
        private double costSavings;
    }
}
