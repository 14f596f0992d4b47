package com.z254.butterfly.prognos.strategy.execution;

import com.z254.butterfly.prognos.EngineFixtures;
import com.z254.butterfly.prognos.domain.model.BusinessImpact;
import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.strategy.PreventionStrategyCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static com.z254.butterfly.prognos.EngineFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorStrategyExecutorTest {

    private PreventionStrategy strategy;
    private StrategyExecutionContext context;

    @BeforeEach
    void setUp() {
        strategy = new PreventionStrategyCatalog(EngineFixtures.properties())
                .resolve(PreventionStrategyCatalog.CIRCUIT_BREAKER).orElseThrow();
        context = StrategyExecutionContext.builder()
                .triggeredBy("prediction-loop")
                .predictionId("pred_1")
                .businessImpact(BusinessImpact.CRITICAL)
                .build();
    }

    private OrchestratorStrategyExecutor executor(String responseBody, AtomicReference<ClientRequest> seen) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            seen.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(responseBody)
                    .build());
        });
        return new OrchestratorStrategyExecutor(builder, EngineFixtures.properties(), EngineFixtures.fixedClock());
    }

    @Test
    @DisplayName("should post the strategy and map the orchestrator response")
    void executesRemotely() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        OrchestratorStrategyExecutor executor = executor("""
                {"executionId":"exec-7","success":true,"message":"breaker armed","preventedErrors":120,"costSavings":4200.5}
                """, seen);

        StepVerifier.create(executor.execute(strategy, context))
                .assertNext(outcome -> {
                    assertThat(outcome.getExecutionId()).isEqualTo("exec-7");
                    assertThat(outcome.isExecuted()).isTrue();
                    assertThat(outcome.isSuccess()).isTrue();
                    assertThat(outcome.getPreventedErrors()).isEqualTo(120);
                    assertThat(outcome.getCostSavings()).isEqualTo(4200.5);
                    assertThat(outcome.getExecutedAt()).isEqualTo(NOW);
                })
                .verifyComplete();

        assertThat(seen.get().url().toString()).isEqualTo("http://localhost:8090/api/v1/strategies/execute");
    }

    @Test
    @DisplayName("the request should carry an idempotency key per strategy and prediction")
    void buildsRequest() {
        OrchestratorStrategyExecutor executor = executor("{}", new AtomicReference<>());

        Map<String, Object> request = executor.buildRequest(strategy, context);

        assertThat(request)
                .containsEntry("strategyId", PreventionStrategyCatalog.CIRCUIT_BREAKER)
                .containsEntry("type", "CIRCUIT_BREAKER")
                .containsEntry("triggeredBy", "prediction-loop")
                .containsEntry("businessImpact", "CRITICAL")
                .containsEntry("idempotencyKey", "circuit_breaker:pred_1");
    }

    @Test
    @DisplayName("the fallback should report the strategy as not executed")
    void fallback() {
        OrchestratorStrategyExecutor executor = executor("{}", new AtomicReference<>());

        StepVerifier.create(executor.executeFallback(strategy, context, new ConnectException("Connection refused")))
                .assertNext(outcome -> {
                    assertThat(outcome.isExecuted()).isFalse();
                    assertThat(outcome.isSuccess()).isFalse();
                    assertThat(outcome.getMessage()).isEqualTo("Orchestrator unavailable: Connection refused");
                })
                .verifyComplete();
    }
}
