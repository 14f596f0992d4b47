package com.z254.butterfly.prognos.strategy.execution;

import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Default executor: records what would be done without touching any infrastructure.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "prognos.execution", name = "mode", havingValue = "DRY_RUN", matchIfMissing = true)
public class DryRunStrategyExecutor implements StrategyExecutor {

    private final Clock clock;

    public DryRunStrategyExecutor(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<StrategyExecutionOutcome> execute(PreventionStrategy strategy, StrategyExecutionContext context) {
        log.info("DRY_RUN: Would execute {} ({}) with parameters {}, triggeredBy={}",
                strategy.getStrategyId(), strategy.getImplementation().getType(),
                strategy.getImplementation().getParameters(), context.getTriggeredBy());

        double expectedSavings = strategy.getBusinessJustification().getPreventedLoss()
                * strategy.getEstimatedEffectiveness();
        return Mono.just(StrategyExecutionOutcome.builder()
                .executionId("DRY-RUN-" + UUID.randomUUID().toString().substring(0, 8))
                .strategyId(strategy.getStrategyId())
                .executed(true)
                .success(true)
                .message("Dry run completed successfully")
                .costSavings(expectedSavings)
                .executionTimeMs(0)
                .executedAt(clock.instant())
                .build());
    }
}
