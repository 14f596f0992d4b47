package com.z254.butterfly.prognos.strategy.execution;

import com.z254.butterfly.prognos.domain.model.PreventionStrategy;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionContext;
import com.z254.butterfly.prognos.domain.model.StrategyExecutionOutcome;
import reactor.core.publisher.Mono;

/**
 * Performs the side effects of a prevention strategy on behalf of the engine,
 * which only recommends and reports.
 */
public interface StrategyExecutor {

    Mono<StrategyExecutionOutcome> execute(PreventionStrategy strategy, StrategyExecutionContext context);
}
