package com.z254.butterfly.prognos.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Transient record of a strategy execution reported by the executor.
 */
@Value
@Builder
public class StrategyExecutionOutcome {
    String executionId;
    String strategyId;
    boolean executed;
    boolean success;
    String message;
    long preventedErrors;
    double costSavings;
    long executionTimeMs;
    Instant executedAt;

    public static StrategyExecutionOutcome notExecuted(String strategyId, String message, Instant at) {
        return StrategyExecutionOutcome.builder()
                .strategyId(strategyId)
                .executed(false)
                .success(false)
                .message(message)
                .executedAt(at)
                .build();
    }
}
