package com.z254.butterfly.prognos.scheduling;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a task periodically without ever overlapping two iterations of the same loop.
 */
public interface LoopScheduler {

    /**
     * Start a loop. Ticks that arrive while an iteration is still running are dropped;
     * an iteration running past {@code timeout} is cancelled and the loop keeps going.
     */
    LoopHandle schedule(String name, Duration interval, Duration timeout, Supplier<Mono<?>> task);
}
