package com.z254.butterfly.prognos.scheduling;

import com.z254.butterfly.prognos.config.EngineSchedulers;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link LoopScheduler} on {@code Flux.interval}. Ticks are dropped under backpressure
 * and iterations are flattened one at a time, which keeps iterations from overlapping.
 */
@Slf4j
@Component
public class ReactorLoopScheduler implements LoopScheduler {

    private final Scheduler scheduler;
    private final PrognosMetrics metrics;

    public ReactorLoopScheduler(EngineSchedulers schedulers, PrognosMetrics metrics) {
        this.scheduler = schedulers.getLoops();
        this.metrics = metrics;
    }

    @Override
    public LoopHandle schedule(String name, Duration interval, Duration timeout, Supplier<Mono<?>> task) {
        LoopHandle handle = new LoopHandle(name);
        handle.attach(Flux.interval(interval, interval, scheduler)
                .onBackpressureDrop(tick -> {
                    handle.onSkipped();
                    metrics.recordLoopIteration(name, "skipped");
                    log.debug("Loop {} still busy, skipping tick {}", name, tick);
                })
                .flatMap(tick -> runIteration(name, timeout, task, handle), 1, 1)
                .subscribe());
        log.info("Started loop {} (interval={}, timeout={})", name, interval, timeout);
        return handle;
    }

    private Mono<Void> runIteration(String name, Duration timeout, Supplier<Mono<?>> task, LoopHandle handle) {
        return Mono.defer(task)
                .timeout(timeout, scheduler)
                .doOnSuccess(ignored -> {
                    handle.onCompleted();
                    metrics.recordLoopIteration(name, "success");
                })
                .then()
                .onErrorResume(TimeoutException.class, e -> {
                    handle.onTimedOut();
                    metrics.recordLoopIteration(name, "timeout");
                    log.warn("Loop {} iteration exceeded {} and was cancelled", name, timeout);
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    handle.onFailed();
                    metrics.recordLoopIteration(name, "failure");
                    log.error("Loop {} iteration failed: {}", name, e.getMessage(), e);
                    return Mono.empty();
                });
    }
}
