package com.z254.butterfly.prognos.config;

import lombok.Value;
import reactor.core.scheduler.Scheduler;

/**
 * Schedulers the engine runs its work on: model and detector fan-out, training jobs
 * and periodic loop ticks are kept on separate pools so none can starve another.
 */
@Value
public class EngineSchedulers {
    Scheduler inference;
    Scheduler training;
    Scheduler loops;

    public void dispose() {
        inference.dispose();
        training.dispose();
        loops.dispose();
    }
}
