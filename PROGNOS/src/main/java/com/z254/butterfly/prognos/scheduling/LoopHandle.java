package com.z254.butterfly.prognos.scheduling;

import lombok.Getter;
import reactor.core.Disposable;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Control handle and iteration counters of a running loop.
 */
public class LoopHandle {

    @Getter
    private final String name;
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private volatile Disposable subscription;

    LoopHandle(String name) {
        this.name = name;
    }

    void attach(Disposable subscription) {
        this.subscription = subscription;
    }

    public void stop() {
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }

    public boolean isRunning() {
        Disposable current = subscription;
        return current != null && !current.isDisposed();
    }

    public long completed() {
        return completed.get();
    }

    public long failed() {
        return failed.get();
    }

    public long timedOut() {
        return timedOut.get();
    }

    public long skipped() {
        return skipped.get();
    }

    void onCompleted() {
        completed.incrementAndGet();
    }

    void onFailed() {
        failed.incrementAndGet();
    }

    void onTimedOut() {
        timedOut.incrementAndGet();
    }

    void onSkipped() {
        skipped.incrementAndGet();
    }
}
