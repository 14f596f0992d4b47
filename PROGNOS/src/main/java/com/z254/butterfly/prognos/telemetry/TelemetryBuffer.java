package com.z254.butterfly.prognos.telemetry;

import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory history of telemetry data points.
 * <p>
 * Appends are serialized behind a short lock and evict the oldest entry once capacity
 * is reached. Readers take an immutable snapshot and compute outside the lock, so
 * feature engineering never blocks ingestion.
 */
@Slf4j
public class TelemetryBuffer {

    private final int capacity;
    private final Deque<TelemetryDataPoint> points;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong totalAppended = new AtomicLong();
    private final AtomicLong totalEvicted = new AtomicLong();

    public TelemetryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.points = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Append a data point, evicting the oldest one when full.
     *
     * @return the evicted point, or null when nothing was evicted
     */
    public TelemetryDataPoint append(TelemetryDataPoint point) {
        Objects.requireNonNull(point, "point");
        TelemetryDataPoint evicted = null;
        lock.lock();
        try {
            if (points.size() >= capacity) {
                evicted = points.pollFirst();
            }
            points.addLast(point);
        } finally {
            lock.unlock();
        }
        totalAppended.incrementAndGet();
        if (evicted != null) {
            totalEvicted.incrementAndGet();
        }
        return evicted;
    }

    /**
     * Immutable copy of the whole buffer, oldest first.
     */
    public List<TelemetryDataPoint> snapshot() {
        lock.lock();
        try {
            return List.copyOf(points);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Immutable copy of the most recent {@code count} points, oldest first.
     */
    public List<TelemetryDataPoint> latest(int count) {
        lock.lock();
        try {
            int skip = Math.max(0, points.size() - count);
            List<TelemetryDataPoint> copy = new ArrayList<>(points.size() - skip);
            int index = 0;
            for (TelemetryDataPoint point : points) {
                if (index++ >= skip) {
                    copy.add(point);
                }
            }
            return List.copyOf(copy);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return points.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long totalAppended() {
        return totalAppended.get();
    }

    public long totalEvicted() {
        return totalEvicted.get();
    }

    public void clear() {
        lock.lock();
        try {
            points.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Telemetry buffer cleared");
    }
}
