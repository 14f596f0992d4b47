package com.z254.butterfly.prognos.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * The future interval [start, end) a forecast is generated for.
 */
@Value
public class PredictionWindow {

    Instant start;
    Instant end;

    public static PredictionWindow of(Instant start, Instant end) {
        return new PredictionWindow(start, end);
    }

    public static PredictionWindow starting(Instant start, Duration length) {
        return new PredictionWindow(start, start.plus(length));
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public Instant midpoint() {
        return start.plus(length().dividedBy(2));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
