package com.z254.butterfly.prognos.anomaly.detector;

import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.feature.RollingStatistics;

import java.util.Arrays;
import java.util.List;

/**
 * Standardised multi-signal vectors shared by the multivariate detectors.
 */
final class SignalVectors {

    static final Signal[] SIGNALS = Signal.values();

    private final double[] means;
    private final double[] stds;

    private SignalVectors(double[] means, double[] stds) {
        this.means = means;
        this.stds = stds;
    }

    /**
     * Standardisation parameters fitted on {@code baseline}; constant signals keep scale 1.
     */
    static SignalVectors fit(List<TelemetryDataPoint> baseline) {
        double[] means = new double[SIGNALS.length];
        double[] stds = new double[SIGNALS.length];
        for (int d = 0; d < SIGNALS.length; d++) {
            Signal signal = SIGNALS[d];
            double[] values = baseline.stream().mapToDouble(p -> p.signal(signal)).toArray();
            means[d] = RollingStatistics.mean(values);
            double std = RollingStatistics.std(values);
            stds[d] = std > 0.0 ? std : 1.0;
        }
        return new SignalVectors(means, stds);
    }

    double[] standardise(TelemetryDataPoint point) {
        double[] vector = new double[SIGNALS.length];
        for (int d = 0; d < SIGNALS.length; d++) {
            vector[d] = (point.signal(SIGNALS[d]) - means[d]) / stds[d];
        }
        return vector;
    }

    static double norm(double[] vector) {
        return Math.sqrt(Arrays.stream(vector).map(v -> v * v).sum());
    }

    /**
     * The signal contributing the largest absolute deviation.
     */
    static Signal dominant(double[] vector) {
        int best = 0;
        for (int d = 1; d < vector.length; d++) {
            if (Math.abs(vector[d]) > Math.abs(vector[best])) {
                best = d;
            }
        }
        return SIGNALS[best];
    }
}
