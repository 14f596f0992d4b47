package com.z254.butterfly.prognos.feature;

import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Engineered features over one immutable telemetry snapshot.
 * <p>
 * Shared read-only by every model and detector of a cycle.
 */
@Value
@Builder
public class FeatureSet {

    PredictionWindow window;

    /** Layer filter, null when all layers were used */
    SystemLayer systemLayer;

    /** The filtered slice features were derived from, oldest first */
    List<TelemetryDataPoint> samples;

    /** Feature name to value, sorted by name */
    SortedMap<String, Double> features;

    /** Share of errors per layer over the unfiltered slice */
    Map<SystemLayer, Double> layerErrorShares;

    /** Data quality score in [0, 1] */
    double dataQuality;

    /** Relative importance of each raw signal for the error rate, summing to 1 */
    Map<String, Double> featureImportance;

    SeasonalRegression.Fit errorCountFit;

    SeasonalRegression.Fit errorRateFit;

    /** Hours from the first sample to the window midpoint */
    double horizonHours;

    /** Whether the window starts on a weekend (UTC) */
    boolean weekendWindow;

    public double get(String name) {
        Double value = features.get(name);
        return value != null ? value : 0.0;
    }

    public boolean has(String name) {
        return features.containsKey(name);
    }

    public int sampleCount() {
        return samples.size();
    }

    /**
     * Values of one signal across the slice, oldest first.
     */
    public double[] series(TelemetryDataPoint.Signal signal) {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).signal(signal);
        }
        return values;
    }

    public TelemetryDataPoint latest() {
        return samples.get(samples.size() - 1);
    }
}
