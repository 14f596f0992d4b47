package com.z254.butterfly.prognos.training;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.AccuracyReport;
import com.z254.butterfly.prognos.domain.model.AccuracyReport.AccuracyTrend;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scores past predictions against the telemetry that later arrived for their window.
 * <p>
 * Per-model accuracy feeds the {@link DegradationMonitor}; ensemble accuracy history backs
 * {@link #report()}.
 */
@Slf4j
@Component
public class PredictionAccuracyTracker {

    private static final int HISTORY_SIZE = 100;
    private static final double RELATIVE_ERROR_FLOOR = 0.01;
    private static final double TREND_BAND = 0.02;

    private final DegradationMonitor degradationMonitor;
    private final Duration retention;

    private final List<PendingEvaluation> pending = new ArrayList<>();
    private final Deque<Double> ensembleHistory = new ArrayDeque<>();
    private final Map<String, Deque<Double>> modelHistory = new TreeMap<>();
    private int evaluated;

    public PredictionAccuracyTracker(DegradationMonitor degradationMonitor, PrognosProperties properties) {
        this.degradationMonitor = degradationMonitor;
        this.retention = properties.getTraining().getEvaluationRetention();
    }

    public synchronized void record(PredictionResult result, Map<String, Double> modelErrorRates) {
        pending.add(new PendingEvaluation(result.getPredictionId(), result.getWindow(), result.getSystemLayer(),
                result.getPredictions().getErrorRate().getValue(), Map.copyOf(modelErrorRates)));
    }

    /**
     * Score every pending prediction whose window has elapsed and has actuals in {@code snapshot}.
     *
     * @return number of predictions scored
     */
    public synchronized int evaluate(List<TelemetryDataPoint> snapshot, Instant now) {
        int scored = 0;
        Iterator<PendingEvaluation> it = pending.iterator();
        while (it.hasNext()) {
            PendingEvaluation evaluation = it.next();
            PredictionWindow window = evaluation.window();
            if (now.isBefore(window.getEnd())) {
                continue;
            }
            double[] actuals = snapshot.stream()
                    .filter(p -> window.contains(p.getTimestamp()))
                    .filter(p -> evaluation.layer() == null || p.getSystemLayer() == evaluation.layer())
                    .mapToDouble(TelemetryDataPoint::getErrorRate)
                    .toArray();
            if (actuals.length == 0) {
                if (now.isAfter(window.getEnd().plus(retention))) {
                    log.debug("Discarding prediction {} without actuals", evaluation.predictionId());
                    it.remove();
                }
                continue;
            }
            double actual = Arrays.stream(actuals).average().orElse(0.0);
            push(ensembleHistory, accuracy(evaluation.ensembleErrorRate(), actual));
            evaluation.modelErrorRates().forEach((modelId, predicted) -> {
                double accuracy = accuracy(predicted, actual);
                push(modelHistory.computeIfAbsent(modelId, id -> new ArrayDeque<>()), accuracy);
                degradationMonitor.record(modelId, accuracy);
            });
            it.remove();
            evaluated++;
            scored++;
        }
        return scored;
    }

    public synchronized AccuracyReport report() {
        AccuracyReport.AccuracyReportBuilder report = AccuracyReport.builder()
                .overallAccuracy(mean(ensembleHistory))
                .trend(trend())
                .evaluatedPredictions(evaluated);
        modelHistory.forEach((modelId, history) -> report.modelAccuracy(modelId, mean(history)));
        return report.build();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    static double accuracy(double predicted, double actual) {
        return Math.max(0.0, 1.0 - Math.abs(predicted - actual) / Math.max(actual, RELATIVE_ERROR_FLOOR));
    }

    private AccuracyTrend trend() {
        if (ensembleHistory.size() < 4) {
            return AccuracyTrend.STABLE;
        }
        List<Double> values = new ArrayList<>(ensembleHistory);
        int half = values.size() / 2;
        double older = values.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double recent = values.subList(half, values.size()).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (recent - older > TREND_BAND) {
            return AccuracyTrend.IMPROVING;
        }
        if (older - recent > TREND_BAND) {
            return AccuracyTrend.DECLINING;
        }
        return AccuracyTrend.STABLE;
    }

    private static void push(Deque<Double> history, double value) {
        history.addLast(value);
        while (history.size() > HISTORY_SIZE) {
            history.removeFirst();
        }
    }

    private static double mean(Deque<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private record PendingEvaluation(String predictionId, PredictionWindow window, SystemLayer layer,
                                     double ensembleErrorRate, Map<String, Double> modelErrorRates) {
    }
}
