package com.z254.butterfly.prognos.feature;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint;
import com.z254.butterfly.prognos.domain.model.TelemetryDataPoint.Signal;
import com.z254.butterfly.prognos.exception.PredictionValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives time, statistical, correlation, lag, business-context and seasonal features
 * from a telemetry snapshot.
 * <p>
 * The pipeline reads nothing but its arguments and configuration: the same slice and
 * window always yield an equal {@link FeatureSet}.
 */
@Slf4j
@Component
public class FeatureEngineeringPipeline {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final PrognosProperties.Features config;

    public FeatureEngineeringPipeline(PrognosProperties properties) {
        this.config = properties.getFeatures();
    }

    /**
     * Engineer features for a prediction window.
     *
     * @param slice  buffered history, oldest first
     * @param window the window being predicted
     * @param layer  optional layer filter
     * @throws PredictionValidationException on a malformed window or too few samples
     */
    public FeatureSet engineer(List<TelemetryDataPoint> slice, PredictionWindow window, SystemLayer layer) {
        validateWindow(window);
        List<TelemetryDataPoint> samples = layer == null
                ? List.copyOf(slice)
                : slice.stream().filter(p -> p.getSystemLayer() == layer).toList();
        if (samples.size() < config.getMinSamples()) {
            throw new PredictionValidationException(String.format(
                    "Insufficient samples for feature engineering: %d < %d%s",
                    samples.size(), config.getMinSamples(),
                    layer != null ? " (layer " + layer + ")" : ""));
        }

        TreeMap<String, Double> features = new TreeMap<>();
        ZonedDateTime start = ZonedDateTime.ofInstant(window.getStart(), ZoneOffset.UTC);
        boolean weekendWindow = isWeekend(window.getStart());
        addTimeFeatures(features, start, weekendWindow);

        Map<Signal, double[]> series = new EnumMap<>(Signal.class);
        for (Signal signal : Signal.values()) {
            double[] values = new double[samples.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = samples.get(i).signal(signal);
            }
            series.put(signal, values);
        }
        addStatisticalFeatures(features, series);
        addCorrelationFeatures(features, series);
        addLagFeatures(features, series);
        addBusinessFeatures(features, samples, layer);

        Instant origin = samples.stream().map(TelemetryDataPoint::getTimestamp)
                .min(Instant::compareTo).orElse(window.getStart());
        double[] hours = new double[samples.size()];
        double[] weekend = new double[samples.size()];
        for (int i = 0; i < samples.size(); i++) {
            Instant ts = samples.get(i).getTimestamp();
            hours[i] = Duration.between(origin, ts).toMillis() / MILLIS_PER_HOUR;
            weekend[i] = isWeekend(ts) ? 1.0 : 0.0;
        }
        SeasonalRegression.Fit countFit = SeasonalRegression.fit(hours, weekend, series.get(Signal.ERROR_COUNT));
        SeasonalRegression.Fit rateFit = SeasonalRegression.fit(hours, weekend, series.get(Signal.ERROR_RATE));
        addSeasonalFeatures(features, countFit, rateFit, series, weekend);

        Map<SystemLayer, Double> layerShares = layerErrorShares(slice);
        layerShares.forEach((l, share) ->
                features.put(l.name().toLowerCase(Locale.ROOT) + "_error_share", share));

        double horizonHours = Duration.between(origin, window.midpoint()).toMillis() / MILLIS_PER_HOUR;

        return FeatureSet.builder()
                .window(window)
                .systemLayer(layer)
                .samples(samples)
                .features(Collections.unmodifiableSortedMap(features))
                .layerErrorShares(Collections.unmodifiableMap(layerShares))
                .dataQuality(dataQuality(samples))
                .featureImportance(featureImportance(series))
                .errorCountFit(countFit)
                .errorRateFit(rateFit)
                .horizonHours(horizonHours)
                .weekendWindow(weekendWindow)
                .build();
    }

    /**
     * Reject null or empty windows before any computation.
     */
    public static void validateWindow(PredictionWindow window) {
        if (window == null || window.getStart() == null || window.getEnd() == null) {
            throw new PredictionValidationException("Prediction window must have a start and an end");
        }
        if (!window.getEnd().isAfter(window.getStart())) {
            throw new PredictionValidationException(
                    "Prediction window end must be after its start: " + window);
        }
    }

    public static boolean isWeekend(Instant instant) {
        DayOfWeek day = ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private void addTimeFeatures(Map<String, Double> features, ZonedDateTime start, boolean weekend) {
        int hour = start.getHour();
        features.put("hour_of_day", (double) hour);
        features.put("day_of_week", (double) start.getDayOfWeek().getValue());
        features.put("is_weekend", weekend ? 1.0 : 0.0);
        features.put("is_business_hours",
                hour >= config.getBusinessHoursStart() && hour < config.getBusinessHoursEnd() ? 1.0 : 0.0);
        features.put("is_peak_hours", isPeakHour(hour) ? 1.0 : 0.0);
    }

    public boolean isPeakHour(int hour) {
        return hour >= config.getPeakHoursStart() && hour < config.getPeakHoursEnd();
    }

    private void addStatisticalFeatures(Map<String, Double> features, Map<Signal, double[]> series) {
        for (Signal signal : Signal.values()) {
            double[] values = series.get(signal);
            for (int window : config.getWindows()) {
                double[] slice = RollingStatistics.tail(values, window);
                String prefix = signal.metricName() + "_";
                features.put(prefix + "mean_" + window, RollingStatistics.mean(slice));
                features.put(prefix + "std_" + window, RollingStatistics.std(slice));
                features.put(prefix + "p95_" + window, RollingStatistics.percentile(slice, 0.95));
                features.put(prefix + "volatility_" + window, RollingStatistics.volatility(slice));
            }
        }
    }

    private void addCorrelationFeatures(Map<String, Double> features, Map<Signal, double[]> series) {
        int window = config.getCorrelationWindow();
        double[] errorRate = RollingStatistics.tail(series.get(Signal.ERROR_RATE), window);
        features.put("error_load_correlation", RollingStatistics.pearson(errorRate,
                RollingStatistics.tail(series.get(Signal.SYSTEM_LOAD), window)));
        features.put("error_response_correlation", RollingStatistics.pearson(errorRate,
                RollingStatistics.tail(series.get(Signal.RESPONSE_TIME), window)));
    }

    private void addLagFeatures(Map<String, Double> features, Map<Signal, double[]> series) {
        for (Signal signal : Signal.values()) {
            double[] values = series.get(signal);
            features.put(signal.metricName() + "_current", values[values.length - 1]);
            for (int lag : config.getLags()) {
                int index = values.length - 1 - lag;
                features.put(signal.metricName() + "_lag_" + lag, index >= 0 ? values[index] : 0.0);
            }
        }
    }

    private void addBusinessFeatures(Map<String, Double> features, List<TelemetryDataPoint> samples,
                                     SystemLayer layer) {
        double impact = samples.stream().mapToDouble(p -> p.getBusinessImpact().weight()).average().orElse(0.0);
        double priority = layer != null
                ? layer.priority()
                : samples.stream().mapToDouble(p -> p.getSystemLayer().priority()).average().orElse(0.0);
        features.put("business_impact_weight", impact);
        features.put("system_layer_priority", priority);
    }

    private void addSeasonalFeatures(Map<String, Double> features, SeasonalRegression.Fit countFit,
                                     SeasonalRegression.Fit rateFit, Map<Signal, double[]> series,
                                     double[] weekend) {
        features.put("error_count_trend_slope", countFit.slope());
        features.put("error_rate_trend_slope", rateFit.slope());
        features.put("error_count_weekend_effect", countFit.weekendEffect());

        double[] counts = series.get(Signal.ERROR_COUNT);
        double[] rates = series.get(Signal.ERROR_RATE);
        double countSum = 0.0;
        double rateSum = 0.0;
        double weekdaySum = 0.0;
        double weekendSum = 0.0;
        int weekendCount = 0;
        for (int i = 0; i < counts.length; i++) {
            boolean isWeekend = weekend[i] > 0.5;
            countSum += countFit.deseasonalize(counts[i], isWeekend);
            rateSum += rateFit.deseasonalize(rates[i], isWeekend);
            if (isWeekend) {
                weekendSum += counts[i];
                weekendCount++;
            } else {
                weekdaySum += counts[i];
            }
        }
        features.put("error_count_deseasonalized_mean", countSum / counts.length);
        features.put("error_rate_deseasonalized_mean", rateSum / rates.length);

        int weekdayCount = counts.length - weekendCount;
        double weekdayMean = weekdayCount > 0 ? weekdaySum / weekdayCount : 0.0;
        double factor = weekendCount > 0 && weekdayMean > 0.0 ? (weekendSum / weekendCount) / weekdayMean : 1.0;
        features.put("weekend_factor", factor);
    }

    private Map<SystemLayer, Double> layerErrorShares(List<TelemetryDataPoint> slice) {
        Map<SystemLayer, Double> errors = new EnumMap<>(SystemLayer.class);
        Map<SystemLayer, Double> counts = new EnumMap<>(SystemLayer.class);
        double totalErrors = 0.0;
        for (TelemetryDataPoint point : slice) {
            errors.merge(point.getSystemLayer(), point.getErrorCount(), Double::sum);
            counts.merge(point.getSystemLayer(), 1.0, Double::sum);
            totalErrors += point.getErrorCount();
        }
        Map<SystemLayer, Double> shares = new EnumMap<>(SystemLayer.class);
        double total = totalErrors;
        if (total > 0.0) {
            errors.forEach((layer, sum) -> shares.put(layer, sum / total));
        } else {
            counts.forEach((layer, count) -> shares.put(layer, count / slice.size()));
        }
        return shares;
    }

    /**
     * 70% completeness of valid values, 30% coverage of the longest rolling window.
     */
    private double dataQuality(List<TelemetryDataPoint> samples) {
        long valid = samples.stream().filter(this::isValid).count();
        double completeness = (double) valid / samples.size();
        int longest = config.getWindows().stream().mapToInt(Integer::intValue).max().orElse(1);
        double coverage = Math.min(1.0, (double) samples.size() / longest);
        return RollingStatistics.clamp(0.7 * completeness + 0.3 * coverage, 0.0, 1.0);
    }

    private boolean isValid(TelemetryDataPoint point) {
        for (Signal signal : Signal.values()) {
            double value = point.signal(signal);
            if (!Double.isFinite(value) || value < 0.0) {
                return false;
            }
        }
        return point.getErrorRate() <= 1.0 && point.getTimestamp() != null;
    }

    private Map<String, Double> featureImportance(Map<Signal, double[]> series) {
        double[] errorRate = series.get(Signal.ERROR_RATE);
        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0.0;
        for (Signal signal : Signal.values()) {
            if (signal == Signal.ERROR_RATE) {
                continue;
            }
            double importance = Math.abs(RollingStatistics.pearson(series.get(signal), errorRate));
            raw.put(signal.metricName(), importance);
            total += importance;
        }
        Map<String, Double> normalised = new TreeMap<>();
        double sum = total;
        raw.forEach((name, value) -> normalised.put(name, sum > 0.0 ? value / sum : 1.0 / raw.size()));
        return Collections.unmodifiableMap(normalised);
    }
}
