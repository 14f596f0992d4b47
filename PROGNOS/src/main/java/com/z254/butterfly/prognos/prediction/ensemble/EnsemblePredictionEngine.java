package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.config.EngineSchedulers;
import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.EnsembleMethod;
import com.z254.butterfly.prognos.domain.model.ModelConfig;
import com.z254.butterfly.prognos.domain.model.PredictionResult.Trend;
import com.z254.butterfly.prognos.exception.ModelUnavailableException;
import com.z254.butterfly.prognos.feature.FeatureSet;
import com.z254.butterfly.prognos.feature.RollingStatistics;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import com.z254.butterfly.prognos.prediction.ConfidenceCalibrator;
import com.z254.butterfly.prognos.prediction.ModelOutput;
import com.z254.butterfly.prognos.prediction.PredictionModelFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs every supplied model concurrently against one feature snapshot and combines the
 * survivors with the requested ensemble method.
 * <p>
 * A model that throws or misses the inference deadline is excluded for this run only and
 * recorded as a warning. The run fails with {@link ModelUnavailableException} when no
 * model is supplied or none succeeds.
 */
@Slf4j
@Component
public class EnsemblePredictionEngine {

    private static final Comparator<WeightedOutput> COMBINATION_ORDER =
            Comparator.comparingDouble(WeightedOutput::getWeight).reversed()
                    .thenComparing(wo -> wo.getConfig().getLastTrained(),
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final PredictionModelFactory modelFactory;
    private final ConfidenceCalibrator calibrator;
    private final BusinessLogicCorrector corrector;
    private final Map<EnsembleMethod, EnsembleCombiner> combiners = new EnumMap<>(EnsembleMethod.class);
    private final PrognosMetrics metrics;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Duration deadline;
    private final Duration recencyHorizon;
    private final double trendTolerance;

    public EnsemblePredictionEngine(PredictionModelFactory modelFactory,
                                    ConfidenceCalibrator calibrator,
                                    BusinessLogicCorrector corrector,
                                    List<EnsembleCombiner> combiners,
                                    PrognosMetrics metrics,
                                    EngineSchedulers schedulers,
                                    Clock clock,
                                    PrognosProperties properties) {
        this.modelFactory = modelFactory;
        this.calibrator = calibrator;
        this.corrector = corrector;
        combiners.forEach(c -> this.combiners.put(c.method(), c));
        this.metrics = metrics;
        this.scheduler = schedulers.getInference();
        this.clock = clock;
        this.deadline = properties.getPrediction().getInferenceDeadline();
        this.recencyHorizon = properties.getPrediction().getRecencyHorizon();
        this.trendTolerance = properties.getPrediction().getTrendTolerance();
    }

    public Mono<EnsembleOutput> predict(FeatureSet features, List<ModelConfig> models, EnsembleMethod method) {
        if (models.isEmpty()) {
            return Mono.error(new ModelUnavailableException("No active models available"));
        }
        EnsembleCombiner combiner = combiners.get(method);
        if (combiner == null) {
            return Mono.error(new IllegalArgumentException("No combiner registered for " + method));
        }

        return Flux.fromIterable(models)
                .flatMapSequential(config -> runModel(config, features))
                .collectList()
                .map(runs -> assemble(runs, features, combiner));
    }

    private Mono<ModelRun> runModel(ModelConfig config, FeatureSet features) {
        return Mono.fromCallable(() -> modelFactory.create(config).predict(features))
                .subscribeOn(scheduler)
                .timeout(deadline)
                .map(output -> new ModelRun(config, output, null))
                .onErrorResume(error -> {
                    String reason = error instanceof TimeoutException
                            ? "exceeded inference deadline of " + deadline.toMillis() + "ms"
                            : error.getClass().getSimpleName() + ": " + error.getMessage();
                    log.warn("Model {} excluded from ensemble: {}", config.getModelId(), reason);
                    metrics.recordModelFailure(config.getModelId());
                    return Mono.just(new ModelRun(config, null, "Model " + config.getModelId() + " " + reason));
                });
    }

    private EnsembleOutput assemble(List<ModelRun> runs, FeatureSet features, EnsembleCombiner combiner) {
        Instant now = clock.instant();
        List<String> warnings = new ArrayList<>();
        List<WeightedOutput> weighted = new ArrayList<>();
        for (ModelRun run : runs) {
            if (run.output() == null) {
                warnings.add(run.warning());
                continue;
            }
            double recency = recency(run.config(), now);
            double weight = 0.5 * run.config().accuracy() + 0.3 * recency + 0.2 * features.getDataQuality();
            double confidence = calibrator.calibrate(run.output().getConfidence(), run.config().accuracy());
            weighted.add(new WeightedOutput(run.config(), run.output(), weight, recency, confidence));
        }
        if (weighted.isEmpty()) {
            throw new ModelUnavailableException("All " + runs.size() + " models failed: " + warnings);
        }
        weighted.sort(COMBINATION_ORDER);

        CombinedForecast combined = combiner.combine(weighted);
        Trend trend = trend(combined.getErrorCount(), features);
        CombinedForecast corrected = corrector.correct(combined, features.getWindow());

        double[] normalised = WeightedAverageCombiner.effectiveWeights(weighted);
        EnsembleOutput.EnsembleOutputBuilder output = EnsembleOutput.builder()
                .forecast(corrected)
                .uncorrectedErrorCount(combined.getErrorCount())
                .trend(trend)
                .method(combiner.method())
                .warnings(warnings);
        for (int i = 0; i < weighted.size(); i++) {
            WeightedOutput wo = weighted.get(i);
            output.contribution(wo.modelId(), normalised[i])
                    .modelUsed(wo.modelId())
                    .modelErrorRate(wo.modelId(), wo.getOutput().getErrorRate());
        }
        return output.build();
    }

    /**
     * 1 for a model trained just now, decaying linearly to 0.1 at the recency horizon.
     */
    double recency(ModelConfig config, Instant now) {
        if (config.getLastTrained() == null) {
            return 0.1;
        }
        double age = Math.max(0L, Duration.between(config.getLastTrained(), now).toMillis());
        return RollingStatistics.clamp(1.0 - age / recencyHorizon.toMillis(), 0.1, 1.0);
    }

    /**
     * Compare the uncorrected forecast to the deseasonalised mean of the slice.
     */
    Trend trend(double forecast, FeatureSet features) {
        double baseline = features.get("error_count_deseasonalized_mean");
        if (baseline <= 0.0) {
            return forecast > 0.0 ? Trend.INCREASING : Trend.STABLE;
        }
        double change = (forecast - baseline) / baseline;
        if (change > trendTolerance) {
            return Trend.INCREASING;
        }
        if (change < -trendTolerance) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private record ModelRun(ModelConfig config, ModelOutput output, String warning) {
    }
}
