package com.z254.butterfly.prognos.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.z254.butterfly.prognos.domain.model.PredictionOptions;
import com.z254.butterfly.prognos.domain.model.PredictionResult;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.domain.model.SystemLayer;
import com.z254.butterfly.prognos.observability.PrognosMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Short-lived cache of prediction results keyed by window, layer and options.
 * <p>
 * The cache is an optimization only: a failing lookup or write is logged, counted
 * and treated as a miss so the caller recomputes.
 */
@Slf4j
@Component
public class PredictionCache {

    private final Cache<String, PredictionResult> cache;
    private final PrognosMetrics metrics;

    public PredictionCache(Cache<String, PredictionResult> predictionResultCache, PrognosMetrics metrics) {
        this.cache = predictionResultCache;
        this.metrics = metrics;
    }

    public static String key(PredictionWindow window, SystemLayer layer, PredictionOptions options) {
        String raw = window.getStart().toEpochMilli()
                + "|" + window.getEnd().toEpochMilli()
                + "|" + (layer != null ? layer.name() : "ALL")
                + "|" + options.canonical();
        return "prediction:" + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<PredictionResult> get(String key) {
        try {
            PredictionResult cached = cache.getIfPresent(key);
            if (cached != null) {
                metrics.recordCacheHit();
                return Optional.of(cached);
            }
            metrics.recordCacheMiss();
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Prediction cache lookup failed for {}: {}", key, e.getMessage());
            metrics.recordCacheError();
            return Optional.empty();
        }
    }

    public void put(String key, PredictionResult result) {
        try {
            cache.put(key, result);
        } catch (RuntimeException e) {
            log.warn("Prediction cache write failed for {}: {}", key, e.getMessage());
            metrics.recordCacheError();
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
