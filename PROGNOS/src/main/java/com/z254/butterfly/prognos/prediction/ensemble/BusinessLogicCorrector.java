package com.z254.butterfly.prognos.prediction.ensemble;

import com.z254.butterfly.prognos.config.PrognosProperties;
import com.z254.butterfly.prognos.domain.model.PredictionWindow;
import com.z254.butterfly.prognos.feature.FeatureEngineeringPipeline;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Deterministic calendar corrections applied to every ensemble result, after combination.
 * Weekend windows are dampened, peak-hour windows amplified (both by window start, UTC).
 */
@Component
public class BusinessLogicCorrector {

    private final double weekendFactor;
    private final double peakFactor;
    private final int peakStart;
    private final int peakEnd;

    public BusinessLogicCorrector(PrognosProperties properties) {
        this.weekendFactor = properties.getPrediction().getWeekendFactor();
        this.peakFactor = properties.getPrediction().getPeakFactor();
        this.peakStart = properties.getFeatures().getPeakHoursStart();
        this.peakEnd = properties.getFeatures().getPeakHoursEnd();
    }

    public CombinedForecast correct(CombinedForecast forecast, PredictionWindow window) {
        double factor = 1.0;
        if (FeatureEngineeringPipeline.isWeekend(window.getStart())) {
            factor *= weekendFactor;
        }
        int hour = ZonedDateTime.ofInstant(window.getStart(), ZoneOffset.UTC).getHour();
        if (hour >= peakStart && hour < peakEnd) {
            factor *= peakFactor;
        }
        if (factor == 1.0) {
            return forecast;
        }
        return forecast.toBuilder()
                .errorCount(forecast.getErrorCount() * factor)
                .errorRate(Math.min(1.0, forecast.getErrorRate() * factor))
                .build();
    }
}
