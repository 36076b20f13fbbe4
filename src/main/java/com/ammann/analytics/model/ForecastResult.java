package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.ForecastModel;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast produced by one model.
 *
 * @param accuracy     hold-out accuracy, present when the series is long enough to split
 * @param parameters   fitted model parameters (slope, level, smoothing factors, ...)
 * @param residuals    in-sample residuals used for the prediction interval
 * @param fallbackFrom model originally requested when the series was too short for it
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResult(
        ForecastModel model,
        List<ForecastPoint> forecast,
        AccuracyMetrics accuracy,
        Map<String, Double> parameters,
        double[] residuals,
        ForecastModel fallbackFrom
) {
    public ForecastResult {
        forecast = List.copyOf(forecast);
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        residuals = residuals == null ? null : residuals.clone();
    }

    @Override
    public double[] residuals() {
        return residuals == null ? null : residuals.clone();
    }

    public static ForecastResult empty(ForecastModel model) {
        return new ForecastResult(model, List.of(), null, Map.of(), null, null);
    }

    public ForecastResult withAccuracy(AccuracyMetrics metrics) {
        return new ForecastResult(model, forecast, metrics, parameters, residuals, fallbackFrom);
    }

    public ForecastResult withFallbackFrom(ForecastModel requested) {
        return new ForecastResult(model, forecast, accuracy, parameters, residuals, requested);
    }
}
