package com.ammann.analytics.model;

import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Forecast error measures against held-out actuals.
 *
 * @param mape  mean absolute percentage error in percent, skipping zero actuals
 * @param smape symmetric MAPE in percent
 * @param mase  MAE scaled by the mean absolute one-step change of the actuals
 * @param r2    coefficient of determination of predictions against actuals
 */
public record AccuracyMetrics(
        double mae,
        double mse,
        double rmse,
        double mape,
        double smape,
        double mase,
        double r2
) {
    public static AccuracyMetrics zero() {
        return new AccuracyMetrics(0, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Field-wise mean of several accuracy measurements.
     *
     * @param metrics measurements to average
     * @return averaged metrics, or {@link #zero()} for an empty list
     */
    public static AccuracyMetrics average(List<AccuracyMetrics> metrics) {
        if (metrics.isEmpty()) {
            return zero();
        }
        return new AccuracyMetrics(
                mean(metrics, AccuracyMetrics::mae),
                mean(metrics, AccuracyMetrics::mse),
                mean(metrics, AccuracyMetrics::rmse),
                mean(metrics, AccuracyMetrics::mape),
                mean(metrics, AccuracyMetrics::smape),
                mean(metrics, AccuracyMetrics::mase),
                mean(metrics, AccuracyMetrics::r2));
    }

    private static double mean(List<AccuracyMetrics> metrics, ToDoubleFunction<AccuracyMetrics> field) {
        return metrics.stream().mapToDouble(field).average().orElse(0.0);
    }
}
