package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.ForecastModel;

/**
 * Cross-validated accuracy of one forecasting model.
 *
 * @param folds number of validation windows the average is taken over
 */
public record ModelAccuracy(
        ForecastModel model,
        int folds,
        AccuracyMetrics accuracy
) {
}
