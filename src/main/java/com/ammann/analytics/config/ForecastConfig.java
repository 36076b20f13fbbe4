/* (C)2026 */
package com.ammann.analytics.config;

import com.ammann.analytics.enumeration.ForecastModel;
import com.ammann.analytics.exception.ValidationException;

/**
 * Settings of the forecasting engine.
 *
 * @param confidence  coverage of the prediction interval, in (0, 1)
 * @param alpha       level smoothing factor
 * @param beta        trend smoothing factor
 * @param gamma       seasonal smoothing factor
 * @param splitRatio  share of the series used for training in the hold-out accuracy check
 * @param folds       number of rolling-origin windows in cross-validation
 */
public record ForecastConfig(
        ForecastModel model,
        int horizon,
        double confidence,
        int seasonalPeriod,
        double alpha,
        double beta,
        double gamma,
        double splitRatio,
        int folds
) {
    public static final ForecastConfig DEFAULT =
            new ForecastConfig(ForecastModel.AUTO, 7, 0.95, 7, 0.3, 0.1, 0.1, 0.8, 5);

    public ForecastConfig {
        if (model == null) {
            throw ValidationException.invalidParameter("forecast.model", null, "a forecast model");
        }
        if (horizon < 1) {
            throw ValidationException.invalidParameter("forecast.horizon", horizon, "a value >= 1");
        }
        if (!(confidence > 0 && confidence < 1)) {
            throw ValidationException.invalidParameter("forecast.confidence", confidence, "a value in (0, 1)");
        }
        if (seasonalPeriod < 2) {
            throw ValidationException.invalidParameter("forecast.seasonal-period", seasonalPeriod, "a value >= 2");
        }
        requireUnitInterval("forecast.alpha", alpha);
        requireUnitInterval("forecast.beta", beta);
        requireUnitInterval("forecast.gamma", gamma);
        if (!(splitRatio > 0 && splitRatio < 1)) {
            throw ValidationException.invalidParameter("forecast.split-ratio", splitRatio, "a value in (0, 1)");
        }
        if (folds < 1) {
            throw ValidationException.invalidParameter("forecast.folds", folds, "a value >= 1");
        }
    }

    public ForecastConfig withModel(ForecastModel value) {
        return new ForecastConfig(value, horizon, confidence, seasonalPeriod, alpha, beta, gamma, splitRatio, folds);
    }

    public ForecastConfig withHorizon(int value) {
        return new ForecastConfig(model, value, confidence, seasonalPeriod, alpha, beta, gamma, splitRatio, folds);
    }

    private static void requireUnitInterval(String name, double value) {
        if (!(value > 0 && value <= 1)) {
            throw ValidationException.invalidParameter(name, value, "a value in (0, 1]");
        }
    }
}
