/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.ForecastModel;
import com.ammann.analytics.model.SeriesCharacteristics;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Decision function behind {@link ForecastModel#AUTO}.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>fewer than {@value #MIN_LENGTH} points: {@code linear}</li>
 *   <li>seasonal strength above {@value #SEASONAL_STRENGTH} with two full
 *       periods, and trend strength above {@value #SEASONAL_TREND_STRENGTH}:
 *       {@code holt-winters}</li>
 *   <li>seasonal strength above {@value #SEASONAL_STRENGTH} with two full
 *       periods: {@code seasonal}</li>
 *   <li>trend strength above {@value #TREND_STRENGTH}: {@code linear}</li>
 *   <li>more than {@value #SMOOTHING_MIN_LENGTH} points and a variance-to-mean
 *       ratio of at most {@value #MAX_SMOOTHING_DISPERSION}: {@code smoothing}</li>
 *   <li>otherwise {@code moving-average}, or {@code linear} when the series is
 *       too short for a moving average</li>
 * </ol>
 */
@ApplicationScoped
public class ModelSelector {

    private static final Logger LOG = Logger.getLogger(ModelSelector.class);

    static final int MIN_LENGTH = 4;
    static final double SEASONAL_STRENGTH = 0.3;
    static final double SEASONAL_TREND_STRENGTH = 0.3;
    static final double TREND_STRENGTH = 0.5;
    static final int SMOOTHING_MIN_LENGTH = 20;

    /** Above this dispersion index a series is too bursty for exponential smoothing. */
    static final double MAX_SMOOTHING_DISPERSION = 10.0;

    /**
     * Picks a concrete model for a series.
     *
     * @param characteristics series measurements
     * @param seasonalPeriod  configured season length
     * @return a concrete model, never {@link ForecastModel#AUTO}
     */
    public ForecastModel select(SeriesCharacteristics characteristics, int seasonalPeriod) {
        ForecastModel model = decide(characteristics, seasonalPeriod);
        LOG.debugf("Selected %s for %s", model.getValue(), characteristics);
        return model;
    }

    private static ForecastModel decide(SeriesCharacteristics c, int seasonalPeriod) {
        if (c.length() < MIN_LENGTH) {
            return ForecastModel.LINEAR;
        }
        boolean twoPeriods = c.length() >= seasonalPeriod * 2;
        boolean seasonal = twoPeriods && c.seasonalStrength() > SEASONAL_STRENGTH;

        if (seasonal && c.trendStrength() > SEASONAL_TREND_STRENGTH) {
            return ForecastModel.HOLT_WINTERS;
        }
        if (seasonal) {
            return ForecastModel.SEASONAL;
        }
        if (c.trendStrength() > TREND_STRENGTH) {
            return ForecastModel.LINEAR;
        }
        if (c.length() > SMOOTHING_MIN_LENGTH && c.varianceToMeanRatio() <= MAX_SMOOTHING_DISPERSION) {
            return ForecastModel.SMOOTHING;
        }
        if (c.length() < ForecastModel.MOVING_AVERAGE.minimumLength(seasonalPeriod)) {
            return ForecastModel.LINEAR;
        }
        return ForecastModel.MOVING_AVERAGE;
    }
}
