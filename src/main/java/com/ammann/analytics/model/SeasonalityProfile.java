package com.ammann.analytics.model;

/**
 * Result of a seasonality check on a linearly detrended series.
 *
 * @param strength ratio of pattern variance to detrended variance
 * @param pattern  mean detrended value per position in the period
 */
public record SeasonalityProfile(
        int period,
        boolean hasSeasonality,
        double strength,
        double[] pattern
) {
    public SeasonalityProfile {
        pattern = pattern.clone();
    }

    @Override
    public double[] pattern() {
        return pattern.clone();
    }

    public static SeasonalityProfile none(int period) {
        return new SeasonalityProfile(period, false, 0.0, new double[0]);
    }
}
