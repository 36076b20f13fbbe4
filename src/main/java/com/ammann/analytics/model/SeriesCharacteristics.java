package com.ammann.analytics.model;

/**
 * Inputs of the automatic forecast model choice.
 *
 * @param varianceToMeanRatio dispersion index of the series (0 when the mean is 0)
 * @param seasonalStrength    variance share of the seasonal pattern, in [0, 1]
 * @param trendStrength       R-squared of a linear fit, in [0, 1]
 */
public record SeriesCharacteristics(
        int length,
        double varianceToMeanRatio,
        double seasonalStrength,
        double trendStrength
) {
}
