package com.ammann.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Descriptive statistics of a value series.
 *
 * <p>Standard deviation and variance use the population formula. Kurtosis is
 * excess kurtosis, so a normal sample is close to 0. {@code mode} is
 * {@code null} when no value repeats. {@code outliers} lists the values
 * outside the 1.5 IQR Tukey fences.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryStatistics(
        int count,
        double mean,
        double median,
        Double mode,
        double standardDeviation,
        double variance,
        double min,
        double max,
        double range,
        Quartiles quartiles,
        double iqr,
        List<Double> outliers,
        double skewness,
        double kurtosis
) {
    public SummaryStatistics {
        outliers = List.copyOf(outliers);
    }

    /**
     * Summary of an empty series: every field zero, no outliers.
     */
    public static SummaryStatistics empty() {
        return new SummaryStatistics(
                0, 0.0, 0.0, null, 0.0, 0.0, 0.0, 0.0, 0.0, Quartiles.ZERO, 0.0, List.of(), 0.0, 0.0);
    }
}
