package com.ammann.analytics.model;

/**
 * Additive decomposition {@code value[i] = trend[i] + seasonal[i] + residual[i]}.
 *
 * <p>{@code pattern} holds one period of the seasonal component and sums to
 * approximately zero; {@code seasonal[i] == pattern[i % period]}. When the
 * series is shorter than two periods, {@code sufficientData} is {@code false},
 * {@code trend} is the raw series and the other components are zero.
 *
 * @param trendStrength    share of non-seasonal variance explained by the trend, in [0, 1]
 * @param seasonalStrength share of detrended variance explained by the pattern, in [0, 1]
 */
public record SeasonalDecomposition(
        int period,
        double[] trend,
        double[] seasonal,
        double[] residual,
        double[] pattern,
        double trendStrength,
        double seasonalStrength,
        boolean sufficientData
) {
    public SeasonalDecomposition {
        trend = trend.clone();
        seasonal = seasonal.clone();
        residual = residual.clone();
        pattern = pattern.clone();
    }

    @Override
    public double[] trend() {
        return trend.clone();
    }

    @Override
    public double[] seasonal() {
        return seasonal.clone();
    }

    @Override
    public double[] residual() {
        return residual.clone();
    }

    @Override
    public double[] pattern() {
        return pattern.clone();
    }

    /** Series minus its seasonal component. */
    public double[] seasonallyAdjusted() {
        double[] adjusted = new double[trend.length];
        for (int i = 0; i < adjusted.length; i++) {
            adjusted[i] = trend[i] + residual[i];
        }
        return adjusted;
    }
}
