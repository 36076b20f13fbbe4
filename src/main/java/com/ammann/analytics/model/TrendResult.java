package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.TrendDirection;
import com.ammann.analytics.enumeration.TrendMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outcome of a trend analysis.
 *
 * <p>Regression results carry {@code slope}, {@code rSquared} and
 * {@code confidence}; Mann-Kendall results carry {@code statistic} and
 * {@code pValue}. Fields that do not apply to the method are {@code null}.
 * {@code insufficientData} marks the neutral result returned for series that
 * are too short to test.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendResult(
        TrendMethod method,
        TrendDirection trend,
        Double slope,
        Double rSquared,
        Double statistic,
        Double pValue,
        Double confidence,
        boolean significant,
        List<Integer> breakpoints,
        Double changePercent,
        Double volatility,
        boolean insufficientData
) {
    public TrendResult {
        breakpoints = breakpoints == null ? null : List.copyOf(breakpoints);
    }

    /**
     * Neutral result: stable, not significant, zero confidence.
     *
     * @param method method that was requested
     */
    public static TrendResult insufficientData(TrendMethod method) {
        return method == TrendMethod.MANN_KENDALL
                ? new TrendResult(method, TrendDirection.STABLE, null, null, 0.0, 1.0, 0.0,
                        false, null, null, null, true)
                : new TrendResult(method, TrendDirection.STABLE, 0.0, 0.0, null, null, 0.0,
                        false, null, 0.0, 0.0, true);
    }

    /**
     * Returns a copy carrying the given breakpoint indices.
     */
    public TrendResult withBreakpoints(List<Integer> indices) {
        return new TrendResult(method, trend, slope, rSquared, statistic, pValue, confidence,
                significant, List.copyOf(indices), changePercent, volatility, insufficientData);
    }
}
