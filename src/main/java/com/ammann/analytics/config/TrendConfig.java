/* (C)2026 */
package com.ammann.analytics.config;

import com.ammann.analytics.exception.ValidationException;

/**
 * Settings of the trend analyzer.
 *
 * @param minDataPoints        shortest series that is tested at all
 * @param alpha                Mann-Kendall significance level
 * @param confidenceThreshold  regression confidence above which a trend is significant
 * @param stableSlopeThreshold normalized slope below which a regression trend is stable
 * @param minSegmentLength     shortest segment on each side of a breakpoint
 * @param breakpointThreshold  structural-change F statistic a split must exceed
 * @param seasonalPeriod       period used by seasonality checks
 */
public record TrendConfig(
        int minDataPoints,
        double alpha,
        double confidenceThreshold,
        double stableSlopeThreshold,
        int minSegmentLength,
        double breakpointThreshold,
        int seasonalPeriod
) {
    public static final TrendConfig DEFAULT = new TrendConfig(4, 0.05, 0.95, 0.01, 5, 10.0, 7);

    public TrendConfig {
        if (minDataPoints < 3) {
            throw ValidationException.invalidParameter("trend.min-data-points", minDataPoints, "a value >= 3");
        }
        if (!(alpha > 0 && alpha < 1)) {
            throw ValidationException.invalidParameter("trend.alpha", alpha, "a value in (0, 1)");
        }
        if (!(confidenceThreshold >= 0 && confidenceThreshold <= 1)) {
            throw ValidationException.invalidParameter(
                    "trend.confidence-threshold", confidenceThreshold, "a value in [0, 1]");
        }
        if (!(stableSlopeThreshold >= 0) || Double.isInfinite(stableSlopeThreshold)) {
            throw ValidationException.invalidParameter(
                    "trend.stable-slope-threshold", stableSlopeThreshold, "a finite value >= 0");
        }
        if (minSegmentLength < 3) {
            throw ValidationException.invalidParameter(
                    "trend.min-segment-length", minSegmentLength, "a value >= 3");
        }
        if (!(breakpointThreshold > 0) || Double.isInfinite(breakpointThreshold)) {
            throw ValidationException.invalidParameter(
                    "trend.breakpoint-threshold", breakpointThreshold, "a finite value > 0");
        }
        if (seasonalPeriod < 2) {
            throw ValidationException.invalidParameter("trend.seasonal-period", seasonalPeriod, "a value >= 2");
        }
    }
}
