package com.ammann.analytics.model;

/**
 * Reference values explaining why a point was flagged.
 *
 * @param expected   value the detector considered normal (mean, median or quartile)
 * @param deviation  signed distance of the point from {@code expected}, or past the fence
 * @param percentile rank of the value within the series, 0 to 100
 */
public record AnomalyContext(
        double expected,
        double deviation,
        double percentile
) {
}
