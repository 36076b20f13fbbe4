package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.TrendDirection;

/**
 * Index where the local mean shifts between two adjacent windows.
 *
 * @param magnitude t-statistic of the shift
 * @param direction {@code INCREASING} when the right window has the higher mean
 */
public record ChangePoint(
        int index,
        double value,
        double magnitude,
        TrendDirection direction
) {
}
