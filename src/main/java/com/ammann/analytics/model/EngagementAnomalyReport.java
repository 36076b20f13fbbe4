package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.EngagementMetric;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-metric and cross-metric anomaly results of an engagement scan.
 *
 * @param crossMetric {@code unusual_pattern} anomalies where the windowed
 *                    correlation between two metrics departs from its baseline
 */
public record EngagementAnomalyReport(
        Map<EngagementMetric, AnomalyDetectionResult> perMetric,
        AnomalyDetectionResult crossMetric
) {
    public EngagementAnomalyReport {
        perMetric = perMetric.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(perMetric));
    }

    public AnomalyDetectionResult forMetric(EngagementMetric metric) {
        return perMetric.get(metric);
    }
}
