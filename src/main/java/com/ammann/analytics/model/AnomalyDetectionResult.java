package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.DetectionMethod;
import java.util.List;
import java.util.Map;

/**
 * Anomalies found in one series, ordered by index.
 *
 * @param confidence trust in the result set, in [0, 1]; zero for skipped runs
 */
public record AnomalyDetectionResult(
        List<Anomaly> anomalies,
        AnomalyStatistics statistics,
        double confidence
) {
    public AnomalyDetectionResult {
        anomalies = List.copyOf(anomalies);
    }

    /**
     * Result returned when the series is too short to analyse.
     *
     * @param methods configured methods
     */
    public static AnomalyDetectionResult empty(List<DetectionMethod> methods) {
        return new AnomalyDetectionResult(
                List.of(), new AnomalyStatistics(0, 0.0, List.copyOf(methods), Map.of()), 0.0);
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
