package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.DetectionMethod;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run statistics of an anomaly detection pass.
 *
 * @param thresholds threshold applied by each method, keyed by method name
 */
public record AnomalyStatistics(
        int totalPoints,
        double anomalyRate,
        List<DetectionMethod> methods,
        Map<String, Double> thresholds
) {
    public AnomalyStatistics {
        methods = List.copyOf(methods);
        thresholds = Collections.unmodifiableMap(new LinkedHashMap<>(thresholds));
    }
}
