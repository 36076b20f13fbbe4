/* (C)2026 */
package com.ammann.analytics.config;

import com.ammann.analytics.enumeration.DetectionMethod;
import com.ammann.analytics.exception.ValidationException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings of the anomaly detector.
 *
 * <p>Higher {@code sensitivity} lowers every method's threshold, so more points
 * are flagged.
 *
 * @param adaptiveThreshold when {@code true}, severity is measured against the
 *                          sensitivity-adjusted threshold; otherwise against the
 *                          method's threshold at the reference sensitivity 0.5
 * @param randomSeed        seed for the isolation forest, {@code null} for a fresh seed per run
 * @param isolationTimeout  deadline for one isolation forest fit
 */
public record AnomalyDetectorConfig(
        double sensitivity,
        List<DetectionMethod> methods,
        int contextWindow,
        int minDataPoints,
        boolean adaptiveThreshold,
        int seasonalPeriod,
        int numTrees,
        int maxSampleSize,
        Long randomSeed,
        Duration isolationTimeout
) {
    public static final AnomalyDetectorConfig DEFAULT = new AnomalyDetectorConfig(
            0.5, List.of(DetectionMethod.ZSCORE, DetectionMethod.IQR), 10, 5, true, 7,
            100, 256, null, Duration.ofSeconds(30));

    public AnomalyDetectorConfig {
        if (!(sensitivity >= 0 && sensitivity <= 1)) {
            throw ValidationException.invalidParameter("anomaly.sensitivity", sensitivity, "a value in [0, 1]");
        }
        if (methods == null || methods.isEmpty() || methods.stream().anyMatch(Objects::isNull)) {
            throw ValidationException.invalidParameter("anomaly.methods", methods, "at least one detection method");
        }
        methods = List.copyOf(methods);
        if (contextWindow < 2) {
            throw ValidationException.invalidParameter("anomaly.context-window", contextWindow, "a value >= 2");
        }
        if (minDataPoints < 3) {
            throw ValidationException.invalidParameter("anomaly.min-data-points", minDataPoints, "a value >= 3");
        }
        if (seasonalPeriod < 2) {
            throw ValidationException.invalidParameter("anomaly.seasonal-period", seasonalPeriod, "a value >= 2");
        }
        if (numTrees < 1) {
            throw ValidationException.invalidParameter("anomaly.num-trees", numTrees, "a value >= 1");
        }
        if (maxSampleSize < 2) {
            throw ValidationException.invalidParameter("anomaly.max-sample-size", maxSampleSize, "a value >= 2");
        }
        if (isolationTimeout == null || isolationTimeout.isNegative() || isolationTimeout.isZero()) {
            throw ValidationException.invalidParameter(
                    "anomaly.isolation-timeout", isolationTimeout, "a positive duration");
        }
    }

    /** Copy with a different sensitivity. */
    public AnomalyDetectorConfig withSensitivity(double value) {
        return new AnomalyDetectorConfig(value, methods, contextWindow, minDataPoints, adaptiveThreshold,
                seasonalPeriod, numTrees, maxSampleSize, randomSeed, isolationTimeout);
    }

    /** Copy with different detection methods. */
    public AnomalyDetectorConfig withMethods(List<DetectionMethod> value) {
        return new AnomalyDetectorConfig(sensitivity, value, contextWindow, minDataPoints, adaptiveThreshold,
                seasonalPeriod, numTrees, maxSampleSize, randomSeed, isolationTimeout);
    }

    /** Copy with a fixed isolation forest seed. */
    public AnomalyDetectorConfig withRandomSeed(Long value) {
        return new AnomalyDetectorConfig(sensitivity, methods, contextWindow, minDataPoints, adaptiveThreshold,
                seasonalPeriod, numTrees, maxSampleSize, value, isolationTimeout);
    }

    /** Copy with a different isolation forest deadline. */
    public AnomalyDetectorConfig withIsolationTimeout(Duration value) {
        return new AnomalyDetectorConfig(sensitivity, methods, contextWindow, minDataPoints, adaptiveThreshold,
                seasonalPeriod, numTrees, maxSampleSize, randomSeed, value);
    }
}
