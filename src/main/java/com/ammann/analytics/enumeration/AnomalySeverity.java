package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity bucket of an anomaly, derived from how far its score exceeds the
 * detection threshold.
 *
 * <p>Each level defines an exclusive upper bound on the score-to-threshold ratio.
 * A ratio is classified into the first level whose bound it stays below.
 */
public enum AnomalySeverity
{
    /** Ratio below 1.5. */
    LOW("low", 1.5, 1),
    /** Ratio below 2.5. */
    MEDIUM("medium", 2.5, 2),
    /** Ratio below 4.0. */
    HIGH("high", 4.0, 3),
    /** Ratio of 4.0 or above. */
    CRITICAL("critical", Double.POSITIVE_INFINITY, 4);

    private final String value;
    private final double upperRatio;
    private final int weight;

    AnomalySeverity(String value, double upperRatio, int weight) {
        this.value = value;
        this.upperRatio = upperRatio;
        this.weight = weight;
    }

    /**
     * Returns the severity for a detection score measured against its threshold.
     * A non-positive threshold yields {@link #LOW}.
     *
     * @param score     detection score
     * @param threshold threshold the score was compared against
     * @return severity bucket
     */
    public static AnomalySeverity fromScore(double score, double threshold) {
        if (!(threshold > 0) || !Double.isFinite(score)) return LOW;
        double ratio = Math.abs(score) / threshold;
        if (ratio < LOW.upperRatio) return LOW;
        if (ratio < MEDIUM.upperRatio) return MEDIUM;
        if (ratio < HIGH.upperRatio) return HIGH;
        return CRITICAL;
    }

    @JsonValue
    public String getValue() { return value; }

    /** Weight used by the confidence calculation, 1 (low) to 4 (critical). */
    public int getWeight() { return weight; }
}
