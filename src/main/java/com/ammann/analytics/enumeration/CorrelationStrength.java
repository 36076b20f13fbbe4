package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative strength of a Pearson correlation coefficient.
 */
public enum CorrelationStrength
{
    STRONG("strong", 0.7),
    MODERATE("moderate", 0.4),
    WEAK("weak", 0.2),
    NONE("none", 0.0);

    private final String value;
    private final double threshold;

    CorrelationStrength(String value, double threshold) {
        this.value = value;
        this.threshold = threshold;
    }

    public static CorrelationStrength fromCoefficient(double r) {
        double abs = Math.abs(r);
        if (abs >= STRONG.threshold) return STRONG;
        if (abs >= MODERATE.threshold) return MODERATE;
        if (abs >= WEAK.threshold) return WEAK;
        return NONE;
    }

    @JsonValue
    public String getValue() { return value; }
}
