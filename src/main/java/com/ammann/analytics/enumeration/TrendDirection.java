package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a fitted or tested trend.
 */
public enum TrendDirection
{
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    /**
     * Classifies a signed quantity (slope or Mann-Kendall S) into a direction.
     *
     * @param signed the signed measure
     * @return {@link #STABLE} for zero, otherwise the matching direction
     */
    public static TrendDirection fromSign(double signed) {
        if (signed > 0) return INCREASING;
        if (signed < 0) return DECREASING;
        return STABLE;
    }

    @JsonValue
    public String getValue() { return value; }
}
