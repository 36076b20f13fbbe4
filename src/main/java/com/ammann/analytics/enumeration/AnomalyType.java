package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shape of a flagged point relative to its neighbours.
 */
public enum AnomalyType
{
    /** Local maximum followed by a drop. */
    SPIKE("spike"),
    /** Local minimum followed by a rise. */
    DIP("dip"),
    /** Slope changes sign at the point. */
    TREND_BREAK("trend_break"),
    /** Correlation between metrics deviates from its baseline. */
    UNUSUAL_PATTERN("unusual_pattern"),
    /** Statistical outlier with no distinctive local shape. */
    OUTLIER("outlier");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }
}
