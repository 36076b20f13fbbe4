package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Statistical method that produced a {@link com.ammann.analytics.model.TrendResult}.
 */
public enum TrendMethod
{
    LINEAR_REGRESSION("linear_regression"),
    MANN_KENDALL("mann_kendall");

    private final String value;

    TrendMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }
}
