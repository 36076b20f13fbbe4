package com.ammann.analytics.enumeration;

import com.ammann.analytics.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Anomaly detection methods supported by the detector.
 */
public enum DetectionMethod
{
    ZSCORE("zscore"),
    IQR("iqr"),
    ISOLATION_FOREST("isolation_forest"),
    MAD("mad"),
    ENSEMBLE("ensemble");

    /** Methods the ensemble votes across. */
    public static final List<DetectionMethod> ENSEMBLE_MEMBERS = List.of(ZSCORE, IQR, MAD);

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    /**
     * Parses a method name as written in configuration ({@code zscore},
     * {@code isolation_forest}, ...). Matching is case-insensitive.
     *
     * @param value configured method name
     * @return the matching method
     * @throws ValidationException if the name is unknown
     */
    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase().replace('-', '_');
            for (DetectionMethod method : values()) {
                if (method.value.equals(normalized)) {
                    return method;
                }
            }
        }
        throw ValidationException.invalidParameter(
                "methods", value, "one of zscore, iqr, isolation_forest, mad, ensemble");
    }

    @JsonValue
    public String getValue() { return value; }
}
