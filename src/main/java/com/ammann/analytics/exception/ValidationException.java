package com.ammann.analytics.exception;

/**
 * Exception indicating that a caller-supplied parameter, configuration value or
 * data point does not meet the constraints of the requested operation.
 *
 * <p>Configuration objects throw it from their constructors so invalid settings
 * fail before any computation starts. Provides factory methods for common
 * validation failure patterns.
 */
public class ValidationException extends AnalyticsException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for insufficient data.
     */
    public static ValidationException insufficientData(String resourceType, int required, int actual) {
        return new ValidationException(
                String.format("Insufficient %s: need at least %d, but got %d",
                        resourceType, required, actual));
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a NaN or infinite input value.
     */
    public static ValidationException nonFiniteValue(String seriesName, int index, double value) {
        return new ValidationException(
                String.format("Non-finite value %s at index %d of %s; clean the series before analysis",
                        value, index, seriesName));
    }
}
