package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.CorrelationStrength;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pearson correlation with a two-sided significance test.
 *
 * @param pValue probability of observing |r| this large under no correlation
 *               (Student's t with n - 2 degrees of freedom)
 */
public record CorrelationResult(
        double correlation,
        double pValue,
        CorrelationStrength strength,
        Direction direction
) {
    public static CorrelationResult none() {
        return new CorrelationResult(0.0, 1.0, CorrelationStrength.NONE, Direction.NONE);
    }

    /** Sign of the correlation coefficient. */
    public enum Direction {
        POSITIVE("positive"),
        NEGATIVE("negative"),
        NONE("none");

        private final String value;

        Direction(String value) {
            this.value = value;
        }

        public static Direction fromCoefficient(double r) {
            if (r > 0) return POSITIVE;
            if (r < 0) return NEGATIVE;
            return NONE;
        }

        @JsonValue
        public String getValue() { return value; }
    }
}
