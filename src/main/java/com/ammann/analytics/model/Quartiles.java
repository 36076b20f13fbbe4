package com.ammann.analytics.model;

/**
 * First, second and third quartile of a sample.
 */
public record Quartiles(
        double q1,
        double q2,
        double q3
) {
    public static final Quartiles ZERO = new Quartiles(0.0, 0.0, 0.0);

    /** Interquartile range {@code q3 - q1}. */
    public double iqr() {
        return q3 - q1;
    }
}
