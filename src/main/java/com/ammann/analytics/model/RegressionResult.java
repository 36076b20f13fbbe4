package com.ammann.analytics.model;

/**
 * Ordinary least squares fit {@code y = slope * x + intercept}.
 *
 * @param predictions fitted values for every input x
 * @param residuals   {@code y - prediction} for every input pair
 */
public record RegressionResult(
        double slope,
        double intercept,
        double rSquared,
        double[] predictions,
        double[] residuals
) {
    public RegressionResult {
        predictions = predictions.clone();
        residuals = residuals.clone();
    }

    public static RegressionResult empty() {
        return new RegressionResult(0.0, 0.0, 0.0, new double[0], new double[0]);
    }

    @Override
    public double[] predictions() {
        return predictions.clone();
    }

    @Override
    public double[] residuals() {
        return residuals.clone();
    }

    /** Evaluates the fitted line at {@code x}. */
    public double predict(double x) {
        return slope * x + intercept;
    }
}
