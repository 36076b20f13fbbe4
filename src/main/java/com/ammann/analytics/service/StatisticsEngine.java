/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.enumeration.CorrelationStrength;
import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.model.CorrelationResult;
import com.ammann.analytics.model.Quartiles;
import com.ammann.analytics.model.RegressionResult;
import com.ammann.analytics.model.SeasonalityProfile;
import com.ammann.analytics.model.SummaryStatistics;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.jboss.logging.Logger;

/**
 * Descriptive statistics over activity series.
 *
 * <p>All methods are pure functions of their arguments. Degenerate input (empty
 * arrays, constant series, mismatched lengths) yields neutral values such as
 * {@code 0}; no method returns NaN or infinity for finite input.
 *
 * <p>Dispersion measures use the population formula {@code sqrt(sum((x - mean)^2) / n)}.
 * Quartiles use linear interpolation between closest ranks (the R-7 estimator),
 * so {@code q2} always equals {@link #median(double[])}.
 */
@ApplicationScoped
public class StatisticsEngine {

    private static final Logger LOG = Logger.getLogger(StatisticsEngine.class);

    /** Tukey fence multiplier used by {@link #getSummary(double[])}. */
    public static final double DEFAULT_OUTLIER_MULTIPLIER = 1.5;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    /**
     * Rejects NaN and infinite values.
     *
     * @param seriesName name used in the error message
     * @param values     series to check
     * @throws ValidationException naming the first non-finite index
     */
    public static void requireFinite(String seriesName, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw ValidationException.nonFiniteValue(seriesName, i, values[i]);
            }
        }
    }

    public double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Median; the average of the two middle values for even-length input.
     */
    public double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 0
                ? (sorted[mid - 1] + sorted[mid]) / 2.0
                : sorted[mid];
    }

    /**
     * Most frequent value. Ties go to the value seen first.
     *
     * @return the mode, or empty when no value occurs more than once
     */
    public OptionalDouble mode(double[] values) {
        Map<Double, Integer> frequency = new LinkedHashMap<>();
        for (double v : values) {
            frequency.merge(v, 1, Integer::sum);
        }

        int maxFrequency = 0;
        double mode = 0.0;
        for (Map.Entry<Double, Integer> entry : frequency.entrySet()) {
            if (entry.getValue() > maxFrequency) {
                maxFrequency = entry.getValue();
                mode = entry.getKey();
            }
        }
        return maxFrequency > 1 ? OptionalDouble.of(mode) : OptionalDouble.empty();
    }

    public double variance(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    public double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    private static double sampleStandardDeviation(double[] values, double mean) {
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return Math.sqrt(sum / (values.length - 1));
    }

    /**
     * Quartiles by linear interpolation between closest ranks.
     */
    public Quartiles quartiles(double[] values) {
        if (values.length == 0) {
            return Quartiles.ZERO;
        }
        double[] sorted = sorted(values);
        return new Quartiles(
                quantileOfSorted(sorted, 0.25),
                median(values),
                quantileOfSorted(sorted, 0.75));
    }

    /**
     * Quantile {@code p} in [0, 1] by the R-7 estimator.
     */
    public double quantile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        if (!(p >= 0.0 && p <= 1.0)) {
            throw ValidationException.invalidParameter("p", p, "a value in [0, 1]");
        }
        return quantileOfSorted(sorted(values), p);
    }

    /**
     * Adjusted Fisher-Pearson skewness {@code G1}, standardized by the sample
     * standard deviation. Fewer than 3 points or zero variance yields 0.
     */
    public double skewness(double[] values) {
        int n = values.length;
        if (n < 3) {
            return 0.0;
        }
        double mean = mean(values);
        double sd = sampleStandardDeviation(values, mean);
        if (sd == 0.0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            double z = (v - mean) / sd;
            sum += z * z * z;
        }
        return ((double) n / ((n - 1.0) * (n - 2.0))) * sum;
    }

    /**
     * Sample excess kurtosis {@code G2}, standardized by the sample standard
     * deviation; a normal sample is close to 0. Fewer than 4 points or zero
     * variance yields 0.
     */
    public double kurtosis(double[] values) {
        int n = values.length;
        if (n < 4) {
            return 0.0;
        }
        double mean = mean(values);
        double sd = sampleStandardDeviation(values, mean);
        if (sd == 0.0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            double z = (v - mean) / sd;
            sum += z * z * z * z;
        }
        double factor1 = (n * (n + 1.0)) / ((n - 1.0) * (n - 2.0) * (n - 3.0));
        double factor2 = (3.0 * (n - 1.0) * (n - 1.0)) / ((n - 2.0) * (n - 3.0));
        return factor1 * sum - factor2;
    }

    /**
     * Values outside the Tukey fences {@code [q1 - k*iqr, q3 + k*iqr]}, in input order.
     *
     * @param multiplier fence multiplier {@code k}
     */
    public List<Double> detectOutliers(double[] values, double multiplier) {
        List<Double> outliers = new ArrayList<>();
        if (values.length == 0) {
            return outliers;
        }
        Quartiles q = quartiles(values);
        double lower = q.q1() - multiplier * q.iqr();
        double upper = q.q3() + multiplier * q.iqr();
        for (double v : values) {
            if (v < lower || v > upper) {
                outliers.add(v);
            }
        }
        return outliers;
    }

    /**
     * Ordinary least squares fit of {@code y} on {@code x}.
     *
     * <p>Empty or mismatched input yields {@link RegressionResult#empty()}. When
     * {@code x} is constant the slope and R-squared are 0 and the line passes
     * through the mean of {@code y}.
     */
    public RegressionResult linearRegression(double[] x, double[] y) {
        if (x.length != y.length || x.length == 0) {
            return RegressionResult.empty();
        }
        int n = x.length;
        double meanX = mean(x);
        double meanY = mean(y);

        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            numerator += (x[i] - meanX) * (y[i] - meanY);
            denominator += (x[i] - meanX) * (x[i] - meanX);
        }

        double slope = denominator != 0.0 ? numerator / denominator : 0.0;
        double intercept = meanY - slope * meanX;

        double[] predictions = new double[n];
        double[] residuals = new double[n];
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            predictions[i] = slope * x[i] + intercept;
            residuals[i] = y[i] - predictions[i];
            ssRes += residuals[i] * residuals[i];
            ssTot += (y[i] - meanY) * (y[i] - meanY);
        }

        double rSquared = (denominator != 0.0 && ssTot != 0.0) ? clamp01(1.0 - ssRes / ssTot) : 0.0;
        return new RegressionResult(slope, intercept, rSquared, predictions, residuals);
    }

    /**
     * Regression of {@code values} against their index {@code 0..n-1}.
     */
    public RegressionResult linearRegression(double[] values) {
        return linearRegression(indices(values.length), values);
    }

    /**
     * Pearson correlation coefficient; 0 on length mismatch, fewer than 2 points
     * or zero variance in either series.
     */
    public double correlation(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            return 0.0;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0.0;
        double sxx = 0.0;
        double syy = 0.0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0.0 || syy == 0.0) {
            return 0.0;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Pearson correlation with strength, direction and a two-sided p-value
     * from Student's t with {@code n - 2} degrees of freedom.
     */
    public CorrelationResult correlationTest(double[] x, double[] y) {
        double r = correlation(x, y);
        if (r == 0.0) {
            return CorrelationResult.none();
        }
        int n = x.length;
        double pValue;
        if (n < 3) {
            pValue = 1.0;
        } else if (Math.abs(r) >= 1.0) {
            pValue = 0.0;
        } else {
            double t = r * Math.sqrt((n - 2.0) / (1.0 - r * r));
            TDistribution distribution = new TDistribution(n - 2.0);
            pValue = clamp01(2.0 * (1.0 - distribution.cumulativeProbability(Math.abs(t))));
        }
        return new CorrelationResult(
                r, pValue, CorrelationStrength.fromCoefficient(r), CorrelationResult.Direction.fromCoefficient(r));
    }

    /**
     * Aggregates every descriptive measure. Empty input yields
     * {@link SummaryStatistics#empty()}.
     *
     * @throws ValidationException if a value is NaN or infinite
     */
    public SummaryStatistics getSummary(double[] values) {
        if (values.length == 0) {
            return SummaryStatistics.empty();
        }
        requireFinite("values", values);

        Quartiles q = quartiles(values);
        double min = Arrays.stream(values).min().orElse(0.0);
        double max = Arrays.stream(values).max().orElse(0.0);
        OptionalDouble mode = mode(values);
        double variance = variance(values);

        SummaryStatistics summary = new SummaryStatistics(
                values.length,
                mean(values),
                q.q2(),
                mode.isPresent() ? mode.getAsDouble() : null,
                Math.sqrt(variance),
                variance,
                min,
                max,
                max - min,
                q,
                q.iqr(),
                detectOutliers(values, DEFAULT_OUTLIER_MULTIPLIER),
                skewness(values),
                kurtosis(values));

        LOG.debugf("Summary computed over %d values: mean=%.4f, sd=%.4f, %d outliers",
                values.length, summary.mean(), summary.standardDeviation(), summary.outliers().size());
        return summary;
    }

    /**
     * Trailing moving averages; element {@code i} is the mean of
     * {@code values[i .. i + window - 1]}. A window longer than the series is
     * shortened to the series length.
     */
    public double[] movingAverage(double[] values, int window) {
        if (values.length == 0 || window <= 0) {
            return new double[0];
        }
        int w = Math.min(window, values.length);
        double[] result = new double[values.length - w + 1];
        double sum = 0.0;
        for (int i = 0; i < w; i++) {
            sum += values[i];
        }
        result[0] = sum / w;
        for (int i = w; i < values.length; i++) {
            sum += values[i] - values[i - w];
            result[i - w + 1] = sum / w;
        }
        return result;
    }

    /**
     * Simple exponential smoothing seeded with the first value.
     *
     * @param alpha smoothing factor in [0, 1]
     */
    public double[] exponentialSmoothing(double[] values, double alpha) {
        if (!(alpha >= 0.0 && alpha <= 1.0)) {
            throw ValidationException.invalidParameter("alpha", alpha, "a value in [0, 1]");
        }
        if (values.length == 0) {
            return new double[0];
        }
        double[] result = new double[values.length];
        result[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            result[i] = alpha * values[i] + (1.0 - alpha) * result[i - 1];
        }
        return result;
    }

    /** Standard score; 0 when {@code standardDeviation} is 0. */
    public double zScore(double value, double mean, double standardDeviation) {
        return standardDeviation == 0.0 ? 0.0 : (value - mean) / standardDeviation;
    }

    /**
     * Min-max scaling into [0, 1]. A constant series maps to 0.5.
     */
    public double[] normalize(double[] values) {
        if (values.length == 0) {
            return new double[0];
        }
        double min = Arrays.stream(values).min().orElse(0.0);
        double range = Arrays.stream(values).max().orElse(0.0) - min;
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = range == 0.0 ? 0.5 : (values[i] - min) / range;
        }
        return result;
    }

    /**
     * Standard scores of every value. A constant series maps to 0.
     */
    public double[] standardize(double[] values) {
        double mean = mean(values);
        double sd = standardDeviation(values);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = zScore(values[i], mean, sd);
        }
        return result;
    }

    /**
     * Percentage of values strictly below {@code value}, 0 to 100. A value above
     * every element ranks 100.
     */
    public double percentileRank(double value, double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] >= value) {
                return (double) i / sorted.length * 100.0;
            }
        }
        return 100.0;
    }

    /**
     * Seasonality check on the linearly detrended series. The pattern is the
     * mean detrended value per position in the period; strength is the pattern
     * variance over the detrended variance. Series shorter than two periods
     * have no seasonality.
     */
    public SeasonalityProfile detectSeasonality(double[] values, int period) {
        if (period < 2) {
            throw ValidationException.invalidParameter("period", period, "a value >= 2");
        }
        if (values.length < period * 2) {
            return SeasonalityProfile.none(period);
        }

        RegressionResult fit = linearRegression(values);
        double[] detrended = fit.residuals();

        int cycles = detrended.length / period;
        double[] pattern = new double[period];
        for (int position = 0; position < period; position++) {
            double sum = 0.0;
            for (int cycle = 0; cycle < cycles; cycle++) {
                sum += detrended[cycle * period + position];
            }
            pattern[position] = sum / cycles;
        }

        double totalVariance = variance(detrended);
        double strength = totalVariance > 0.0 ? clamp01(variance(pattern) / totalVariance) : 0.0;
        return new SeasonalityProfile(period, strength > 0.1, strength, pattern);
    }

    /** Standard normal cumulative distribution function. */
    public double normalCdf(double z) {
        return STANDARD_NORMAL.cumulativeProbability(z);
    }

    /**
     * Two-sided critical value of the standard normal, e.g. 1.96 for 0.95.
     *
     * @param level coverage in (0, 1)
     */
    public double zForConfidence(double level) {
        if (!(level > 0.0 && level < 1.0)) {
            throw ValidationException.invalidParameter("confidence", level, "a value in (0, 1)");
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - level) / 2.0);
    }

    static double[] indices(int n) {
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = i;
        }
        return x;
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    private static double quantileOfSorted(double[] sorted, double p) {
        double h = (sorted.length - 1) * p;
        int lo = (int) Math.floor(h);
        int hi = Math.min(lo + 1, sorted.length - 1);
        return sorted[lo] + (h - lo) * (sorted[hi] - sorted[lo]);
    }
}
