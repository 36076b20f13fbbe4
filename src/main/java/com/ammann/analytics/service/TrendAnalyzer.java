/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.config.TrendConfig;
import com.ammann.analytics.enumeration.TrendDirection;
import com.ammann.analytics.enumeration.TrendMethod;
import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.model.ChangePoint;
import com.ammann.analytics.model.RegressionResult;
import com.ammann.analytics.model.SeasonalDecomposition;
import com.ammann.analytics.model.SeasonalityProfile;
import com.ammann.analytics.model.TimeSeriesPoint;
import com.ammann.analytics.model.TrendResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.jboss.logging.Logger;

/**
 * Trend classification, monotonic trend testing, additive seasonal decomposition
 * and regime change detection for activity series.
 *
 * <p>Series shorter than {@link TrendConfig#minDataPoints()} produce neutral
 * "insufficient data" results instead of exceptions. NaN and infinite values
 * are rejected with a {@link ValidationException}.
 */
@ApplicationScoped
public class TrendAnalyzer {

    private static final Logger LOG = Logger.getLogger(TrendAnalyzer.class);

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    /** Half-width of the sliding windows compared by {@link #detectChangePoints(double[], double)}. */
    static final int CHANGE_POINT_WINDOW = 7;

    /** Relative floor of the residual variance in the structural-change test. */
    private static final double RESIDUAL_VARIANCE_FLOOR = 1e-8;

    private final StatisticsEngine statistics;
    private final TrendConfig config;

    @Inject
    public TrendAnalyzer(StatisticsEngine statistics, TrendConfig config) {
        this.statistics = statistics;
        this.config = config;
    }

    public TrendConfig getConfig() {
        return config;
    }

    /**
     * Fits a least-squares line through the series and classifies its direction.
     *
     * <p>The regressor is the index, or the elapsed days since the first
     * timestamp when timestamps are supplied for every value. The slope is
     * normalized by {@code |mean|}; a normalized slope below
     * {@link TrendConfig#stableSlopeThreshold()} is {@code stable}. Confidence is
     * the R-squared of the fit.
     *
     * @param values     series values
     * @param timestamps optional timestamps aligned with {@code values}
     * @return regression trend result
     */
    public TrendResult analyzeTrend(double[] values, List<Instant> timestamps) {
        StatisticsEngine.requireFinite("values", values);
        if (values.length < config.minDataPoints()) {
            LOG.debugf(
                    "Trend analysis skipped: %d points, need %d",
                    values.length, config.minDataPoints());
            return TrendResult.insufficientData(TrendMethod.LINEAR_REGRESSION);
        }

        double[] x = regressor(values.length, timestamps);
        RegressionResult fit = statistics.linearRegression(x, values);

        double mean = statistics.mean(values);
        double normalizedSlope = fit.slope() / (mean != 0.0 ? Math.abs(mean) : 1.0);
        TrendDirection direction =
                Math.abs(normalizedSlope) < config.stableSlopeThreshold()
                        ? TrendDirection.STABLE
                        : TrendDirection.fromSign(normalizedSlope);

        double confidence = StatisticsEngine.clamp01(fit.rSquared());
        double first = values[0];
        double last = values[values.length - 1];
        double changePercent = first != 0.0 ? (last - first) / Math.abs(first) * 100.0 : 0.0;

        TrendResult result =
                new TrendResult(
                        TrendMethod.LINEAR_REGRESSION,
                        direction,
                        fit.slope(),
                        fit.rSquared(),
                        null,
                        null,
                        confidence,
                        confidence > config.confidenceThreshold(),
                        null,
                        changePercent,
                        volatility(values),
                        false);

        LOG.debugf(
                "Trend over %d points: %s (slope=%.4f, r2=%.4f)",
                values.length, direction.getValue(), fit.slope(), fit.rSquared());
        return result;
    }

    public TrendResult analyzeTrend(double[] values) {
        return analyzeTrend(values, null);
    }

    /**
     * Convenience overload of {@link #analyzeTrend(double[], List)} for point lists.
     */
    public TrendResult analyzeTimeSeries(List<TimeSeriesPoint> points) {
        return analyzeTrend(TimeSeriesPoint.values(points), TimeSeriesPoint.timestamps(points));
    }

    /**
     * Mann-Kendall test for a monotonic trend.
     *
     * <p>{@code S} counts concordant minus discordant pairs. Its variance uses
     * the classical tie correction
     * {@code [n(n-1)(2n+5) - sum t(t-1)(2t+5)] / 18} over groups of tied values,
     * {@code Z} applies a continuity correction of one, and the two-sided p-value is
     * {@code 2(1 - Phi(|Z|))}. The direction follows the sign of {@code S}.
     *
     * @param values series values
     * @return test result with statistic {@code S} and p-value
     */
    public TrendResult mannKendallTest(double[] values) {
        StatisticsEngine.requireFinite("values", values);
        int n = values.length;
        if (n < config.minDataPoints()) {
            LOG.debugf("Mann-Kendall skipped: %d points, need %d", n, config.minDataPoints());
            return TrendResult.insufficientData(TrendMethod.MANN_KENDALL);
        }

        long s = 0;
        for (int i = 0; i < n - 1; i++) {
            for (int j = i + 1; j < n; j++) {
                s += Long.signum(Double.compare(values[j], values[i]));
            }
        }

        double variance = (n * (n - 1.0) * (2.0 * n + 5.0) - tieCorrection(values)) / 18.0;
        double z = 0.0;
        if (variance > 0.0) {
            if (s > 0) {
                z = (s - 1) / Math.sqrt(variance);
            } else if (s < 0) {
                z = (s + 1) / Math.sqrt(variance);
            }
        }

        double pValue = StatisticsEngine.clamp01(2.0 * (1.0 - statistics.normalCdf(Math.abs(z))));
        TrendDirection direction = TrendDirection.fromSign(s);

        LOG.debugf("Mann-Kendall over %d points: S=%d, Z=%.4f, p=%.6f", n, s, z, pValue);
        return new TrendResult(
                TrendMethod.MANN_KENDALL,
                direction,
                null,
                null,
                (double) s,
                pValue,
                1.0 - pValue,
                pValue < config.alpha(),
                null,
                null,
                null,
                false);
    }

    /**
     * Additive decomposition {@code value = trend + seasonal + residual}.
     *
     * <p>The trend is a centered moving average spanning one period; even
     * periods use the 2 x period average whose end points carry half weight.
     * Windows shrink at the series edges. The seasonal pattern is the mean
     * detrended value per position {@code i mod period}, shifted to sum to zero.
     * Series shorter than two periods return the raw series as trend with zero
     * seasonal and residual components.
     *
     * @param series values to decompose
     * @param period season length, at least 2
     * @return decomposition with trend and seasonal strength
     * @throws ValidationException if {@code period < 2} or a value is not finite
     */
    public SeasonalDecomposition seasonalDecomposition(double[] series, int period) {
        if (period < 2) {
            throw ValidationException.invalidParameter("period", period, "a value >= 2");
        }
        StatisticsEngine.requireFinite("series", series);
        int n = series.length;
        if (n < period * 2) {
            LOG.debugf("Decomposition skipped: %d points, need two periods of %d", n, period);
            return new SeasonalDecomposition(
                    period,
                    series.clone(),
                    new double[n],
                    new double[n],
                    new double[period],
                    0.0,
                    0.0,
                    false);
        }

        double[] trend = centeredMovingAverage(series, period);

        double[] pattern = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < n; i++) {
            pattern[i % period] += series[i] - trend[i];
            counts[i % period]++;
        }
        for (int p = 0; p < period; p++) {
            pattern[p] /= counts[p];
        }
        double patternMean = statistics.mean(pattern);
        for (int p = 0; p < period; p++) {
            pattern[p] -= patternMean;
        }

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        double[] trendPlusResidual = new double[n];
        double[] seasonalPlusResidual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = pattern[i % period];
            residual[i] = series[i] - trend[i] - seasonal[i];
            trendPlusResidual[i] = trend[i] + residual[i];
            seasonalPlusResidual[i] = seasonal[i] + residual[i];
        }

        double residualVariance = statistics.variance(residual);
        double trendStrength = strength(residualVariance, statistics.variance(trendPlusResidual));
        double seasonalStrength =
                strength(residualVariance, statistics.variance(seasonalPlusResidual));

        LOG.debugf(
                "Decomposed %d points with period %d: trend strength %.3f, seasonal strength %.3f",
                n, period, trendStrength, seasonalStrength);
        return new SeasonalDecomposition(
                period, trend, seasonal, residual, pattern, trendStrength, seasonalStrength, true);
    }

    public SeasonalDecomposition seasonalDecomposition(List<TimeSeriesPoint> points, int period) {
        return seasonalDecomposition(TimeSeriesPoint.values(points), period);
    }

    /**
     * Finds regime changes by binary segmentation.
     *
     * <p>Every segment is modelled by its own least-squares line. A candidate
     * split is scored with the Chow statistic
     * {@code ((SSE - SSE_left - SSE_right) / 2) / ((SSE_left + SSE_right) / (m - 4))},
     * so a jump in level or a change of slope scores high while a single
     * straight ramp does not. The best split is accepted when its score
     * exceeds {@link TrendConfig#breakpointThreshold()}; both sides are then
     * searched again. Each side keeps at least
     * {@link TrendConfig#minSegmentLength()} points.
     *
     * @param values series values
     * @return ascending indices of the first point of each new regime
     */
    public List<Integer> detectBreakpoints(double[] values) {
        StatisticsEngine.requireFinite("values", values);
        int minSegment = config.minSegmentLength();
        List<Integer> breakpoints = new ArrayList<>();
        if (values.length < minSegment * 2) {
            return List.of();
        }

        SegmentSums sums = new SegmentSums(values);
        double scale = statistics.variance(values) + Math.pow(statistics.mean(values), 2);
        double varianceFloor = Math.max(RESIDUAL_VARIANCE_FLOOR * scale, Double.MIN_NORMAL);

        segment(sums, 0, values.length, varianceFloor, breakpoints);
        breakpoints.sort(Integer::compareTo);

        LOG.debugf("Detected %d breakpoints in %d points: %s", breakpoints.size(), values.length, breakpoints);
        return List.copyOf(breakpoints);
    }

    /**
     * Returns a copy of {@code result} carrying the breakpoints of {@code values}.
     */
    public TrendResult withBreakpoints(TrendResult result, double[] values) {
        return result.withBreakpoints(detectBreakpoints(values));
    }

    /**
     * Sliding-window change points. At each index the windows before and after
     * are compared with a t-statistic on their means; indices above
     * {@code sensitivity} are kept and neighbours within one window merged into
     * the strongest.
     *
     * @param values      series values
     * @param sensitivity minimum t-statistic, for example 2
     * @return change points in ascending index order
     */
    public List<ChangePoint> detectChangePoints(double[] values, double sensitivity) {
        StatisticsEngine.requireFinite("values", values);
        List<ChangePoint> candidates = new ArrayList<>();
        if (values.length < 3) {
            return candidates;
        }

        int window = Math.min(CHANGE_POINT_WINDOW, values.length / 3);
        if (window < 1) {
            return candidates;
        }
        for (int i = window; i < values.length - window; i++) {
            double[] left = Arrays.copyOfRange(values, i - window, i);
            double[] right = Arrays.copyOfRange(values, i, i + window);

            double leftMean = statistics.mean(left);
            double rightMean = statistics.mean(right);
            double pooled =
                    Math.sqrt((statistics.variance(left) + statistics.variance(right)) / 2.0);
            double meanDiff = Math.abs(rightMean - leftMean);
            TrendDirection direction =
                    rightMean > leftMean ? TrendDirection.INCREASING : TrendDirection.DECREASING;

            if (pooled > 0.0) {
                double t = meanDiff / (pooled / Math.sqrt(window));
                if (t > sensitivity) {
                    candidates.add(new ChangePoint(i, values[i], t, direction));
                }
            } else if (meanDiff > 0.1) {
                candidates.add(new ChangePoint(i, values[i], meanDiff * 10.0, direction));
            }
        }
        return mergeNearby(candidates, window);
    }

    /**
     * Seasonality check of the point values with the configured period.
     */
    public SeasonalityProfile detectSeasonality(List<TimeSeriesPoint> points) {
        double[] values = TimeSeriesPoint.values(points);
        StatisticsEngine.requireFinite("values", values);
        return statistics.detectSeasonality(values, config.seasonalPeriod());
    }

    /**
     * Percentage change over {@code period} steps. Steps from a zero base yield 0.
     *
     * @return momentum values for indices {@code period .. n-1}; empty when the
     *     series is not longer than {@code period}
     */
    public double[] calculateMomentum(double[] values, int period) {
        if (period < 1) {
            throw ValidationException.invalidParameter("period", period, "a value >= 1");
        }
        if (values.length <= period) {
            return new double[0];
        }
        double[] momentum = new double[values.length - period];
        for (int i = period; i < values.length; i++) {
            double base = values[i - period];
            momentum[i - period] = base != 0.0 ? (values[i] - base) / Math.abs(base) * 100.0 : 0.0;
        }
        return momentum;
    }

    /**
     * Relative strength index with Wilder smoothing.
     *
     * @return RSI values in [0, 100] for indices {@code period .. n-1}; empty
     *     when fewer than {@code period + 1} values are given
     */
    public double[] calculateRsi(double[] values, int period) {
        if (period < 1) {
            throw ValidationException.invalidParameter("period", period, "a value >= 1");
        }
        if (values.length < period + 1) {
            return new double[0];
        }

        double gains = 0.0;
        double losses = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = values[i] - values[i - 1];
            if (change > 0) {
                gains += change;
            } else {
                losses -= change;
            }
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;

        double[] rsi = new double[values.length - period];
        rsi[0] = rsi(avgGain, avgLoss);
        for (int i = period + 1; i < values.length; i++) {
            double change = values[i] - values[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
            rsi[i - period] = rsi(avgGain, avgLoss);
        }
        return rsi;
    }

    private void segment(
            SegmentSums sums, int start, int end, double varianceFloor, List<Integer> breakpoints) {
        int minSegment = config.minSegmentLength();
        int length = end - start;
        if (length < minSegment * 2) {
            return;
        }

        double whole = sums.sse(start, end);
        double bestScore = 0.0;
        int bestSplit = -1;
        for (int split = start + minSegment; split <= end - minSegment; split++) {
            double left = sums.sse(start, split);
            double right = sums.sse(split, end);
            double residualVariance = Math.max((left + right) / Math.max(length - 4, 1), varianceFloor);
            double score = Math.max(whole - left - right, 0.0) / 2.0 / residualVariance;
            if (score > bestScore) {
                bestScore = score;
                bestSplit = split;
            }
        }

        if (bestSplit < 0 || bestScore <= config.breakpointThreshold()) {
            return;
        }
        breakpoints.add(bestSplit);
        segment(sums, start, bestSplit, varianceFloor, breakpoints);
        segment(sums, bestSplit, end, varianceFloor, breakpoints);
    }

    private double[] regressor(int n, List<Instant> timestamps) {
        if (timestamps == null || timestamps.size() != n || timestamps.stream().anyMatch(Objects::isNull)) {
            return StatisticsEngine.indices(n);
        }
        Instant origin = timestamps.get(0);
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = Duration.between(origin, timestamps.get(i)).toMillis() / MILLIS_PER_DAY;
        }
        // identical timestamps carry no spacing information
        return x[n - 1] == x[0] ? StatisticsEngine.indices(n) : x;
    }

    private double volatility(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double[] returns = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            returns[i - 1] = previous != 0.0 ? (values[i] - previous) / Math.abs(previous) : 0.0;
        }
        return statistics.standardDeviation(returns);
    }

    private static double tieCorrection(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double correction = 0.0;
        int run = 1;
        for (int i = 1; i <= sorted.length; i++) {
            if (i < sorted.length && sorted[i] == sorted[i - 1]) {
                run++;
            } else {
                if (run > 1) {
                    correction += run * (run - 1.0) * (2.0 * run + 5.0);
                }
                run = 1;
            }
        }
        return correction;
    }

    private static double[] centeredMovingAverage(double[] values, int period) {
        int n = values.length;
        int half = period / 2;
        boolean even = period % 2 == 0;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            double weight = 0.0;
            for (int j = Math.max(0, i - half); j <= Math.min(n - 1, i + half); j++) {
                double w = even && Math.abs(j - i) == half ? 0.5 : 1.0;
                sum += w * values[j];
                weight += w;
            }
            result[i] = sum / weight;
        }
        return result;
    }

    private static double strength(double residualVariance, double componentVariance) {
        if (componentVariance <= 0.0) {
            return 0.0;
        }
        return StatisticsEngine.clamp01(1.0 - residualVariance / componentVariance);
    }

    private static double rsi(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        return 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
    }

    private static List<ChangePoint> mergeNearby(List<ChangePoint> candidates, int window) {
        if (candidates.size() <= 1) {
            return candidates;
        }
        List<ChangePoint> merged = new ArrayList<>();
        ChangePoint current = candidates.get(0);
        for (int i = 1; i < candidates.size(); i++) {
            ChangePoint next = candidates.get(i);
            if (next.index() - current.index() <= window) {
                if (next.magnitude() > current.magnitude()) {
                    current = next;
                }
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return merged;
    }

    /** Prefix sums for O(1) least-squares residuals of any index range. */
    private static final class SegmentSums {
        private final double[] y;
        private final double[] yy;
        private final double[] xy;

        SegmentSums(double[] values) {
            int n = values.length;
            y = new double[n + 1];
            yy = new double[n + 1];
            xy = new double[n + 1];
            for (int i = 0; i < n; i++) {
                y[i + 1] = y[i] + values[i];
                yy[i + 1] = yy[i] + values[i] * values[i];
                xy[i + 1] = xy[i] + i * values[i];
            }
        }

        /** Residual sum of squares of the line fitted to {@code [start, end)}. */
        double sse(int start, int end) {
            double m = end - start;
            if (m < 2) {
                return 0.0;
            }
            double sumX = (start + end - 1.0) * m / 2.0;
            double sumXX = sumSquares(end - 1) - sumSquares(start - 1);
            double sumY = y[end] - y[start];
            double sumYY = yy[end] - yy[start];
            double sumXY = xy[end] - xy[start];

            double sxx = sumXX - sumX * sumX / m;
            double syy = sumYY - sumY * sumY / m;
            double sxy = sumXY - sumX * sumY / m;
            return Math.max(syy - (sxx > 0.0 ? sxy * sxy / sxx : 0.0), 0.0);
        }

        private static double sumSquares(int k) {
            return k < 0 ? 0.0 : k * (k + 1.0) * (2.0 * k + 1.0) / 6.0;
        }
    }
}
