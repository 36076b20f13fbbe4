/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.config.ForecastConfig;
import com.ammann.analytics.enumeration.ForecastModel;
import com.ammann.analytics.model.AccuracyMetrics;
import com.ammann.analytics.model.ForecastPoint;
import com.ammann.analytics.model.ForecastResult;
import com.ammann.analytics.model.ModelAccuracy;
import com.ammann.analytics.model.RegressionResult;
import com.ammann.analytics.model.SeasonalDecomposition;
import com.ammann.analytics.model.SeriesCharacteristics;
import com.ammann.analytics.model.TimeSeriesPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Point forecasts with prediction intervals for activity series.
 *
 * <p>Every model yields exactly {@code horizon} points. The interval half-width
 * is {@code z * sigma * g(h)} where {@code z} is the two-sided normal quantile of
 * the configured confidence, {@code sigma} the standard deviation of the
 * in-sample residuals (at least {@value #MIN_STANDARD_ERROR}) and {@code g} a
 * model-specific factor that never shrinks with the distance {@code h}.
 *
 * <p>When a series is shorter than the chosen model needs, the engine falls back
 * to {@link ForecastModel#LINEAR} and records the requested model in
 * {@link ForecastResult#fallbackFrom()}. Fewer than two points yield an empty
 * forecast.
 */
@ApplicationScoped
public class ForecastingEngine {

    private static final Logger LOG = Logger.getLogger(ForecastingEngine.class);

    static final double MIN_STANDARD_ERROR = 0.01;

    /** Points used to estimate the recent trend of smoothed series. */
    static final int RECENT_TREND_POINTS = 5;

    private static final Duration DEFAULT_SPACING = Duration.ofDays(1);

    private final StatisticsEngine statistics;
    private final TrendAnalyzer trendAnalyzer;
    private final ModelSelector modelSelector;
    private final ForecastConfig config;

    @Inject
    public ForecastingEngine(
            StatisticsEngine statistics,
            TrendAnalyzer trendAnalyzer,
            ModelSelector modelSelector,
            ForecastConfig config) {
        this.statistics = statistics;
        this.trendAnalyzer = trendAnalyzer;
        this.modelSelector = modelSelector;
        this.config = config;
    }

    public ForecastConfig getConfig() {
        return config;
    }

    public ForecastResult forecast(double[] values) {
        return forecast(values, null, config);
    }

    public ForecastResult forecast(double[] values, List<Instant> timestamps) {
        return forecast(values, timestamps, config);
    }

    /**
     * Forecasts {@code runConfig.horizon()} steps past the end of the series.
     *
     * <p>Hold-out accuracy is attached when the series is longer than twice
     * the horizon: the model is refitted on the first {@code splitRatio} of the
     * series and scored against the rest.
     *
     * @param values     series values
     * @param timestamps optional timestamps, extrapolated with their average spacing
     * @param runConfig  settings for this call
     * @return the forecast
     * @throws com.ammann.analytics.exception.ValidationException if a value is not finite
     */
    public ForecastResult forecast(double[] values, List<Instant> timestamps, ForecastConfig runConfig) {
        StatisticsEngine.requireFinite("values", values);
        if (values.length < 2) {
            LOG.warnf("Forecast skipped: %d points, need at least 2", values.length);
            return ForecastResult.empty(ForecastModel.LINEAR);
        }

        ForecastModel requested = resolveModel(values, runConfig);
        ForecastModel model = applicable(requested, values.length, runConfig.seasonalPeriod());
        if (model != requested) {
            LOG.warnf(
                    "Series of %d points too short for %s (needs %d), falling back to %s",
                    values.length,
                    requested.getValue(),
                    requested.minimumLength(runConfig.seasonalPeriod()),
                    model.getValue());
        }

        Projection projection = project(model, values, runConfig.horizon(), runConfig);
        double sigma = Math.max(statistics.standardDeviation(projection.residuals()), MIN_STANDARD_ERROR);
        double z = statistics.zForConfidence(runConfig.confidence());

        List<ForecastPoint> points = new ArrayList<>(runConfig.horizon());
        for (int h = 0; h < runConfig.horizon(); h++) {
            double value = projection.values()[h];
            double margin = z * sigma * projection.growth()[h];
            points.add(new ForecastPoint(
                    values.length + h,
                    extrapolate(timestamps, values.length, h),
                    value,
                    value - margin,
                    value + margin));
        }

        ForecastResult result = new ForecastResult(
                model,
                List.copyOf(points),
                null,
                projection.parameters(),
                projection.residuals(),
                null);
        if (model != requested) {
            result = result.withFallbackFrom(requested);
        }

        if (values.length > runConfig.horizon() * 2) {
            result = result.withAccuracy(holdOutAccuracy(values, model, runConfig));
        }

        LOG.debugf(
                "Forecast %d steps with %s from %d points (sigma=%.4f)",
                runConfig.horizon(), model.getValue(), values.length, sigma);
        return result;
    }

    /**
     * Convenience overload of {@link #forecast(double[], List)} for point lists.
     */
    public ForecastResult forecastTimeSeries(List<TimeSeriesPoint> points) {
        return forecast(TimeSeriesPoint.values(points), TimeSeriesPoint.timestamps(points), config);
    }

    public List<ModelAccuracy> crossValidate(double[] values) {
        return crossValidate(values, config);
    }

    /**
     * Rolling-origin validation of every concrete model.
     *
     * <p>Fold {@code k} of {@code folds} trains on the series up to
     * {@code n - horizon * (folds - k)} and is scored on the following
     * {@code horizon} values. Folds whose training part is too short for a
     * model are skipped for that model; models without any usable fold are
     * left out.
     *
     * @param values    series values
     * @param runConfig settings for this call
     * @return one row per evaluated model, best (lowest RMSE) first
     */
    public List<ModelAccuracy> crossValidate(double[] values, ForecastConfig runConfig) {
        StatisticsEngine.requireFinite("values", values);
        long start = System.nanoTime();
        int horizon = runConfig.horizon();

        List<ModelAccuracy> rows = new ArrayList<>();
        for (ForecastModel model : ForecastModel.CANDIDATES) {
            int minimum = Math.max(2, model.minimumLength(runConfig.seasonalPeriod()));
            List<AccuracyMetrics> folds = new ArrayList<>();
            for (int k = 0; k < runConfig.folds(); k++) {
                int origin = values.length - horizon * (runConfig.folds() - k);
                if (origin < minimum) {
                    continue;
                }
                double[] train = Arrays.copyOfRange(values, 0, origin);
                double[] test = Arrays.copyOfRange(values, origin, origin + horizon);
                double[] predicted = project(model, train, horizon, runConfig).values();
                folds.add(calculateAccuracy(test, predicted));
            }
            if (!folds.isEmpty()) {
                rows.add(new ModelAccuracy(model, folds.size(), AccuracyMetrics.average(folds)));
            }
        }
        rows.sort(Comparator.comparingDouble(row -> row.accuracy().rmse()));

        if (rows.isEmpty()) {
            LOG.warnf("Cross-validation skipped: %d points are too few for horizon %d", values.length, horizon);
        } else {
            LOG.infof(
                    "Cross-validated %d models over %d points in %d ms, best: %s (rmse=%.4f)",
                    rows.size(),
                    values.length,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
                    rows.get(0).model().getValue(),
                    rows.get(0).accuracy().rmse());
        }
        return List.copyOf(rows);
    }

    /**
     * Error measures of {@code predicted} against {@code actual} over their
     * common length. MAPE skips zero actuals; SMAPE skips pairs that are both zero.
     */
    public AccuracyMetrics calculateAccuracy(double[] actual, double[] predicted) {
        int n = Math.min(actual.length, predicted.length);
        if (n == 0) {
            return AccuracyMetrics.zero();
        }

        double mae = 0.0;
        double mse = 0.0;
        double mape = 0.0;
        double smape = 0.0;
        for (int i = 0; i < n; i++) {
            double error = actual[i] - predicted[i];
            double absError = Math.abs(error);
            mae += absError;
            mse += error * error;
            if (actual[i] != 0.0) {
                mape += absError / Math.abs(actual[i]);
            }
            double denominator = Math.abs(actual[i]) + Math.abs(predicted[i]);
            if (denominator != 0.0) {
                smape += absError / (denominator / 2.0);
            }
        }
        mae /= n;
        mse /= n;
        mape = mape / n * 100.0;
        smape = smape / n * 100.0;

        double naive = 0.0;
        for (int i = 1; i < n; i++) {
            naive += Math.abs(actual[i] - actual[i - 1]);
        }
        naive = n > 1 ? naive / (n - 1) : 0.0;
        double mase = naive != 0.0 ? mae / naive : 0.0;

        double[] observed = Arrays.copyOf(actual, n);
        double meanActual = statistics.mean(observed);
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            ssTot += (actual[i] - meanActual) * (actual[i] - meanActual);
        }
        double r2 = ssTot != 0.0 ? 1.0 - ssRes / ssTot : 0.0;

        return new AccuracyMetrics(mae, mse, Math.sqrt(mse), mape, smape, mase, r2);
    }

    /**
     * Measures the inputs of the automatic model choice.
     */
    public SeriesCharacteristics characterize(double[] values, int seasonalPeriod) {
        double mean = statistics.mean(values);
        double dispersion = mean != 0.0 ? statistics.variance(values) / Math.abs(mean) : 0.0;
        double seasonal = statistics.detectSeasonality(values, seasonalPeriod).strength();
        double trend = values.length >= 2 ? statistics.linearRegression(values).rSquared() : 0.0;
        return new SeriesCharacteristics(values.length, dispersion, seasonal, trend);
    }

    /**
     * The configured model, or the {@link ModelSelector} choice when it is
     * {@link ForecastModel#AUTO}.
     */
    public ForecastModel resolveModel(double[] values, ForecastConfig runConfig) {
        if (runConfig.model() != ForecastModel.AUTO) {
            return runConfig.model();
        }
        return modelSelector.select(characterize(values, runConfig.seasonalPeriod()), runConfig.seasonalPeriod());
    }

    private AccuracyMetrics holdOutAccuracy(double[] values, ForecastModel model, ForecastConfig runConfig) {
        int trainSize = (int) Math.floor(values.length * runConfig.splitRatio());
        trainSize = Math.max(2, Math.min(trainSize, values.length - 1));
        double[] train = Arrays.copyOfRange(values, 0, trainSize);
        double[] test = Arrays.copyOfRange(values, trainSize, values.length);

        ForecastModel trainModel = applicable(model, train.length, runConfig.seasonalPeriod());
        double[] predicted = project(trainModel, train, test.length, runConfig).values();
        return calculateAccuracy(test, predicted);
    }

    private static ForecastModel applicable(ForecastModel model, int length, int seasonalPeriod) {
        return length < model.minimumLength(seasonalPeriod) ? ForecastModel.LINEAR : model;
    }

    private Projection project(ForecastModel model, double[] values, int horizon, ForecastConfig runConfig) {
        return switch (model) {
            case LINEAR, AUTO -> linear(values, horizon);
            case SEASONAL -> seasonal(values, horizon, runConfig.seasonalPeriod());
            case SMOOTHING -> smoothing(values, horizon, runConfig.alpha());
            case HOLT_WINTERS -> holtWinters(values, horizon, runConfig);
            case MOVING_AVERAGE -> movingAverage(values, horizon, runConfig.seasonalPeriod());
        };
    }

    /**
     * Least-squares line; the interval uses the textbook prediction factor
     * {@code sqrt(1 + 1/n + (x - mean(x))^2 / Sxx)}.
     */
    private Projection linear(double[] values, int horizon) {
        int n = values.length;
        RegressionResult fit = statistics.linearRegression(values);
        double meanX = (n - 1) / 2.0;
        double sxx = n * (n * (double) n - 1.0) / 12.0;

        double[] forecast = new double[horizon];
        double[] growth = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            double x = n + h;
            forecast[h] = fit.predict(x);
            growth[h] = Math.sqrt(1.0 + 1.0 / n + (x - meanX) * (x - meanX) / sxx);
        }
        return new Projection(forecast, growth, fit.residuals(), parameters(
                "slope", fit.slope(),
                "intercept", fit.intercept(),
                "rSquared", fit.rSquared()));
    }

    /**
     * Linear trend of the seasonally adjusted series plus the seasonal pattern
     * of {@link TrendAnalyzer#seasonalDecomposition(double[], int)}.
     */
    private Projection seasonal(double[] values, int horizon, int period) {
        int n = values.length;
        SeasonalDecomposition decomposition = trendAnalyzer.seasonalDecomposition(values, period);
        RegressionResult fit = statistics.linearRegression(decomposition.seasonallyAdjusted());
        double[] pattern = decomposition.pattern();

        double[] forecast = new double[horizon];
        double[] growth = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            forecast[h] = fit.predict(n + h) + pattern[(n + h) % period];
            growth[h] = Math.sqrt(1.0 + (double) h / period);
        }
        return new Projection(forecast, growth, fit.residuals(), parameters(
                "period", period,
                "trendSlope", fit.slope(),
                "seasonalStrength", decomposition.seasonalStrength()));
    }

    /**
     * Exponential smoothing continued with the slope of the last few smoothed values.
     */
    private Projection smoothing(double[] values, int horizon, double alpha) {
        double[] smoothed = statistics.exponentialSmoothing(values, alpha);
        double level = smoothed[smoothed.length - 1];
        double trend = recentSlope(smoothed);

        double[] residuals = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residuals[i] = values[i] - smoothed[i];
        }

        double[] forecast = new double[horizon];
        double[] growth = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            forecast[h] = level + trend * (h + 1);
            growth[h] = Math.sqrt(1.0 + alpha * (h + 1));
        }
        return new Projection(forecast, growth, residuals, parameters(
                "alpha", alpha,
                "initialLevel", smoothed[0],
                "finalLevel", level,
                "trend", trend));
    }

    /**
     * Additive Holt-Winters. The level starts from the mean of the first period,
     * the trend from the difference between the first two period means, and the
     * seasonal indices from the first period's deviations from that line.
     * Residuals are the one-step-ahead errors from the second period on.
     */
    private Projection holtWinters(double[] values, int horizon, ForecastConfig runConfig) {
        int period = runConfig.seasonalPeriod();
        double alpha = runConfig.alpha();
        double beta = runConfig.beta();
        double gamma = runConfig.gamma();
        int n = values.length;

        double firstMean = statistics.mean(Arrays.copyOfRange(values, 0, period));
        double secondMean = statistics.mean(Arrays.copyOfRange(values, period, period * 2));
        double trend = (secondMean - firstMean) / period;
        double[] seasonal = new double[period];
        for (int i = 0; i < period; i++) {
            seasonal[i] = values[i] - (firstMean + trend * i);
        }
        double level = firstMean + trend * (period - 1);

        double[] residuals = new double[n - period];
        for (int i = period; i < n; i++) {
            int position = i % period;
            residuals[i - period] = values[i] - (level + trend + seasonal[position]);

            double previousLevel = level;
            level = alpha * (values[i] - seasonal[position]) + (1.0 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1.0 - beta) * trend;
            seasonal[position] = gamma * (values[i] - level) + (1.0 - gamma) * seasonal[position];
        }

        double[] forecast = new double[horizon];
        double[] growth = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            forecast[h] = level + trend * (h + 1) + seasonal[(n + h) % period];
            growth[h] = Math.sqrt(1.0 + 0.1 * h);
        }
        return new Projection(forecast, growth, residuals, parameters(
                "alpha", alpha,
                "beta", beta,
                "gamma", gamma,
                "lastLevel", level,
                "lastTrend", trend));
    }

    /**
     * Last trailing moving average continued with the slope of the most recent
     * averages. The window is a third of the series, at most one season.
     */
    private Projection movingAverage(double[] values, int horizon, int period) {
        int window = Math.max(2, Math.min(values.length / 3, period));
        double[] averages = statistics.movingAverage(values, window);
        double last = averages[averages.length - 1];
        double trend = recentSlope(averages);

        double[] residuals = new double[averages.length];
        for (int i = 0; i < averages.length; i++) {
            residuals[i] = values[i + window - 1] - averages[i];
        }

        double[] forecast = new double[horizon];
        double[] growth = new double[horizon];
        for (int h = 0; h < horizon; h++) {
            forecast[h] = last + trend * (h + 1);
            growth[h] = Math.sqrt(1.0 + (double) h / window);
        }
        return new Projection(forecast, growth, residuals, parameters(
                "windowSize", window,
                "trend", trend,
                "lastValue", last));
    }

    private double recentSlope(double[] series) {
        if (series.length < 2) {
            return 0.0;
        }
        int count = Math.min(RECENT_TREND_POINTS, series.length);
        return statistics.linearRegression(Arrays.copyOfRange(series, series.length - count, series.length)).slope();
    }

    private static Instant extrapolate(List<Instant> timestamps, int length, int offset) {
        if (timestamps == null || timestamps.size() != length || timestamps.stream().anyMatch(Objects::isNull)) {
            return null;
        }
        Instant last = timestamps.get(length - 1);
        if (length < 2) {
            return last.plus(DEFAULT_SPACING.multipliedBy(offset + 1L));
        }
        double spacingMillis = Duration.between(timestamps.get(0), last).toMillis() / (length - 1.0);
        return last.plusMillis(Math.round(spacingMillis * (offset + 1)));
    }

    private static Map<String, Double> parameters(Object... keyValues) {
        Map<String, Double> parameters = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            parameters.put((String) keyValues[i], ((Number) keyValues[i + 1]).doubleValue());
        }
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Model output before intervals are applied.
     *
     * @param growth interval factor per step, non-decreasing
     */
    private record Projection(
            double[] values, double[] growth, double[] residuals, Map<String, Double> parameters) {
    }
}
