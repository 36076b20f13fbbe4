/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.config.AnomalyDetectorConfig;
import com.ammann.analytics.enumeration.AnomalySeverity;
import com.ammann.analytics.enumeration.AnomalyType;
import com.ammann.analytics.enumeration.DetectionMethod;
import com.ammann.analytics.enumeration.EngagementMetric;
import com.ammann.analytics.model.Anomaly;
import com.ammann.analytics.model.AnomalyContext;
import com.ammann.analytics.model.AnomalyDetectionResult;
import com.ammann.analytics.model.AnomalyStatistics;
import com.ammann.analytics.model.EngagementAnomalyReport;
import com.ammann.analytics.model.EngagementMetrics;
import com.ammann.analytics.model.Quartiles;
import com.ammann.analytics.model.SeasonalDecomposition;
import com.ammann.analytics.model.TimeSeriesPoint;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleUnaryOperator;
import org.jboss.logging.Logger;

/**
 * Multi-method anomaly detection over activity series.
 *
 * <p>Supported methods are z-score, IQR fences, median absolute deviation,
 * isolation forest and a majority-vote ensemble of the first three. Every
 * threshold tightens as {@link AnomalyDetectorConfig#sensitivity()} grows.
 * When several configured methods flag the same index, the anomaly with the
 * higher severity is kept.
 *
 * <p>Series shorter than {@link AnomalyDetectorConfig#minDataPoints()} return
 * an empty result with zero confidence.
 */
@ApplicationScoped
public class AnomalyDetector {

    private static final Logger LOG = Logger.getLogger(AnomalyDetector.class);

    /** Sensitivity used for severity when adaptive thresholds are disabled. */
    static final double REFERENCE_SENSITIVITY = 0.5;

    static final double MAD_SCALE = 0.6745;

    /** Relative step change above which an engagement value counts as a jump. */
    static final double JUMP_RATIO = 2.0;

    /** Relative step change above which a jump is critical. */
    static final double CRITICAL_JUMP_RATIO = 5.0;

    static final double TREND_BREAK_MIN_SLOPE = 0.1;

    static final double CORRELATION_DEVIATION_THRESHOLD = 0.5;

    private final StatisticsEngine statistics;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetectorConfig config;
    private final Executor isolationExecutor;

    @Inject
    public AnomalyDetector(
            StatisticsEngine statistics,
            TrendAnalyzer trendAnalyzer,
            AnomalyDetectorConfig config,
            @Named("isolation-forest-executor") Executor isolationExecutor) {
        this.statistics = statistics;
        this.trendAnalyzer = trendAnalyzer;
        this.config = config;
        this.isolationExecutor = isolationExecutor;
    }

    public AnomalyDetectorConfig getConfig() {
        return config;
    }

    public AnomalyDetectionResult detect(double[] values) {
        return detect(values, null, config);
    }

    public AnomalyDetectionResult detect(double[] values, List<Instant> timestamps) {
        return detect(values, timestamps, config);
    }

    /**
     * Runs every configured method and merges their findings.
     *
     * @param values     series values
     * @param timestamps optional timestamps aligned with {@code values}
     * @param runConfig  settings for this run
     * @return anomalies ordered by index, with run statistics and confidence
     * @throws com.ammann.analytics.exception.ValidationException if a value is not finite
     * @throws com.ammann.analytics.exception.AnalysisTimeoutException if the
     *     isolation forest exceeds its deadline
     */
    public AnomalyDetectionResult detect(
            double[] values, List<Instant> timestamps, AnomalyDetectorConfig runConfig) {
        StatisticsEngine.requireFinite("values", values);
        if (values.length < runConfig.minDataPoints()) {
            LOG.debugf(
                    "Anomaly detection skipped: %d points, need %d",
                    values.length, runConfig.minDataPoints());
            return AnomalyDetectionResult.empty(runConfig.methods());
        }

        Map<Integer, Anomaly> merged = new TreeMap<>();
        Map<String, Double> thresholds = new LinkedHashMap<>();
        for (DetectionMethod method : runConfig.methods()) {
            MethodOutcome outcome = apply(method, values, runConfig);
            for (Anomaly anomaly : outcome.anomalies()) {
                merged.merge(
                        anomaly.index(),
                        anomaly,
                        (existing, candidate) ->
                                candidate.severity().compareTo(existing.severity()) > 0
                                        ? candidate
                                        : existing);
            }
            thresholds.put(method.getValue(), outcome.threshold());
        }

        List<Anomaly> anomalies = attachTimestamps(new ArrayList<>(merged.values()), timestamps, values.length);
        AnomalyDetectionResult result = result(anomalies, values.length, runConfig.methods(), thresholds);

        LOG.debugf(
                "Detected %d anomalies in %d points using %s",
                anomalies.size(), values.length, runConfig.methods());
        return result;
    }

    /**
     * Detects anomalies after removing the seasonal component computed by
     * {@link TrendAnalyzer#seasonalDecomposition(double[], int)}. Reported
     * values are the original, unadjusted values.
     */
    public AnomalyDetectionResult detectTimeSeries(List<TimeSeriesPoint> points) {
        double[] values = TimeSeriesPoint.values(points);
        List<Instant> timestamps = TimeSeriesPoint.timestamps(points);
        StatisticsEngine.requireFinite("values", values);

        double[] adjusted = values;
        if (values.length >= config.seasonalPeriod() * 2) {
            SeasonalDecomposition decomposition =
                    trendAnalyzer.seasonalDecomposition(values, config.seasonalPeriod());
            double[] seasonal = decomposition.seasonal();
            adjusted = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                adjusted[i] = values[i] - seasonal[i];
            }
        }

        AnomalyDetectionResult result = detect(adjusted, timestamps, config);
        List<Anomaly> restored = new ArrayList<>(result.anomalies().size());
        for (Anomaly anomaly : result.anomalies()) {
            restored.add(anomaly.withValue(values[anomaly.index()]));
        }
        return new AnomalyDetectionResult(restored, result.statistics(), result.confidence());
    }

    /**
     * Scans every engagement metric separately and adds jump and trend break
     * patterns, then compares pairwise correlations of posts, comments, likes and
     * shares over a sliding window against their full-series baseline.
     *
     * @param metrics engagement samples in time order
     * @return per-metric results and the cross-metric result
     */
    public EngagementAnomalyReport detectEngagementAnomalies(List<EngagementMetrics> metrics) {
        long start = System.nanoTime();
        List<Instant> timestamps = metrics.stream().map(EngagementMetrics::timestamp).toList();

        Map<EngagementMetric, AnomalyDetectionResult> perMetric = new EnumMap<>(EngagementMetric.class);
        for (EngagementMetric metric : EngagementMetric.values()) {
            double[] values = metric.extract(metrics);
            AnomalyDetectionResult base = detect(values, timestamps, config);
            perMetric.put(metric, withPatterns(base, values, timestamps));
        }
        AnomalyDetectionResult crossMetric = detectCrossMetricAnomalies(metrics, timestamps);

        int total = perMetric.values().stream().mapToInt(r -> r.anomalies().size()).sum();
        LOG.infof(
                "Engagement scan of %d samples finished in %d ms: %d metric anomalies, %d cross-metric",
                metrics.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
                total,
                crossMetric.anomalies().size());
        return new EngagementAnomalyReport(perMetric, crossMetric);
    }

    private MethodOutcome apply(DetectionMethod method, double[] values, AnomalyDetectorConfig runConfig) {
        return switch (method) {
            case ZSCORE -> detectZScore(values, runConfig);
            case IQR -> detectIqr(values, runConfig);
            case MAD -> detectMad(values, runConfig);
            case ISOLATION_FOREST -> detectIsolationForest(values, runConfig);
            case ENSEMBLE -> detectEnsemble(values, runConfig);
        };
    }

    private MethodOutcome detectZScore(double[] values, AnomalyDetectorConfig runConfig) {
        double threshold = zScoreThreshold(runConfig.sensitivity());
        double severityThreshold = severityThreshold(runConfig, AnomalyDetector::zScoreThreshold);
        double mean = statistics.mean(values);
        double sd = statistics.standardDeviation(values);

        List<Anomaly> anomalies = new ArrayList<>();
        if (sd == 0.0) {
            return new MethodOutcome(anomalies, threshold);
        }
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(statistics.zScore(values[i], mean, sd));
            if (z > threshold) {
                anomalies.add(anomaly(values, i, z, DetectionMethod.ZSCORE,
                        AnomalySeverity.fromScore(z, severityThreshold), mean, values[i] - mean));
            }
        }
        return new MethodOutcome(anomalies, threshold);
    }

    private MethodOutcome detectIqr(double[] values, AnomalyDetectorConfig runConfig) {
        double multiplier = iqrMultiplier(runConfig.sensitivity());
        Quartiles q = statistics.quartiles(values);
        double iqr = q.iqr();

        List<Anomaly> anomalies = new ArrayList<>();
        if (iqr == 0.0) {
            return new MethodOutcome(anomalies, multiplier);
        }
        double lower = q.q1() - multiplier * iqr;
        double upper = q.q3() + multiplier * iqr;
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (v < lower || v > upper) {
                double deviation = v < lower ? lower - v : v - upper;
                anomalies.add(anomaly(values, i, deviation / iqr, DetectionMethod.IQR,
                        AnomalySeverity.fromScore(deviation, iqr), q.q2(), deviation));
            }
        }
        return new MethodOutcome(anomalies, multiplier);
    }

    private MethodOutcome detectMad(double[] values, AnomalyDetectorConfig runConfig) {
        double threshold = madThreshold(runConfig.sensitivity());
        double severityThreshold = severityThreshold(runConfig, AnomalyDetector::madThreshold);
        double median = statistics.median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = statistics.median(deviations);

        List<Anomaly> anomalies = new ArrayList<>();
        if (mad == 0.0) {
            return new MethodOutcome(anomalies, threshold);
        }
        for (int i = 0; i < values.length; i++) {
            double modifiedZ = Math.abs(MAD_SCALE * (values[i] - median) / mad);
            if (modifiedZ > threshold) {
                anomalies.add(anomaly(values, i, modifiedZ, DetectionMethod.MAD,
                        AnomalySeverity.fromScore(modifiedZ, severityThreshold), median, values[i] - median));
            }
        }
        return new MethodOutcome(anomalies, threshold);
    }

    private MethodOutcome detectIsolationForest(double[] values, AnomalyDetectorConfig runConfig) {
        double threshold = isolationThreshold(runConfig.sensitivity());
        double severityThreshold = severityThreshold(runConfig, AnomalyDetector::isolationThreshold);
        long seed = runConfig.randomSeed() != null
                ? runConfig.randomSeed()
                : ThreadLocalRandom.current().nextLong();

        long start = System.nanoTime();
        IsolationForest forest = IsolationForest.fit(
                values,
                runConfig.numTrees(),
                runConfig.maxSampleSize(),
                seed,
                isolationExecutor,
                runConfig.isolationTimeout());
        double[] scores = forest.scores(values);
        LOG.infof(
                "Isolation forest scored %d points with %d trees in %d ms",
                values.length, forest.getTreeCount(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

        double median = statistics.median(values);
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            if (scores[i] > threshold) {
                anomalies.add(anomaly(values, i, scores[i], DetectionMethod.ISOLATION_FOREST,
                        AnomalySeverity.fromScore(scores[i], severityThreshold), median, values[i] - median));
            }
        }
        return new MethodOutcome(anomalies, threshold);
    }

    /**
     * Accepts an index when a strict majority of z-score, IQR and MAD flag it.
     * The member anomaly with the highest score is reported, rescored to
     * {@code votes / members}.
     */
    private MethodOutcome detectEnsemble(double[] values, AnomalyDetectorConfig runConfig) {
        List<DetectionMethod> members = DetectionMethod.ENSEMBLE_MEMBERS;
        Map<Integer, Integer> votes = new TreeMap<>();
        Map<Integer, Anomaly> strongest = new TreeMap<>();
        for (DetectionMethod member : members) {
            for (Anomaly anomaly : apply(member, values, runConfig).anomalies()) {
                votes.merge(anomaly.index(), 1, Integer::sum);
                strongest.merge(anomaly.index(), anomaly,
                        (existing, candidate) -> candidate.score() > existing.score() ? candidate : existing);
            }
        }

        double required = members.size() / 2.0;
        List<Anomaly> anomalies = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : votes.entrySet()) {
            if (entry.getValue() > required) {
                anomalies.add(strongest.get(entry.getKey())
                        .withVote(DetectionMethod.ENSEMBLE, (double) entry.getValue() / members.size()));
            }
        }
        return new MethodOutcome(anomalies, required);
    }

    private AnomalyDetectionResult withPatterns(
            AnomalyDetectionResult base, double[] values, List<Instant> timestamps) {
        if (base.statistics().totalPoints() == 0) {
            return base;
        }
        Map<Integer, Anomaly> byIndex = new TreeMap<>();
        base.anomalies().forEach(a -> byIndex.put(a.index(), a));
        for (Anomaly pattern : jumpPatterns(values)) {
            byIndex.putIfAbsent(pattern.index(), pattern);
        }
        if (values.length > 10) {
            for (Anomaly pattern : trendBreaks(values)) {
                byIndex.putIfAbsent(pattern.index(), pattern);
            }
        }
        List<Anomaly> anomalies = attachTimestamps(new ArrayList<>(byIndex.values()), timestamps, values.length);
        return result(anomalies, values.length, base.statistics().methods(), base.statistics().thresholds());
    }

    private List<Anomaly> jumpPatterns(double[] values) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            double change = values[i] - values[i - 1];
            double ratio = values[i - 1] != 0.0 ? Math.abs(change / values[i - 1]) : Math.abs(change);
            if (ratio > JUMP_RATIO) {
                anomalies.add(new Anomaly(
                        i,
                        values[i],
                        null,
                        change > 0 ? AnomalyType.SPIKE : AnomalyType.DIP,
                        ratio > CRITICAL_JUMP_RATIO ? AnomalySeverity.CRITICAL : AnomalySeverity.HIGH,
                        ratio,
                        DetectionMethod.ENSEMBLE,
                        null));
            }
        }
        return anomalies;
    }

    private List<Anomaly> trendBreaks(double[] values) {
        List<Anomaly> anomalies = new ArrayList<>();
        int window = Math.min(10, values.length / 3);
        for (int i = window; i < values.length - window; i++) {
            double leftSlope = statistics.linearRegression(Arrays.copyOfRange(values, i - window, i)).slope();
            double rightSlope = statistics.linearRegression(Arrays.copyOfRange(values, i, i + window)).slope();
            if (Math.signum(leftSlope) != Math.signum(rightSlope)
                    && Math.abs(leftSlope) > TREND_BREAK_MIN_SLOPE
                    && Math.abs(rightSlope) > TREND_BREAK_MIN_SLOPE) {
                anomalies.add(new Anomaly(
                        i,
                        values[i],
                        null,
                        AnomalyType.TREND_BREAK,
                        AnomalySeverity.MEDIUM,
                        Math.abs(leftSlope - rightSlope),
                        DetectionMethod.ENSEMBLE,
                        null));
            }
        }
        return anomalies;
    }

    /**
     * Flags indices whose trailing-window correlation between two metrics differs
     * from the full-series correlation by more than 0.5. Windows with fewer than
     * {@code minDataPoints} samples are not evaluated. Per index, the pair with
     * the largest deviation is reported.
     */
    private AnomalyDetectionResult detectCrossMetricAnomalies(
            List<EngagementMetrics> metrics, List<Instant> timestamps) {
        List<DetectionMethod> methods = List.of(DetectionMethod.ENSEMBLE);
        int n = metrics.size();
        if (n < config.minDataPoints()) {
            return AnomalyDetectionResult.empty(methods);
        }

        List<EngagementMetric> keys = EngagementMetric.CORRELATED;
        double[][] series = new double[keys.size()][];
        for (int k = 0; k < keys.size(); k++) {
            series[k] = keys.get(k).extract(metrics);
        }
        double[][] baseline = new double[keys.size()][keys.size()];
        for (int a = 0; a < keys.size(); a++) {
            for (int b = a + 1; b < keys.size(); b++) {
                baseline[a][b] = statistics.correlation(series[a], series[b]);
            }
        }

        Map<Integer, Anomaly> byIndex = new TreeMap<>();
        for (int t = 1; t < n; t++) {
            int window = Math.min(config.contextWindow(), t);
            if (window + 1 < config.minDataPoints()) {
                continue;
            }
            int from = t - window;
            for (int a = 0; a < keys.size() - 1; a++) {
                for (int b = a + 1; b < keys.size(); b++) {
                    double windowed = statistics.correlation(
                            Arrays.copyOfRange(series[a], from, t + 1),
                            Arrays.copyOfRange(series[b], from, t + 1));
                    double deviation = Math.abs(baseline[a][b] - windowed);
                    if (deviation > CORRELATION_DEVIATION_THRESHOLD) {
                        Anomaly candidate = new Anomaly(
                                t,
                                deviation,
                                timestamps.get(t),
                                AnomalyType.UNUSUAL_PATTERN,
                                AnomalySeverity.fromScore(deviation, CORRELATION_DEVIATION_THRESHOLD),
                                deviation,
                                DetectionMethod.ENSEMBLE,
                                new AnomalyContext(baseline[a][b], deviation, 0.0));
                        byIndex.merge(t, candidate,
                                (existing, c) -> c.score() > existing.score() ? c : existing);
                    }
                }
            }
        }

        return result(new ArrayList<>(byIndex.values()), n, methods,
                Map.of("correlation_deviation", CORRELATION_DEVIATION_THRESHOLD));
    }

    private Anomaly anomaly(
            double[] values, int index, double score, DetectionMethod method,
            AnomalySeverity severity, double expected, double deviation) {
        return new Anomaly(
                index,
                values[index],
                null,
                classifyType(values, index),
                severity,
                score,
                method,
                new AnomalyContext(expected, deviation, statistics.percentileRank(values[index], values)));
    }

    /**
     * Shape of a flagged point against its neighbours: a rise of more than half
     * the previous value followed by a fall is a spike, the mirror image a dip,
     * any other slope sign change a trend break. End points are outliers.
     */
    static AnomalyType classifyType(double[] values, int index) {
        if (index == 0 || index == values.length - 1) {
            return AnomalyType.OUTLIER;
        }
        double previous = values[index - 1];
        double current = values[index];
        double next = values[index + 1];
        double before = current - previous;
        double after = next - current;
        boolean large = Math.abs(before) > Math.abs(previous) * 0.5;

        if (before > 0 && after < 0 && large) {
            return AnomalyType.SPIKE;
        }
        if (before < 0 && after > 0 && large) {
            return AnomalyType.DIP;
        }
        if (Math.signum(before) != Math.signum(after)) {
            return AnomalyType.TREND_BREAK;
        }
        return AnomalyType.OUTLIER;
    }

    /**
     * {@code (max(0, 1 - 10 * rate) + meanSeverityWeight / 4) / 2}; 0 for an empty series.
     */
    static double confidence(List<Anomaly> anomalies, int totalPoints) {
        if (totalPoints == 0) {
            return 0.0;
        }
        double rate = (double) anomalies.size() / totalPoints;
        double meanWeight = anomalies.stream()
                .mapToInt(a -> a.severity().getWeight())
                .average()
                .orElse(0.0);
        return (Math.max(0.0, 1.0 - rate * 10.0) + meanWeight / 4.0) / 2.0;
    }

    static double zScoreThreshold(double sensitivity) {
        return 3.0 - 1.5 * sensitivity;
    }

    static double iqrMultiplier(double sensitivity) {
        return 2.5 - sensitivity;
    }

    static double madThreshold(double sensitivity) {
        return 3.5 - 1.5 * sensitivity;
    }

    static double isolationThreshold(double sensitivity) {
        return 0.5 + 0.2 * (1.0 - sensitivity);
    }

    private static double severityThreshold(
            AnomalyDetectorConfig runConfig, DoubleUnaryOperator thresholdFor) {
        return thresholdFor.applyAsDouble(
                runConfig.adaptiveThreshold() ? runConfig.sensitivity() : REFERENCE_SENSITIVITY);
    }

    private static AnomalyDetectionResult result(
            List<Anomaly> anomalies, int totalPoints, List<DetectionMethod> methods, Map<String, Double> thresholds) {
        anomalies.sort(Comparator.comparingInt(Anomaly::index));
        return new AnomalyDetectionResult(
                List.copyOf(anomalies),
                new AnomalyStatistics(
                        totalPoints,
                        totalPoints > 0 ? (double) anomalies.size() / totalPoints : 0.0,
                        List.copyOf(methods),
                        Map.copyOf(thresholds)),
                confidence(anomalies, totalPoints));
    }

    private static List<Anomaly> attachTimestamps(List<Anomaly> anomalies, List<Instant> timestamps, int length) {
        if (timestamps == null || timestamps.size() != length) {
            return anomalies;
        }
        List<Anomaly> stamped = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            stamped.add(anomaly.timestamp() == null
                    ? anomaly.withTimestamp(timestamps.get(anomaly.index()))
                    : anomaly);
        }
        return stamped;
    }

    private record MethodOutcome(List<Anomaly> anomalies, double threshold) {
    }
}
