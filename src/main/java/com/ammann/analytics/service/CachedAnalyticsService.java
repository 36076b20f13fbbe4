/* (C)2026 */
package com.ammann.analytics.service;

import com.ammann.analytics.cache.AnalyticsCache;
import com.ammann.analytics.cache.AnalyticsCacheKey;
import com.ammann.analytics.enumeration.CacheDependency;
import com.ammann.analytics.model.AnomalyDetectionResult;
import com.ammann.analytics.model.CacheStatistics;
import com.ammann.analytics.model.EngagementAnomalyReport;
import com.ammann.analytics.model.EngagementMetrics;
import com.ammann.analytics.model.ForecastResult;
import com.ammann.analytics.model.ModelAccuracy;
import com.ammann.analytics.model.SeasonalDecomposition;
import com.ammann.analytics.model.SummaryStatistics;
import com.ammann.analytics.model.TrendResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Memoizing front of the analytics engines.
 *
 * <p>Every call is keyed by its operation, the platform the data belongs to,
 * the input series itself and the engine configuration in effect, so a changed
 * series or setting never returns a stale result. Cache faults degrade to a
 * recomputation; exceptions thrown by the engines reach the caller unchanged
 * and nothing is cached for them. Cached results are immutable, so every hit
 * may hand out the same instance.
 */
@ApplicationScoped
public class CachedAnalyticsService {

    private static final Logger LOG = Logger.getLogger(CachedAnalyticsService.class);

    static final String SUMMARY = "analytics.summary";
    static final String TREND = "analytics.trend";
    static final String MANN_KENDALL = "analytics.mann-kendall";
    static final String DECOMPOSITION = "analytics.decomposition";
    static final String BREAKPOINTS = "analytics.breakpoints";
    static final String ANOMALIES = "analytics.anomalies";
    static final String ENGAGEMENT_ANOMALIES = "analytics.engagement-anomalies";
    static final String FORECAST = "analytics.forecast";
    static final String CROSS_VALIDATION = "analytics.cross-validation";

    private final AnalyticsCache cache;
    private final StatisticsEngine statistics;
    private final TrendAnalyzer trendAnalyzer;
    private final AnomalyDetector anomalyDetector;
    private final ForecastingEngine forecastingEngine;

    @Inject
    public CachedAnalyticsService(
            AnalyticsCache cache,
            StatisticsEngine statistics,
            TrendAnalyzer trendAnalyzer,
            AnomalyDetector anomalyDetector,
            ForecastingEngine forecastingEngine) {
        this.cache = cache;
        this.statistics = statistics;
        this.trendAnalyzer = trendAnalyzer;
        this.anomalyDetector = anomalyDetector;
        this.forecastingEngine = forecastingEngine;
    }

    public SummaryStatistics summary(String platform, double[] values) {
        String key = AnalyticsCacheKey.builder(SUMMARY)
                .platform(platform)
                .shape("summary")
                .param("values", values)
                .build();
        return getOrCompute(
                key,
                SummaryStatistics.class,
                dependencies(platform, false, false),
                () -> statistics.getSummary(values));
    }

    public TrendResult trend(String platform, double[] values, List<Instant> timestamps) {
        String key = seriesKey(TREND, platform, values, timestamps)
                .param("config", trendAnalyzer.getConfig())
                .build();
        return getOrCompute(
                key,
                TrendResult.class,
                dependencies(platform, true, timestamps != null),
                () -> trendAnalyzer.analyzeTrend(values, timestamps));
    }

    public TrendResult mannKendall(String platform, double[] values) {
        String key = seriesKey(MANN_KENDALL, platform, values, null)
                .param("config", trendAnalyzer.getConfig())
                .build();
        return getOrCompute(
                key,
                TrendResult.class,
                dependencies(platform, true, false),
                () -> trendAnalyzer.mannKendallTest(values));
    }

    public SeasonalDecomposition decomposition(String platform, double[] values, int period) {
        String key = seriesKey(DECOMPOSITION, platform, values, null)
                .param("period", period)
                .build();
        return getOrCompute(
                key,
                SeasonalDecomposition.class,
                dependencies(platform, false, false),
                () -> trendAnalyzer.seasonalDecomposition(values, period));
    }

    public List<Integer> breakpoints(String platform, double[] values) {
        String key = seriesKey(BREAKPOINTS, platform, values, null)
                .param("config", trendAnalyzer.getConfig())
                .build();
        return getOrCompute(
                        key,
                        Breakpoints.class,
                        dependencies(platform, true, false),
                        () -> new Breakpoints(trendAnalyzer.detectBreakpoints(values)))
                .indices();
    }

    public AnomalyDetectionResult anomalies(String platform, double[] values, List<Instant> timestamps) {
        String key = seriesKey(ANOMALIES, platform, values, timestamps)
                .param("config", anomalyDetector.getConfig())
                .build();
        return getOrCompute(
                key,
                AnomalyDetectionResult.class,
                dependencies(platform, true, timestamps != null),
                () -> anomalyDetector.detect(values, timestamps));
    }

    public EngagementAnomalyReport engagementAnomalies(String platform, List<EngagementMetrics> metrics) {
        String key = AnalyticsCacheKey.builder(ENGAGEMENT_ANOMALIES)
                .platform(platform)
                .timeRange(firstTimestamp(metrics), lastTimestamp(metrics))
                .shape("report")
                .param("metrics", metrics)
                .param("config", anomalyDetector.getConfig())
                .build();
        return getOrCompute(
                key,
                EngagementAnomalyReport.class,
                dependencies(platform, true, true),
                () -> anomalyDetector.detectEngagementAnomalies(metrics));
    }

    public ForecastResult forecast(String platform, double[] values, List<Instant> timestamps) {
        String key = seriesKey(FORECAST, platform, values, timestamps)
                .param("config", forecastingEngine.getConfig())
                .build();
        return getOrCompute(
                key,
                ForecastResult.class,
                dependencies(platform, true, timestamps != null),
                () -> forecastingEngine.forecast(values, timestamps));
    }

    public List<ModelAccuracy> crossValidate(String platform, double[] values) {
        String key = seriesKey(CROSS_VALIDATION, platform, values, null)
                .param("config", forecastingEngine.getConfig())
                .build();
        return getOrCompute(
                        key,
                        ModelRanking.class,
                        dependencies(platform, true, false),
                        () -> new ModelRanking(forecastingEngine.crossValidate(values)))
                .rows();
    }

    /**
     * Drops every cached result of one operation, for example {@value #TREND}.
     *
     * @return number of removed entries
     */
    public int invalidateOperation(String operation) {
        int removed = cache.invalidateByPrefix(operation + ":");
        LOG.infof("Invalidated %d cached %s results", removed, operation);
        return removed;
    }

    /**
     * Drops every cached result computed from {@code dependency}, for example
     * all configuration-dependent results after a settings change.
     *
     * @return number of removed entries
     */
    public int invalidateDependency(CacheDependency dependency) {
        int removed = cache.invalidateByDependency(dependency.getTag());
        LOG.infof("Invalidated %d cached results depending on %s", removed, dependency.getTag());
        return removed;
    }

    /**
     * Drops every cached result computed for {@code platform}.
     *
     * @return number of removed entries
     */
    public int invalidatePlatform(String platform) {
        String tag = CacheDependency.platform(platform);
        int removed = cache.invalidateByDependency(tag);
        LOG.infof("Invalidated %d cached results of %s", removed, tag);
        return removed;
    }

    public CacheStatistics cacheStatistics() {
        return cache.statistics();
    }

    private static AnalyticsCacheKey.Builder seriesKey(
            String operation, String platform, double[] values, List<Instant> timestamps) {
        AnalyticsCacheKey.Builder builder = AnalyticsCacheKey.builder(operation)
                .platform(platform)
                .shape("series")
                .param("values", values);
        if (timestamps != null && !timestamps.isEmpty()) {
            builder.timeRange(timestamps.get(0), timestamps.get(timestamps.size() - 1))
                    .param("timestamps", timestamps);
        }
        return builder;
    }

    private static Set<String> dependencies(String platform, boolean configured, boolean timed) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(CacheDependency.DATA.getTag());
        tags.add(CacheDependency.platform(platform));
        if (configured) {
            tags.add(CacheDependency.CONFIG.getTag());
        }
        if (timed) {
            tags.add(CacheDependency.TIME_RANGE.getTag());
        }
        return tags;
    }

    private static Instant firstTimestamp(List<EngagementMetrics> metrics) {
        return metrics.isEmpty() ? null : metrics.get(0).timestamp();
    }

    private static Instant lastTimestamp(List<EngagementMetrics> metrics) {
        return metrics.isEmpty() ? null : metrics.get(metrics.size() - 1).timestamp();
    }

    private <T> T getOrCompute(
            String key, Class<T> type, Set<String> dependencies, Supplier<? extends T> computation) {
        Optional<T> cached = lookup(key, type);
        if (cached.isPresent()) {
            LOG.debugf("Cache hit for %s", key);
            return cached.get();
        }

        T value = computation.get();
        try {
            cache.set(key, value, dependencies);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Failed to cache result for %s", key);
        }
        return value;
    }

    /** Cached breakpoint indices; the list is immutable so every hit can share it. */
    record Breakpoints(List<Integer> indices) {
        Breakpoints {
            indices = List.copyOf(indices);
        }
    }

    /** Cached cross-validation ranking, best model first. */
    record ModelRanking(List<ModelAccuracy> rows) {
        ModelRanking {
            rows = List.copyOf(rows);
        }
    }

    private <T> Optional<T> lookup(String key, Class<T> type) {
        try {
            return cache.get(key, type);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Cache lookup failed for %s, recomputing", key);
            return Optional.empty();
        }
    }
}
