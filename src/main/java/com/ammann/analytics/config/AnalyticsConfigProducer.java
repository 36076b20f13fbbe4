/* (C)2026 */
package com.ammann.analytics.config;

import com.ammann.analytics.cache.AnalyticsCache;
import com.ammann.analytics.cache.InMemoryAnalyticsCache;
import com.ammann.analytics.enumeration.DetectionMethod;
import com.ammann.analytics.enumeration.ForecastModel;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * CDI producer for the analytics settings and the shared result cache.
 *
 * <p>Reads the {@code analytics.*} properties from application.properties and
 * turns them into validated configuration records. An invalid value fails the
 * producer with a {@link com.ammann.analytics.exception.ValidationException}
 * the first time the configuration is injected.
 */
@ApplicationScoped
public class AnalyticsConfigProducer {

    private static final Logger LOG = Logger.getLogger(AnalyticsConfigProducer.class);

    @ConfigProperty(name = "analytics.trend.min-data-points", defaultValue = "4")
    int trendMinDataPoints;

    @ConfigProperty(name = "analytics.trend.alpha", defaultValue = "0.05")
    double trendAlpha;

    @ConfigProperty(name = "analytics.trend.confidence-threshold", defaultValue = "0.95")
    double trendConfidenceThreshold;

    @ConfigProperty(name = "analytics.trend.stable-slope-threshold", defaultValue = "0.01")
    double stableSlopeThreshold;

    @ConfigProperty(name = "analytics.trend.min-segment-length", defaultValue = "5")
    int minSegmentLength;

    @ConfigProperty(name = "analytics.trend.breakpoint-threshold", defaultValue = "10.0")
    double breakpointThreshold;

    @ConfigProperty(name = "analytics.trend.seasonal-period", defaultValue = "7")
    int trendSeasonalPeriod;

    @ConfigProperty(name = "analytics.anomaly.sensitivity", defaultValue = "0.5")
    double sensitivity;

    @ConfigProperty(name = "analytics.anomaly.methods", defaultValue = "zscore,iqr")
    List<String> methods;

    @ConfigProperty(name = "analytics.anomaly.context-window", defaultValue = "10")
    int contextWindow;

    @ConfigProperty(name = "analytics.anomaly.min-data-points", defaultValue = "5")
    int anomalyMinDataPoints;

    @ConfigProperty(name = "analytics.anomaly.adaptive-threshold", defaultValue = "true")
    boolean adaptiveThreshold;

    @ConfigProperty(name = "analytics.anomaly.seasonal-period", defaultValue = "7")
    int anomalySeasonalPeriod;

    @ConfigProperty(name = "analytics.anomaly.num-trees", defaultValue = "100")
    int numTrees;

    @ConfigProperty(name = "analytics.anomaly.max-sample-size", defaultValue = "256")
    int maxSampleSize;

    @ConfigProperty(name = "analytics.anomaly.random-seed")
    Optional<Long> randomSeed;

    @ConfigProperty(name = "analytics.anomaly.isolation-timeout", defaultValue = "30s")
    Duration isolationTimeout;

    @ConfigProperty(name = "analytics.forecast.model", defaultValue = "auto")
    String forecastModel;

    @ConfigProperty(name = "analytics.forecast.horizon", defaultValue = "7")
    int horizon;

    @ConfigProperty(name = "analytics.forecast.confidence", defaultValue = "0.95")
    double forecastConfidence;

    @ConfigProperty(name = "analytics.forecast.seasonal-period", defaultValue = "7")
    int forecastSeasonalPeriod;

    @ConfigProperty(name = "analytics.forecast.alpha", defaultValue = "0.3")
    double smoothingAlpha;

    @ConfigProperty(name = "analytics.forecast.beta", defaultValue = "0.1")
    double smoothingBeta;

    @ConfigProperty(name = "analytics.forecast.gamma", defaultValue = "0.1")
    double smoothingGamma;

    @ConfigProperty(name = "analytics.forecast.split-ratio", defaultValue = "0.8")
    double splitRatio;

    @ConfigProperty(name = "analytics.forecast.folds", defaultValue = "5")
    int folds;

    @ConfigProperty(name = "analytics.cache.ttl", defaultValue = "5m")
    Duration cacheTtl;

    @ConfigProperty(name = "analytics.cache.max-entries", defaultValue = "1000")
    int cacheMaxEntries;

    @Inject Instance<MeterRegistry> meterRegistry;

    @Produces
    @Singleton
    public TrendConfig trendConfig() {
        return new TrendConfig(
                trendMinDataPoints,
                trendAlpha,
                trendConfidenceThreshold,
                stableSlopeThreshold,
                minSegmentLength,
                breakpointThreshold,
                trendSeasonalPeriod);
    }

    @Produces
    @Singleton
    public AnomalyDetectorConfig anomalyDetectorConfig() {
        List<DetectionMethod> parsed = methods.stream().map(DetectionMethod::fromValue).toList();
        AnomalyDetectorConfig config = new AnomalyDetectorConfig(
                sensitivity,
                parsed,
                contextWindow,
                anomalyMinDataPoints,
                adaptiveThreshold,
                anomalySeasonalPeriod,
                numTrees,
                maxSampleSize,
                randomSeed.orElse(null),
                isolationTimeout);
        LOG.infof("Anomaly detection configured: methods=%s, sensitivity=%.2f", parsed, sensitivity);
        return config;
    }

    @Produces
    @Singleton
    public ForecastConfig forecastConfig() {
        return new ForecastConfig(
                ForecastModel.fromValue(forecastModel),
                horizon,
                forecastConfidence,
                forecastSeasonalPeriod,
                smoothingAlpha,
                smoothingBeta,
                smoothingGamma,
                splitRatio,
                folds);
    }

    /**
     * Produces the process-wide result cache.
     */
    @Produces
    @Singleton
    public AnalyticsCache analyticsCache() {
        MeterRegistry registry = meterRegistry.isResolvable() ? meterRegistry.get() : null;
        LOG.infof("Analytics cache: ttl=%s, max entries=%d", cacheTtl, cacheMaxEntries);
        return new InMemoryAnalyticsCache(cacheTtl, cacheMaxEntries, Clock.systemUTC(), registry);
    }
}
