/* (C)2026 */
package com.ammann.analytics.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.analytics.cache.AnalyticsCache;
import com.ammann.analytics.enumeration.DetectionMethod;
import com.ammann.analytics.enumeration.ForecastModel;
import com.ammann.analytics.model.AnomalyDetectionResult;
import com.ammann.analytics.model.ForecastResult;
import com.ammann.analytics.service.CachedAnalyticsService;
import com.ammann.analytics.support.TestDataFactory;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@QuarkusTest
class AnalyticsConfigProducerTest {

    @Inject
    TrendConfig trendConfig;

    @Inject
    AnomalyDetectorConfig anomalyConfig;

    @Inject
    ForecastConfig forecastConfig;

    @Inject
    AnalyticsCache cache;

    @Inject
    @Named("isolation-forest-executor")
    ManagedExecutor isolationExecutor;

    @Inject
    CachedAnalyticsService analytics;

    @BeforeEach
    void clearCache() {
        cache.clear();
    }

    @Test
    void propertiesAreBoundToConfigurationRecords() {
        assertThat(trendConfig).isEqualTo(TrendConfig.DEFAULT);

        assertThat(anomalyConfig.methods()).containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR);
        assertThat(anomalyConfig.sensitivity()).isEqualTo(0.5);
        assertThat(anomalyConfig.randomSeed()).isEqualTo(42L);
        assertThat(anomalyConfig.numTrees()).isEqualTo(50);
        assertThat(anomalyConfig.isolationTimeout()).isEqualTo(Duration.ofSeconds(30));

        assertThat(forecastConfig).isEqualTo(ForecastConfig.DEFAULT);
        assertThat(forecastConfig.model()).isEqualTo(ForecastModel.AUTO);
    }

    @Test
    void isolationExecutorRunsTasks() throws Exception {
        assertThat(isolationExecutor.supplyAsync(() -> 21 * 2).get()).isEqualTo(42);
    }

    @Test
    void analyticsFacadeIsWiredAndMemoizes() {
        double[] values = TestDataFactory.noisyConstant(30, 50, 2, 3);
        values[12] = 150;

        AnomalyDetectionResult anomalies = analytics.anomalies("reddit", values, null);
        ForecastResult forecast = analytics.forecast("reddit", values, TestDataFactory.dailyTimestamps(30));

        assertThat(anomalies.anomalies()).extracting(a -> a.index()).contains(12);
        assertThat(forecast.forecast()).hasSize(7);
        assertThat(analytics.anomalies("reddit", values, null)).isSameAs(anomalies);
        assertThat(analytics.cacheStatistics().hits()).isEqualTo(1);
        assertThat(analytics.cacheStatistics().entries()).isEqualTo(2);
    }
}
