package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.TrendMethod;
import com.ammann.analytics.support.TestDataFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResultModelTest
{

    @Test
    void accuracyAverageIsFieldWise()
    {
        AccuracyMetrics a = new AccuracyMetrics(1, 2, 3, 4, 5, 6, 0.5);
        AccuracyMetrics b = new AccuracyMetrics(3, 4, 5, 6, 7, 8, 0.9);

        AccuracyMetrics avg = AccuracyMetrics.average(List.of(a, b));

        assertThat(avg.mae()).isEqualTo(2.0);
        assertThat(avg.rmse()).isEqualTo(4.0);
        assertThat(avg.mase()).isEqualTo(7.0);
        assertThat(avg.r2()).isCloseTo(0.7, within(1e-12));
        assertThat(AccuracyMetrics.average(List.of())).isEqualTo(AccuracyMetrics.zero());
    }

    @Test
    void cacheEntryExpiresExactlyAtTtl()
    {
        CacheEntry entry = new CacheEntry("k", "v", TestDataFactory.START, Duration.ofMinutes(5));

        assertThat(entry.isValidAt(TestDataFactory.START)).isTrue();
        assertThat(entry.isValidAt(TestDataFactory.START.plusSeconds(299))).isTrue();
        assertThat(entry.isValidAt(TestDataFactory.START.plusSeconds(300))).isFalse();
    }

    @Test
    void cacheEntryMatchesItsDependencies()
    {
        CacheEntry entry = new CacheEntry("k", "v", TestDataFactory.START, Duration.ofMinutes(5),
                Set.of("data", "platform:reddit"));

        assertThat(entry.dependsOn("platform:reddit")).isTrue();
        assertThat(entry.dependsOn("config")).isFalse();
        assertThat(new CacheEntry("k", "v", TestDataFactory.START, Duration.ofMinutes(5)).dependencies()).isEmpty();
    }

    @Test
    void regressionArraysAreCopied()
    {
        double[] residuals = {1, -1};
        RegressionResult fit = new RegressionResult(1, 0, 1, new double[] {1, 2}, residuals);

        residuals[0] = 99;
        fit.residuals()[1] = 99;

        assertThat(fit.residuals()).containsExactly(1.0, -1.0);
        assertThat(fit.predictions()).containsExactly(1.0, 2.0);
    }

    @Test
    void resultListsAreImmutableCopies()
    {
        List<Integer> indices = new ArrayList<>(List.of(4, 9));
        TrendResult trend = TrendResult.insufficientData(TrendMethod.LINEAR_REGRESSION).withBreakpoints(indices);

        indices.add(12);

        assertThat(trend.breakpoints()).containsExactly(4, 9);
        assertThatThrownBy(() -> trend.breakpoints().add(1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void hitRateIsZeroWithoutLookups()
    {
        assertThat(new CacheStatistics(0, 0, 0, 0).hitRate()).isZero();
        assertThat(new CacheStatistics(3, 1, 0, 2).hitRate()).isEqualTo(0.75);
    }

    @Test
    void forecastPointWidth()
    {
        assertThat(new ForecastPoint(10, null, 5.0, 3.5, 7.0).width()).isEqualTo(3.5);
    }
}
