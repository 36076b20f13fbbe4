/* (C)2026 */
package com.ammann.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.analytics.config.TrendConfig;
import com.ammann.analytics.enumeration.TrendDirection;
import com.ammann.analytics.enumeration.TrendMethod;
import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.model.ChangePoint;
import com.ammann.analytics.model.SeasonalDecomposition;
import com.ammann.analytics.model.SeasonalityProfile;
import com.ammann.analytics.model.TrendResult;
import com.ammann.analytics.support.TestDataFactory;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

    private final TrendAnalyzer analyzer = new TrendAnalyzer(new StatisticsEngine(), TrendConfig.DEFAULT);

    @Test
    void noisyRisingSeriesIsIncreasingWithHighConfidence() {
        double[] values = TestDataFactory.linearSeries(30, 50.0, 3.0, 2.0, 42L);

        TrendResult result = analyzer.analyzeTrend(values);

        assertThat(result.method()).isEqualTo(TrendMethod.LINEAR_REGRESSION);
        assertThat(result.trend()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.slope()).isCloseTo(3.0, within(0.2));
        assertThat(result.confidence()).isGreaterThan(0.7);
        assertThat(result.significant()).isTrue();
        assertThat(result.insufficientData()).isFalse();
    }

    @Test
    void fallingSeriesReportsChangePercent() {
        double[] values = {100, 98, 96, 94, 92, 90, 88, 86, 84, 82};

        TrendResult result = analyzer.analyzeTrend(values);

        assertThat(result.trend()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.changePercent()).isCloseTo(-18.0, within(1e-9));
        assertThat(result.volatility()).isGreaterThan(0.0);
    }

    @Test
    void flatSeriesIsStable() {
        double[] values = TestDataFactory.noisyConstant(20, 100.0, 1.0, 3L);

        assertThat(analyzer.analyzeTrend(values).trend()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void tooFewPointsGiveNeutralResult() {
        TrendResult result = analyzer.analyzeTrend(new double[] {1, 2, 3});

        assertThat(result.insufficientData()).isTrue();
        assertThat(result.trend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.confidence()).isZero();
        assertThat(result.significant()).isFalse();
    }

    @Test
    void slopeIsMeasuredPerDayWhenTimestampsAreGiven() {
        double[] values = {10, 11, 12, 13, 14, 15};
        List<Instant> hourly = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            hourly.add(TestDataFactory.START.plus(i, ChronoUnit.HOURS));
        }

        TrendResult result = analyzer.analyzeTrend(values, hourly);

        assertThat(result.slope()).isCloseTo(24.0, within(1e-6));
    }

    @Test
    void pointListOverloadUsesTimestamps() {
        double[] values = TestDataFactory.linearSeries(10, 20.0, 1.0, 0.0, 1L);

        TrendResult result = analyzer.analyzeTimeSeries(TestDataFactory.dailyPoints(values));

        assertThat(result.slope()).isCloseTo(1.0, within(1e-6));
    }

    @Test
    void nonFiniteValuesAreRejected() {
        assertThatThrownBy(() -> analyzer.analyzeTrend(new double[] {1, 2, Double.POSITIVE_INFINITY, 4}))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void mannKendallDetectsMonotonicIncrease() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        TrendResult result = analyzer.mannKendallTest(values);

        assertThat(result.method()).isEqualTo(TrendMethod.MANN_KENDALL);
        assertThat(result.statistic()).isEqualTo(45.0);
        assertThat(result.trend()).isEqualTo(TrendDirection.INCREASING);
        assertThat(result.pValue()).isLessThan(0.001);
        assertThat(result.significant()).isTrue();
        assertThat(result.confidence()).isCloseTo(1.0 - result.pValue(), within(1e-12));
    }

    @Test
    void mannKendallDetectsMonotonicDecrease() {
        double[] values = {10, 9, 8, 7, 6, 5, 4, 3, 2, 1};

        TrendResult result = analyzer.mannKendallTest(values);

        assertThat(result.statistic()).isEqualTo(-45.0);
        assertThat(result.trend()).isEqualTo(TrendDirection.DECREASING);
        assertThat(result.significant()).isTrue();
    }

    @Test
    void mannKendallOnTiedSeriesIsNotSignificant() {
        TrendResult result = analyzer.mannKendallTest(new double[] {5, 5, 5, 5, 5, 5});

        assertThat(result.statistic()).isZero();
        assertThat(result.pValue()).isEqualTo(1.0);
        assertThat(result.trend()).isEqualTo(TrendDirection.STABLE);
        assertThat(result.significant()).isFalse();
    }

    @Test
    void mannKendallWithTooFewPointsIsNeutral() {
        TrendResult result = analyzer.mannKendallTest(new double[] {1, 2});

        assertThat(result.insufficientData()).isTrue();
        assertThat(result.pValue()).isEqualTo(1.0);
    }

    @Test
    void decompositionComponentsAddUpToSeries() {
        double[] values = TestDataFactory.weeklySeries(35, 100.0, 0.5, 10.0);

        SeasonalDecomposition decomposition = analyzer.seasonalDecomposition(values, 7);

        assertThat(decomposition.sufficientData()).isTrue();
        for (int i = 0; i < values.length; i++) {
            double rebuilt = decomposition.trend()[i] + decomposition.seasonal()[i] + decomposition.residual()[i];
            assertThat(rebuilt).isCloseTo(values[i], within(1e-9));
        }
        assertThat(Arrays.stream(decomposition.pattern()).sum()).isCloseTo(0.0, within(1e-9));
        assertThat(decomposition.seasonalStrength()).isGreaterThan(0.5);
    }

    @Test
    void evenPeriodDecompositionAlsoReconstructs() {
        double[] values = TestDataFactory.linearSeries(24, 10.0, 0.2, 1.0, 9L);

        SeasonalDecomposition decomposition = analyzer.seasonalDecomposition(values, 4);

        double[] adjusted = decomposition.seasonallyAdjusted();
        for (int i = 0; i < values.length; i++) {
            assertThat(adjusted[i] + decomposition.seasonal()[i]).isCloseTo(values[i], within(1e-9));
        }
    }

    @Test
    void decompositionOfShortSeriesKeepsRawTrend() {
        double[] values = {1, 2, 3, 4, 5};

        SeasonalDecomposition decomposition = analyzer.seasonalDecomposition(values, 7);

        assertThat(decomposition.sufficientData()).isFalse();
        assertThat(decomposition.trend()).containsExactly(values);
        assertThat(decomposition.seasonal()).containsOnly(0.0);
    }

    @Test
    void decompositionRejectsPeriodBelowTwo() {
        assertThatThrownBy(() -> analyzer.seasonalDecomposition(new double[] {1, 2, 3, 4}, 1))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void flatThenRampHasSingleBreakpointAtTheKnee() {
        double[] flat = TestDataFactory.noisyConstant(30, 50.0, 1.0, 42L);
        double[] ramp = TestDataFactory.linearSeries(30, 50.0, 3.0, 1.0, 43L);
        double[] values = concat(flat, ramp);

        List<Integer> breakpoints = analyzer.detectBreakpoints(values);

        assertThat(breakpoints).hasSize(1);
        assertThat(breakpoints.get(0)).isBetween(28, 32);
    }

    @Test
    void levelShiftIsABreakpoint() {
        double[] values = concat(
                TestDataFactory.noisyConstant(20, 10.0, 0.5, 1L),
                TestDataFactory.noisyConstant(20, 30.0, 0.5, 2L));

        assertThat(analyzer.detectBreakpoints(values)).containsExactly(20);
    }

    @Test
    void straightRampHasNoBreakpoints() {
        double[] values = TestDataFactory.linearSeries(40, 5.0, 2.0, 0.0, 1L);

        assertThat(analyzer.detectBreakpoints(values)).isEmpty();
    }

    @Test
    void breakpointsAreAttachedToTrendResult() {
        double[] values = concat(
                TestDataFactory.noisyConstant(20, 10.0, 0.5, 1L),
                TestDataFactory.noisyConstant(20, 30.0, 0.5, 2L));

        TrendResult result = analyzer.withBreakpoints(analyzer.analyzeTrend(values), values);

        assertThat(result.breakpoints()).containsExactly(20);
        assertThat(result.trend()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    void detectedBreakpointsAreImmutable() {
        double[] values = concat(
                TestDataFactory.noisyConstant(20, 10.0, 0.5, 1L),
                TestDataFactory.noisyConstant(20, 30.0, 0.5, 2L));

        List<Integer> breakpoints = analyzer.detectBreakpoints(values);

        assertThatThrownBy(() -> breakpoints.add(5)).isInstanceOf(UnsupportedOperationException.class);
        assertThat(analyzer.detectBreakpoints(new double[] {1, 2, 3})).isEmpty();
    }

    @Test
    void shortStepUsesAWindowOfAThirdOfTheSeries() {
        double[] values = new double[12];
        Arrays.fill(values, 0, 6, 10.0);
        Arrays.fill(values, 6, 12, 30.0);

        List<ChangePoint> changePoints = analyzer.detectChangePoints(values, 2.0);

        assertThat(changePoints).extracting(ChangePoint::index).containsExactly(6);
    }

    @Test
    void stepChangeProducesOneChangePoint() {
        double[] values = new double[20];
        Arrays.fill(values, 0, 10, 10.0);
        Arrays.fill(values, 10, 20, 30.0);

        List<ChangePoint> changePoints = analyzer.detectChangePoints(values, 2.0);

        assertThat(changePoints).hasSize(1);
        assertThat(changePoints.get(0).index()).isEqualTo(10);
        assertThat(changePoints.get(0).direction()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    void seasonalityOfPointsUsesConfiguredPeriod() {
        double[] values = TestDataFactory.weeklySeries(28, 50.0, 0.0, 5.0);

        SeasonalityProfile profile = analyzer.detectSeasonality(TestDataFactory.dailyPoints(values));

        assertThat(profile.period()).isEqualTo(7);
        assertThat(profile.hasSeasonality()).isTrue();
    }

    @Test
    void momentumIsPercentChangeOverPeriod() {
        assertThat(analyzer.calculateMomentum(new double[] {100, 110, 121}, 1))
                .containsExactly(new double[] {10.0, 10.0}, within(1e-9));
        assertThat(analyzer.calculateMomentum(new double[] {0, 5, 10}, 1)[0]).isZero();
        assertThat(analyzer.calculateMomentum(new double[] {1, 2}, 2)).isEmpty();
    }

    @Test
    void rsiOfRisingSeriesIsHundredAndOfFlatSeriesFifty() {
        assertThat(analyzer.calculateRsi(new double[] {1, 2, 3, 4, 5, 6}, 3)).containsOnly(100.0);
        assertThat(analyzer.calculateRsi(new double[] {4, 4, 4, 4, 4}, 2)).containsOnly(50.0);
    }

    @Test
    void rsiStaysWithinBounds() {
        double[] values = TestDataFactory.noisyConstant(50, 100.0, 10.0, 5L);

        double[] rsi = analyzer.calculateRsi(values, 14);

        assertThat(rsi).hasSize(36);
        for (double value : rsi) {
            assertThat(value).isBetween(0.0, 100.0);
        }
    }

    private static double[] concat(double[] first, double[] second) {
        double[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }
}
