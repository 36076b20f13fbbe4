/* (C)2026 */
package com.ammann.analytics.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.analytics.enumeration.DetectionMethod;
import com.ammann.analytics.enumeration.ForecastModel;
import com.ammann.analytics.exception.ValidationException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ConfigValidationTest {

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.1, Double.NaN})
    void sensitivityOutsideUnitIntervalIsRejected(double sensitivity) {
        assertThatThrownBy(() -> AnomalyDetectorConfig.DEFAULT.withSensitivity(sensitivity))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("anomaly.sensitivity");
    }

    @Test
    void sensitivityBoundsAreAccepted() {
        assertThat(AnomalyDetectorConfig.DEFAULT.withSensitivity(0.0).sensitivity()).isZero();
        assertThat(AnomalyDetectorConfig.DEFAULT.withSensitivity(1.0).sensitivity()).isEqualTo(1.0);
    }

    @Test
    void emptyMethodListIsRejected() {
        assertThatThrownBy(() -> AnomalyDetectorConfig.DEFAULT.withMethods(List.of()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("anomaly.methods");
    }

    @Test
    void defaultConfigUsesZScoreAndIqr() {
        assertThat(AnomalyDetectorConfig.DEFAULT.methods())
                .containsExactly(DetectionMethod.ZSCORE, DetectionMethod.IQR);
    }

    @Test
    void methodsParsedFromConfigurationAreAccepted() {
        List<DetectionMethod> parsed = Stream.of("zscore", "isolation-forest")
                .map(DetectionMethod::fromValue)
                .toList();

        AnomalyDetectorConfig config = AnomalyDetectorConfig.DEFAULT.withMethods(parsed).withSensitivity(0.8);

        assertThat(config.methods()).containsExactly(DetectionMethod.ZSCORE, DetectionMethod.ISOLATION_FOREST);
    }

    @Test
    void nullMethodIsRejected() {
        assertThatThrownBy(() -> AnomalyDetectorConfig.DEFAULT.withMethods(Arrays.asList(DetectionMethod.MAD, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("anomaly.methods");
    }

    @Test
    void methodListIsCopied() {
        List<DetectionMethod> methods = new ArrayList<>(List.of(DetectionMethod.MAD));
        AnomalyDetectorConfig config = AnomalyDetectorConfig.DEFAULT.withMethods(methods);

        methods.add(DetectionMethod.IQR);

        assertThat(config.methods()).containsExactly(DetectionMethod.MAD);
    }

    @Test
    void nonPositiveIsolationTimeoutIsRejected() {
        assertThatThrownBy(() -> AnomalyDetectorConfig.DEFAULT.withIsolationTimeout(Duration.ZERO))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void forecastSettingsAreValidated() {
        assertThatThrownBy(() -> ForecastConfig.DEFAULT.withHorizon(0))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("forecast.horizon");
        assertThatThrownBy(() -> ForecastConfig.DEFAULT.withModel(null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new ForecastConfig(ForecastModel.AUTO, 7, 1.0, 7, 0.3, 0.1, 0.1, 0.8, 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("forecast.confidence");
        assertThatThrownBy(() -> new ForecastConfig(ForecastModel.AUTO, 7, 0.95, 7, 0.0, 0.1, 0.1, 0.8, 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("forecast.alpha");
    }

    @Test
    void trendSettingsAreValidated() {
        assertThatThrownBy(() -> new TrendConfig(2, 0.05, 0.95, 0.01, 5, 10.0, 7))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("trend.min-data-points");
        assertThatThrownBy(() -> new TrendConfig(4, 0.05, 0.95, 0.01, 5, 0.0, 7))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("trend.breakpoint-threshold");
    }
}
