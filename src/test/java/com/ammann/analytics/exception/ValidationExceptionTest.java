package com.ammann.analytics.exception;

import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationExceptionTest
{

    @ParameterizedTest
    @MethodSource("insufficientDataSamples")
    void buildsInsufficientDataMessages(String resource, int required, int actual, String expected)
    {
        ValidationException ex = ValidationException.insufficientData(resource, required, actual);
        assertThat(ex.getMessage()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "anomaly.sensitivity,1.5,'a value in [0, 1]'",
            "forecast.horizon,0,a value >= 1"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
    }

    @Test
    void nonFiniteValueNamesSeriesAndIndex()
    {
        ValidationException ex = ValidationException.nonFiniteValue("values", 3, Double.NaN);

        assertThat(ex.getMessage()).contains("NaN", "index 3", "values");
        assertThat(ex).isInstanceOf(AnalyticsException.class);
    }

    @Test
    void timeoutCarriesDeadline()
    {
        AnalysisTimeoutException ex = new AnalysisTimeoutException("Isolation forest fit", Duration.ofMillis(250));

        assertThat(ex.getMessage()).isEqualTo("Isolation forest fit did not finish within 250 ms");
        assertThat(ex.getTimeout()).isEqualTo(Duration.ofMillis(250));
    }

    private static Stream<Arguments> insufficientDataSamples()
    {
        return Stream.of(
                Arguments.of("isolation forest training values", 2, 1,
                        "Insufficient isolation forest training values: need at least 2, but got 1"),
                Arguments.of("samples", 5, 2,
                        "Insufficient samples: need at least 5, but got 2")
        );
    }
}
