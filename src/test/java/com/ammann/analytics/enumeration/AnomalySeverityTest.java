package com.ammann.analytics.enumeration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalySeverityTest
{

    @ParameterizedTest
    @CsvSource({
            "2.0,2.0,LOW",
            "2.99,2.0,LOW",
            "3.0,2.0,MEDIUM",
            "-4.5,2.0,MEDIUM",
            "5.0,2.0,HIGH",
            "8.0,2.0,CRITICAL",
            "5.0,0.0,LOW"
    })
    void mapsScoreToThresholdRatio(double score, double threshold, AnomalySeverity expected)
    {
        assertThat(AnomalySeverity.fromScore(score, threshold)).isEqualTo(expected);
    }

    @Test
    void weightsIncreaseWithSeverity()
    {
        assertThat(AnomalySeverity.values())
                .extracting(AnomalySeverity::getWeight)
                .containsExactly(1, 2, 3, 4);
    }
}
