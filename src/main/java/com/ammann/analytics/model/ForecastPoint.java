package com.ammann.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * One forecast step with its prediction interval; {@code lower <= value <= upper}.
 *
 * @param index position in the extended series (first step is the input length)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastPoint(
        int index,
        Instant timestamp,
        double value,
        double lower,
        double upper
) {
    /** Width of the prediction interval. */
    public double width() {
        return upper - lower;
    }
}
