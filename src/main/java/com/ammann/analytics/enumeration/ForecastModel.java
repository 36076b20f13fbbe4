package com.ammann.analytics.enumeration;

import com.ammann.analytics.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Forecasting models. {@link #AUTO} delegates the choice to
 * {@link com.ammann.analytics.service.ModelSelector}.
 */
public enum ForecastModel
{
    AUTO("auto", 0),
    LINEAR("linear", 2),
    SEASONAL("seasonal", -1),
    SMOOTHING("smoothing", 3),
    HOLT_WINTERS("holt-winters", -1),
    MOVING_AVERAGE("moving-average", 6);

    /** Concrete models evaluated by cross-validation. */
    public static final List<ForecastModel> CANDIDATES =
            List.of(LINEAR, SEASONAL, SMOOTHING, HOLT_WINTERS, MOVING_AVERAGE);

    private final String value;
    private final int fixedMinimum;

    ForecastModel(String value, int fixedMinimum) {
        this.value = value;
        this.fixedMinimum = fixedMinimum;
    }

    /**
     * Minimum series length the model needs. Seasonal models need two full
     * periods.
     *
     * @param seasonalPeriod configured seasonal period
     * @return minimum number of observations
     */
    public int minimumLength(int seasonalPeriod) {
        return fixedMinimum < 0 ? seasonalPeriod * 2 : fixedMinimum;
    }

    /**
     * Parses a model name, accepting both {@code holt-winters} and
     * {@code holt_winters} spellings.
     *
     * @param value configured model name
     * @return the matching model
     * @throws ValidationException if the name is unknown
     */
    @JsonCreator
    public static ForecastModel fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase().replace('_', '-');
            for (ForecastModel model : values()) {
                if (model.value.equals(normalized)) {
                    return model;
                }
            }
        }
        throw ValidationException.invalidParameter(
                "model", value, "one of auto, linear, seasonal, smoothing, holt-winters, moving-average");
    }

    @JsonValue
    public String getValue() { return value; }
}
