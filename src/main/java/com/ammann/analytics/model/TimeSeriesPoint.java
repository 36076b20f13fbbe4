package com.ammann.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * One observation of a fixed-cadence activity series, for example the number
 * of posts on a given day.
 *
 * <p>Series are ordered non-decreasing by timestamp. Callers are expected to
 * pass finite values; engines reject NaN and infinity.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeSeriesPoint(
        Instant timestamp,
        double value
) {
    public static TimeSeriesPoint of(Instant timestamp, double value) {
        return new TimeSeriesPoint(timestamp, value);
    }

    /**
     * Extracts the values of a point list in order.
     *
     * @param points series points
     * @return values aligned with {@code points}
     */
    public static double[] values(List<TimeSeriesPoint> points) {
        return points.stream().mapToDouble(TimeSeriesPoint::value).toArray();
    }

    /**
     * Extracts the timestamps of a point list in order. Missing timestamps stay
     * {@code null}.
     *
     * @param points series points
     * @return timestamps aligned with {@code points}
     */
    public static List<Instant> timestamps(List<TimeSeriesPoint> points) {
        return points.stream().map(TimeSeriesPoint::timestamp).toList();
    }
}
