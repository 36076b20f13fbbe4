package com.ammann.analytics.enumeration;

import com.ammann.analytics.model.EngagementMetrics;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Named numeric fields of {@link EngagementMetrics} scanned by engagement
 * anomaly detection.
 */
public enum EngagementMetric
{
    POSTS("posts", EngagementMetrics::posts),
    COMMENTS("comments", EngagementMetrics::comments),
    LIKES("likes", EngagementMetrics::likes),
    SHARES("shares", EngagementMetrics::shares),
    ACTIVE_USERS("activeUsers", EngagementMetrics::activeUsers),
    NEW_USERS("newUsers", EngagementMetrics::newUsers);

    /** Metrics compared pairwise by the cross-metric correlation pass. */
    public static final List<EngagementMetric> CORRELATED = List.of(POSTS, COMMENTS, LIKES, SHARES);

    private final String value;
    private final ToDoubleFunction<EngagementMetrics> accessor;

    EngagementMetric(String value, ToDoubleFunction<EngagementMetrics> accessor) {
        this.value = value;
        this.accessor = accessor;
    }

    /**
     * Extracts this metric from every sample. Non-finite readings become 0.
     *
     * @param metrics engagement samples in time order
     * @return metric values aligned with {@code metrics}
     */
    public double[] extract(List<EngagementMetrics> metrics) {
        double[] values = new double[metrics.size()];
        for (int i = 0; i < values.length; i++) {
            double v = accessor.applyAsDouble(metrics.get(i));
            values[i] = Double.isFinite(v) ? v : 0.0;
        }
        return values;
    }

    @JsonValue
    public String getValue() { return value; }
}
