package com.ammann.analytics.model;

import com.ammann.analytics.enumeration.AnomalySeverity;
import com.ammann.analytics.enumeration.AnomalyType;
import com.ammann.analytics.enumeration.DetectionMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * A flagged point.
 *
 * <p>{@code index} refers to the array the anomaly was detected from and is the
 * only link back to the source data.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Anomaly(
        int index,
        double value,
        Instant timestamp,
        AnomalyType type,
        AnomalySeverity severity,
        double score,
        DetectionMethod method,
        AnomalyContext context
) {
    public Anomaly withTimestamp(Instant ts) {
        return new Anomaly(index, value, ts, type, severity, score, method, context);
    }

    public Anomaly withValue(double original) {
        return new Anomaly(index, original, timestamp, type, severity, score, method, context);
    }

    public Anomaly withVote(DetectionMethod voteMethod, double voteScore) {
        return new Anomaly(index, value, timestamp, type, severity, voteScore, voteMethod, context);
    }
}
