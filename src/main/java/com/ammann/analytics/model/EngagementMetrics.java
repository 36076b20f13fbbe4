package com.ammann.analytics.model;

import java.time.Instant;

/**
 * Engagement counters of one forum (or one platform) for one period.
 */
public record EngagementMetrics(
        Instant timestamp,
        double posts,
        double comments,
        double likes,
        double shares,
        double activeUsers,
        double newUsers
) {
}
