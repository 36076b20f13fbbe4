package com.ammann.analytics.model;

/**
 * Counters of an analytics cache since creation or the last {@code clear()}.
 */
public record CacheStatistics(
        long hits,
        long misses,
        long evictions,
        int entries
) {
    /** Fraction of lookups served from the cache, 0 when nothing was looked up. */
    public double hitRate() {
        long total = hits + misses;
        return total > 0 ? (double) hits / total : 0.0;
    }
}
