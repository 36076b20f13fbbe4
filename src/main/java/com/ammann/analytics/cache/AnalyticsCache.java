/* (C)2026 */
package com.ammann.analytics.cache;

import com.ammann.analytics.model.CacheStatistics;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * TTL-bound store for computed analytics results.
 *
 * <p>Implementations are shared between threads. Reads never fail: an expired
 * entry or an entry of the wrong type is reported as a miss.
 */
public interface AnalyticsCache {
    /**
     * Returns the value stored under {@code key} if it is still valid and an
     * instance of {@code type}.
     */
    <T> Optional<T> get(String key, Class<T> type);

    /** Stores {@code value} with the default time-to-live. */
    void set(String key, Object value);

    void set(String key, Object value, Duration ttl);

    /** Stores {@code value} with the default time-to-live, tagged with {@code dependencies}. */
    void set(String key, Object value, Set<String> dependencies);

    /**
     * Stores {@code value} tagged with the inputs it was computed from.
     *
     * @param dependencies tags such as {@code data} or {@code platform:reddit}
     * @see #invalidateByDependency(String)
     */
    void set(String key, Object value, Duration ttl, Set<String> dependencies);

    void invalidate(String key);

    /**
     * Removes every entry whose key starts with {@code prefix}.
     *
     * @return number of removed entries
     */
    int invalidateByPrefix(String prefix);

    /**
     * Removes every entry tagged with {@code dependency}.
     *
     * @return number of removed entries
     */
    int invalidateByDependency(String dependency);

    void clear();

    CacheStatistics statistics();

    /**
     * Drops all expired entries.
     *
     * @return number of removed entries
     */
    int purgeExpired();
}
