package com.ammann.analytics.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A memoized analytics result.
 *
 * <p>The entry is valid while {@code now - storedAt < ttl}.
 *
 * @param dependencies tags of the inputs the result was computed from
 */
public record CacheEntry(
        String key,
        Object data,
        Instant storedAt,
        Duration ttl,
        Set<String> dependencies
) {
    public CacheEntry {
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public CacheEntry(String key, Object data, Instant storedAt, Duration ttl) {
        this(key, data, storedAt, ttl, Set.of());
    }

    public boolean isValidAt(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) < 0;
    }

    public boolean dependsOn(String dependency) {
        return dependencies.contains(dependency);
    }
}
