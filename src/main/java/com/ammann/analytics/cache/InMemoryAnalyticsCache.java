/* (C)2026 */
package com.ammann.analytics.cache;

import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.model.CacheEntry;
import com.ammann.analytics.model.CacheStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/**
 * {@link AnalyticsCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Expired entries are removed lazily when read and in bulk by
 * {@link #purgeExpired()}. When the cache is full, the entry stored longest ago
 * is evicted to make room. Concurrent writers to the same key race; the last
 * write wins.
 *
 * <p>Hit, miss and eviction counts are exported as Micrometer counters when a
 * registry is supplied.
 */
public class InMemoryAnalyticsCache implements AnalyticsCache {

    private static final Logger LOG = Logger.getLogger(InMemoryAnalyticsCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration defaultTtl;
    private final int maxEntries;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private Counter hitCounter;
    private Counter missCounter;
    private Counter evictionCounter;

    public InMemoryAnalyticsCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_ENTRIES, Clock.systemUTC(), null);
    }

    /**
     * @param defaultTtl    time-to-live for {@link #set(String, Object)}
     * @param maxEntries    capacity before the oldest entry is evicted
     * @param clock         time source for expiry
     * @param meterRegistry registry for the cache counters, or {@code null}
     */
    public InMemoryAnalyticsCache(Duration defaultTtl, int maxEntries, Clock clock, MeterRegistry meterRegistry) {
        requirePositive(defaultTtl);
        if (maxEntries < 1) {
            throw ValidationException.invalidParameter("maxEntries", maxEntries, "a value >= 1");
        }
        this.defaultTtl = defaultTtl;
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        initMetrics();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            recordMiss();
            return Optional.empty();
        }
        if (!entry.isValidAt(clock.instant())) {
            evict(key, entry);
            recordMiss();
            return Optional.empty();
        }
        if (!type.isInstance(entry.data())) {
            LOG.warnf(
                    "Cache entry %s holds %s, expected %s; evicting",
                    key, entry.data().getClass().getSimpleName(), type.getSimpleName());
            evict(key, entry);
            recordMiss();
            return Optional.empty();
        }
        hits.incrementAndGet();
        incrementCounter(hitCounter);
        return Optional.of(type.cast(entry.data()));
    }

    @Override
    public void set(String key, Object value) {
        set(key, value, defaultTtl);
    }

    @Override
    public void set(String key, Object value, Set<String> dependencies) {
        set(key, value, defaultTtl, dependencies);
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        set(key, value, ttl, Set.of());
    }

    @Override
    public void set(String key, Object value, Duration ttl, Set<String> dependencies) {
        if (key == null || value == null) {
            throw ValidationException.invalidParameter(key == null ? "key" : "value", null, "a non-null value");
        }
        requirePositive(ttl);
        if (!entries.containsKey(key) && entries.size() >= maxEntries) {
            evictOldest();
        }
        entries.put(key, new CacheEntry(key, value, clock.instant(), ttl, dependencies));
        LOG.debugf("Cached %s for %s depending on %s", key, ttl, dependencies);
    }

    @Override
    public void invalidate(String key) {
        entries.remove(key);
    }

    @Override
    public int invalidateByPrefix(String prefix) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(prefix));
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Invalidated %d entries with prefix %s", removed, prefix);
        }
        return Math.max(removed, 0);
    }

    @Override
    public int invalidateByDependency(String dependency) {
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().dependsOn(dependency) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.debugf("Invalidated %d entries depending on %s", removed, dependency);
        }
        return removed;
    }

    @Override
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }

    @Override
    public CacheStatistics statistics() {
        return new CacheStatistics(hits.get(), misses.get(), evictions.get(), entries.size());
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (!e.getValue().isValidAt(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
                recordEviction();
            }
        }
        return removed;
    }

    private void evictOldest() {
        entries.values().stream()
                .min(Comparator.comparing(CacheEntry::storedAt))
                .ifPresent(oldest -> evict(oldest.key(), oldest));
    }

    private void evict(String key, CacheEntry entry) {
        if (entries.remove(key, entry)) {
            recordEviction();
        }
    }

    private void recordMiss() {
        misses.incrementAndGet();
        incrementCounter(missCounter);
    }

    private void recordEviction() {
        evictions.incrementAndGet();
        incrementCounter(evictionCounter);
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw ValidationException.invalidParameter("ttl", ttl, "a positive duration");
        }
    }

    /**
     * Registers the cache counters. Safe to call when no registry is available.
     */
    private void initMetrics() {
        if (meterRegistry == null) {
            LOG.debug("MeterRegistry not available - cache metrics disabled");
            return;
        }
        hitCounter =
                Counter.builder("analytics_cache_hits_total")
                        .description("Analytics cache lookups served from the cache")
                        .register(meterRegistry);
        missCounter =
                Counter.builder("analytics_cache_misses_total")
                        .description("Analytics cache lookups that had to be recomputed")
                        .register(meterRegistry);
        evictionCounter =
                Counter.builder("analytics_cache_evictions_total")
                        .description("Analytics cache entries removed by expiry, capacity or type mismatch")
                        .register(meterRegistry);
    }

    private static void incrementCounter(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
