/* (C)2026 */
package com.ammann.analytics.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.analytics.exception.ValidationException;
import com.ammann.analytics.model.CacheStatistics;
import com.ammann.analytics.support.MutableClock;
import com.ammann.analytics.support.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryAnalyticsCacheTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemoryAnalyticsCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestDataFactory.START);
        registry = new SimpleMeterRegistry();
        cache = new InMemoryAnalyticsCache(Duration.ofMinutes(5), 3, clock, registry);
    }

    @Test
    void storedValueIsReturnedUntilItExpires() {
        cache.set("analytics.summary:a", "result");

        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.get("analytics.summary:a", String.class)).contains("result");

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.get("analytics.summary:a", String.class)).isEmpty();

        CacheStatistics stats = cache.statistics();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.evictions()).isEqualTo(1);
        assertThat(stats.entries()).isZero();
    }

    @Test
    void explicitTtlOverridesTheDefault() {
        cache.set("k", 42, Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.get("k", Integer.class)).isEmpty();
    }

    @Test
    void unknownKeyIsAMiss() {
        assertThat(cache.get("missing", String.class)).isEmpty();
        assertThat(cache.statistics().misses()).isEqualTo(1);
        assertThat(cache.statistics().hitRate()).isZero();
    }

    @Test
    void entryOfAnotherTypeIsEvicted() {
        cache.set("k", List.of(1, 2));

        assertThat(cache.get("k", String.class)).isEmpty();
        assertThat(cache.get("k", List.class)).isEmpty();
        assertThat(cache.statistics().evictions()).isEqualTo(1);
    }

    @Test
    void fullCacheEvictsTheOldestEntry() {
        cache.set("a", "1");
        clock.advance(Duration.ofSeconds(1));
        cache.set("b", "2");
        clock.advance(Duration.ofSeconds(1));
        cache.set("c", "3");
        clock.advance(Duration.ofSeconds(1));

        cache.set("d", "4");

        assertThat(cache.get("a", String.class)).isEmpty();
        assertThat(cache.get("b", String.class)).contains("2");
        assertThat(cache.get("d", String.class)).contains("4");
        assertThat(cache.statistics().entries()).isEqualTo(3);
    }

    @Test
    void overwritingAnExistingKeyDoesNotEvict() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.set("c", "3");

        cache.set("a", "updated");

        assertThat(cache.get("a", String.class)).contains("updated");
        assertThat(cache.statistics().entries()).isEqualTo(3);
        assertThat(cache.statistics().evictions()).isZero();
    }

    @Test
    void prefixInvalidationRemovesMatchingKeysOnly() {
        cache.set("analytics.trend:1", "t1");
        cache.set("analytics.trend:2", "t2");
        cache.set("analytics.forecast:1", "f1");

        int removed = cache.invalidateByPrefix("analytics.trend:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("analytics.forecast:1", String.class)).contains("f1");
        assertThat(cache.invalidateByPrefix("analytics.trend:")).isZero();
    }

    @Test
    void invalidateAndClear() {
        cache.set("a", "1");
        cache.set("b", "2");
        cache.get("a", String.class);

        cache.invalidate("a");
        assertThat(cache.get("a", String.class)).isEmpty();

        cache.clear();
        assertThat(cache.statistics()).isEqualTo(new CacheStatistics(0, 0, 0, 0));
    }

    @Test
    void dependencyInvalidationRemovesTaggedEntriesOnly() {
        cache.set("analytics.trend:1", "t1", Set.of("data", "platform:reddit"));
        cache.set("analytics.trend:2", "t2", Set.of("data", "platform:hn"));
        cache.set("analytics.summary:1", "s1");

        assertThat(cache.invalidateByDependency("platform:reddit")).isEqualTo(1);
        assertThat(cache.get("analytics.trend:2", String.class)).contains("t2");

        assertThat(cache.invalidateByDependency("data")).isEqualTo(1);
        assertThat(cache.invalidateByDependency("config")).isZero();
        assertThat(cache.get("analytics.summary:1", String.class)).contains("s1");
    }

    @Test
    void taggedEntryUsesTheDefaultTtl() {
        cache.set("k", "v", Set.of("data"));

        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.get("k", String.class)).isEmpty();
    }

    @Test
    void purgeRemovesOnlyExpiredEntries() {
        cache.set("short", "1", Duration.ofSeconds(30));
        cache.set("long", "2", Duration.ofMinutes(30));

        clock.advance(Duration.ofMinutes(1));

        assertThat(cache.purgeExpired()).isEqualTo(1);
        assertThat(cache.statistics().entries()).isEqualTo(1);
        assertThat(cache.purgeExpired()).isZero();
    }

    @Test
    void countersAreExportedToTheRegistry() {
        cache.set("a", "1");
        cache.get("a", String.class);
        cache.get("a", String.class);
        cache.get("b", String.class);

        assertThat(registry.get("analytics_cache_hits_total").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("analytics_cache_misses_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("analytics_cache_evictions_total").counter().count()).isZero();
    }

    @Test
    void worksWithoutARegistry() {
        InMemoryAnalyticsCache plain = new InMemoryAnalyticsCache();
        plain.set("a", "1");

        assertThat(plain.get("a", String.class)).contains("1");
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> cache.set(null, "v")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> cache.set("k", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> cache.set("k", "v", Duration.ZERO)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new InMemoryAnalyticsCache(Duration.ofMinutes(1), 0, clock, null))
                .isInstanceOf(ValidationException.class);
    }
}
