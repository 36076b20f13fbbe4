/* (C)2026 */
package com.ammann.analytics.scheduled;

import com.ammann.analytics.cache.AnalyticsCache;
import com.ammann.analytics.model.CacheStatistics;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Scheduled maintenance for the analytics result cache.
 * <p>
 * Expired entries are otherwise only removed when they are read again, so
 * results for series that are never requested twice would stay in memory until
 * capacity eviction pushes them out.
 */
@ApplicationScoped
public class CacheMaintenanceService {

    private static final Logger LOG = Logger.getLogger(CacheMaintenanceService.class);

    private final AnalyticsCache cache;

    @Inject
    public CacheMaintenanceService(AnalyticsCache cache) {
        this.cache = cache;
    }

    /**
     * Sweep: purges expired cache entries every 60 seconds.
     *
     * @return number of purged entries
     */
    @Scheduled(every = "${analytics.cache.sweep-interval:60s}", identity = "analytics-cache-sweep")
    public int purgeExpiredEntries() {
        int purged = cache.purgeExpired();
        if (purged > 0) {
            CacheStatistics stats = cache.statistics();
            LOG.infof(
                    "Cache sweep: purged %d expired entries (%d remaining, hit rate %.2f)",
                    purged, stats.entries(), stats.hitRate());
        } else {
            LOG.debug("Cache sweep: no expired entries");
        }
        return purged;
    }
}
