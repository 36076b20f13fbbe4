/* (C)2026 */
package com.ammann.analytics.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;

/**
 * CDI producer for creating named ManagedExecutor instances.
 *
 * <p>Provides the "isolation-forest-executor" bean on which
 * {@link com.ammann.analytics.service.AnomalyDetector} grows isolation trees
 * in parallel.
 */
@ApplicationScoped
public class ExecutorProducer {

    @ConfigProperty(name = "analytics.executor.isolation-forest.max-async", defaultValue = "4")
    int maxAsync;

    @ConfigProperty(name = "analytics.executor.isolation-forest.max-queued", defaultValue = "1000")
    int maxQueued;

    /**
     * Produces the executor for isolation tree construction.
     *
     * <p>Configuration properties:
     * <ul>
     *   <li>analytics.executor.isolation-forest.max-async</li>
     *   <li>analytics.executor.isolation-forest.max-queued</li>
     * </ul>
     *
     * @return Configured ManagedExecutor instance
     */
    @Produces
    @Named("isolation-forest-executor")
    @ApplicationScoped
    public ManagedExecutor createIsolationForestExecutor() {
        return ManagedExecutor.builder()
                .maxAsync(maxAsync)
                .maxQueued(maxQueued) // up to four tasks per fit
                .propagated(ThreadContext.ALL_REMAINING)
                .cleared(ThreadContext.TRANSACTION)
                .build();
    }
}
