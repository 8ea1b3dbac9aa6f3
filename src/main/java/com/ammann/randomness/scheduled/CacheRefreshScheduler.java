/* (C)2026 */
package com.ammann.randomness.scheduled;

import com.ammann.randomness.service.RandomnessCacheCoordinator;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Periodically refreshes the derived randomness caches.
 * <p>
 * The tick only queues a refresh; the build itself runs on the refresh executor, so a slow
 * build never blocks the scheduler thread. Overlapping ticks are skipped by the scheduler and
 * coalesced by the coordinator.
 */
@ApplicationScoped
public class CacheRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(CacheRefreshScheduler.class);

    @Inject
    RandomnessCacheCoordinator coordinator;

    @Scheduled(
            every = "${randomness.refresh.interval}",
            delayed = "${randomness.refresh.interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP,
            identity = "randomness-cache-refresh")
    public void refreshCaches() {
        LOG.debug("Scheduled cache refresh triggered");
        coordinator.requestRefresh("scheduled")
                .whenComplete((generation, failure) -> {
                    if (failure != null) {
                        LOG.warnf("Scheduled refresh failed, retrying on next tick: %s", failure.getMessage());
                    } else {
                        LOG.debugf("Scheduled refresh published generation #%d", generation.refreshCount());
                    }
                });
    }
}
