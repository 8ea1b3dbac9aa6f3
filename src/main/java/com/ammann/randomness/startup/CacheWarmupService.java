/* (C)2026 */
package com.ammann.randomness.startup;

import com.ammann.randomness.service.RandomnessCacheCoordinator;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Builds the first generation on application startup.
 * <p>
 * Without warm-up the first cache read would pay for a full collection and build. A failure
 * here is not fatal: the service starts EMPTY and the first read retries synchronously.
 */
@ApplicationScoped
public class CacheWarmupService {

    private static final Logger LOG = Logger.getLogger(CacheWarmupService.class);

    @Inject
    RandomnessCacheCoordinator coordinator;

    /**
     * Executed on application startup.
     *
     * @param event Quarkus startup event
     */
    void onStart(@Observes StartupEvent event) {
        LOG.info("Cache warm-up: building initial generation...");
        try {
            coordinator.refresh();
            LOG.infof("Cache warm-up: complete, state=%s", coordinator.state());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Cache warm-up failed; first read will build synchronously");
        }
    }
}
