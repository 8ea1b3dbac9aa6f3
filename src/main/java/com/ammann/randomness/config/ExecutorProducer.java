/* (C)2026 */
package com.ammann.randomness.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.context.ManagedExecutor;
import org.eclipse.microprofile.context.ThreadContext;
import org.jboss.logging.Logger;

/**
 * CDI producer for the executor that drains the refresh queue.
 *
 * <p>One async slot: the coordinator never has more than one drain loop running, so a second
 * thread would only sit idle. The queue bound guards against a stuck drain loop piling up
 * submissions.
 */
@ApplicationScoped
public class ExecutorProducer {

    private static final Logger LOG = Logger.getLogger(ExecutorProducer.class);

    public static final String REFRESH_EXECUTOR = "randomness-refresh-executor";

    @ConfigProperty(name = "randomness.refresh.executor.max-queued", defaultValue = "4")
    int maxQueued = 4;

    /**
     * Produces the named executor used by {@code RandomnessCacheCoordinator}.
     *
     * @return single-slot ManagedExecutor
     */
    @Produces
    @Named(REFRESH_EXECUTOR)
    @ApplicationScoped
    public ManagedExecutor createRefreshExecutor() {
        LOG.debugf("Creating %s (maxAsync=1, maxQueued=%d)", REFRESH_EXECUTOR, maxQueued);
        return ManagedExecutor.builder()
                .maxAsync(1)
                .maxQueued(maxQueued)
                .propagated(ThreadContext.NONE)
                .cleared(ThreadContext.ALL_REMAINING)
                .build();
    }

    void closeRefreshExecutor(@Disposes @Named(REFRESH_EXECUTOR) ManagedExecutor executor) {
        executor.shutdownNow();
    }
}
