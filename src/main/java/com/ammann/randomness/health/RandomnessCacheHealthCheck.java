/* (C)2026 */
package com.ammann.randomness.health;

import com.ammann.randomness.model.HealthStatus;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness check for the randomness cache.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>UP: a generation is published and the entropy pool is fresh</li>
 *   <li>DOWN: nothing published yet, or the last successful collection is older than the
 *       staleness threshold</li>
 * </ul>
 */
@Readiness
@ApplicationScoped
public class RandomnessCacheHealthCheck implements HealthCheck {

    @Inject RandomnessCacheCoordinator coordinator;

    @Override
    public HealthCheckResponse call() {
        HealthStatus health = coordinator.health();

        HealthCheckResponseBuilder builder = HealthCheckResponse.named("randomness-cache")
                .status(health.healthy())
                .withData("state", health.state().name())
                .withData("cache-populated", health.cachePopulated())
                .withData("entropy-fresh", health.entropyFresh())
                .withData("refresh-count", health.refreshCount());
        if (health.lastRefresh() != null) {
            builder.withData("last-refresh", health.lastRefresh().toString());
        }
        return builder.build();
    }
}
