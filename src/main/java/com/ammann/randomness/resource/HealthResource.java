/* (C)2026 */
package com.ammann.randomness.resource;

import com.ammann.randomness.dto.HealthResponseDTO;
import com.ammann.randomness.model.HealthStatus;
import com.ammann.randomness.properties.ApiProperties;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * Lightweight health endpoint for load balancers that do not speak SmallRye Health.
 *
 * <p>Always answers 200; {@code status} carries the verdict. Orchestrators should prefer the
 * {@code randomness-cache} readiness check under {@code /q/health/ready}.
 */
@Path(ApiProperties.Health.BASE)
@Tag(name = "Health", description = "Service health")
@Produces(MediaType.APPLICATION_JSON)
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    @Inject
    RandomnessCacheCoordinator coordinator;

    @ConfigProperty(name = "quarkus.application.name", defaultValue = "randomness-service")
    String serviceName = "randomness-service";

    // Visible for testing
    Clock clock = Clock.systemUTC();

    private final Instant startedAt = Instant.now();

    @GET
    @Operation(summary = "Service health", description = "healthy when the cache is populated and the entropy pool is fresh")
    @APIResponse(responseCode = "200", description = "Health verdict",
            content = @Content(schema = @Schema(implementation = HealthResponseDTO.class)))
    public Response health() {
        HealthStatus health = coordinator.health();
        if (!health.healthy()) {
            LOG.warnf("Health degraded: cachePopulated=%s, entropyFresh=%s, lastRefresh=%s",
                    health.cachePopulated(), health.entropyFresh(), health.lastRefresh());
        }

        Duration uptime = Duration.between(startedAt, clock.instant());
        var response = new HealthResponseDTO(
                health.healthy() ? HealthResponseDTO.HEALTHY : HealthResponseDTO.DEGRADED,
                health.cachePopulated(),
                health.entropyFresh(),
                serviceName,
                Math.max(0L, uptime.toMillis()) / 1000.0);
        return Response.ok(response).build();
    }
}
