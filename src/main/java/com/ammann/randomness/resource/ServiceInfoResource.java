/* (C)2026 */
package com.ammann.randomness.resource;

import com.ammann.randomness.dto.ServiceInfoDTO;
import com.ammann.randomness.enumeration.DerivedCacheType;
import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.properties.ApiProperties;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Describes the running service: available sources, caches and the cache state.
 */
@Path(ApiProperties.ROOT)
@Tag(name = "Service", description = "Service information")
@Produces(MediaType.APPLICATION_JSON)
public class ServiceInfoResource {

    static final List<String> QUALITY_METRICS =
            List.of("chi_square_uniformity", "kolmogorov_smirnov", "lag_one_autocorrelation");

    @Inject
    RandomnessCacheCoordinator coordinator;

    @ConfigProperty(name = "quarkus.application.name", defaultValue = "randomness-service")
    String serviceName = "randomness-service";

    @GET
    @Operation(summary = "Service information")
    @APIResponse(responseCode = "200", description = "Service description",
            content = @Content(schema = @Schema(implementation = ServiceInfoDTO.class)))
    public Response info() {
        var response = new ServiceInfoDTO(
                serviceName,
                coordinator.state().name(),
                EntropySource.wireNames(),
                Arrays.stream(DerivedCacheType.values()).map(DerivedCacheType::wireName).toList(),
                coordinator.health().lastRefresh(),
                QUALITY_METRICS);
        return Response.ok(response).build();
    }
}
