/* (C)2026 */
package com.ammann.randomness.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Service health")
public record HealthResponseDTO(
        @Schema(description = "healthy or degraded") String status,
        @Schema(description = "Whether a generation has been published")
        @JsonProperty("cache_populated") Boolean cachePopulated,
        @Schema(description = "Whether the entropy pool is younger than the staleness threshold")
        @JsonProperty("entropy_fresh") Boolean entropyFresh,
        @Schema(description = "Service name") String service,
        @Schema(description = "Seconds since the service started")
        @JsonProperty("uptime_seconds") Double uptimeSeconds) {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";
}
