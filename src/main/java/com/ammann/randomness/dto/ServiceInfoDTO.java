/* (C)2026 */
package com.ammann.randomness.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data transfer object describing the running service.
 *
 * @param service        service name
 * @param status         lifecycle state of the cache (EMPTY, READY or REFRESHING)
 * @param entropySources wire names of all sources
 * @param cacheTypes     wire names of all derived caches
 * @param lastRefresh    collection time of the live pool, absent before the first collection
 * @param qualityMetrics name of the quality metric family reported by {@code /entropy/quality}
 */
@Schema(description = "Service information")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceInfoDTO(
        @Schema(description = "Service name") String service,
        @Schema(description = "Cache lifecycle state") String status,
        @Schema(description = "Available entropy sources")
        @JsonProperty("entropy_sources") List<String> entropySources,
        @Schema(description = "Available derived caches")
        @JsonProperty("cache_types") List<String> cacheTypes,
        @Schema(description = "Collection time of the live entropy pool")
        @JsonProperty("last_refresh") Instant lastRefresh,
        @Schema(description = "Quality metrics exposed by the service")
        @JsonProperty("quality_metrics") List<String> qualityMetrics) {}
