/* (C)2026 */
package com.ammann.randomness.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data transfer object for the quality report endpoint.
 *
 * <p>Per-source scores come from the live pool; cache statistics describe the published
 * generation. {@code cacheStatistics} is empty and {@code streamDiagnostics} absent until the
 * first refresh.
 *
 * @param entropyQuality    per-source score in [0,1], keyed by wire name
 * @param cacheStatistics   size and age per derived cache, keyed by wire name
 * @param overallQuality    mean of the per-source scores
 * @param overallStatus     classification of {@code overallQuality}
 * @param entropySources    wire names of all sources in canonical order
 * @param streamDiagnostics diagnostics of the live mixed stream
 */
@Schema(description = "Entropy quality report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityResponseDTO(
        @Schema(description = "Per-source quality score in [0,1]")
        @JsonProperty("entropy_quality") Map<String, Double> entropyQuality,

        @Schema(description = "Size and age of each derived cache")
        @JsonProperty("cache_statistics") Map<String, CacheStatisticsDTO> cacheStatistics,

        @Schema(description = "Mean of the per-source scores")
        @JsonProperty("overall_quality") Double overallQuality,

        @Schema(description = "EXCELLENT, GOOD, WARNING or CRITICAL")
        @JsonProperty("overall_status") String overallStatus,

        @Schema(description = "All known entropy sources")
        @JsonProperty("entropy_sources") List<String> entropySources,

        @Schema(description = "Diagnostics of the live mixed stream")
        @JsonProperty("stream_diagnostics") StreamDiagnosticsDTO streamDiagnostics) {}
