/* (C)2026 */
package com.ammann.randomness.dto;

import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.model.MixedEntropy;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Data transfer object for a freshly mixed entropy stream.
 *
 * <p>{@code quality} maps each source wire name to its current score in [0,1].
 */
@Schema(description = "Weighted mix of the live entropy sources")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MixedEntropyResponseDTO(
        @Schema(description = "Mixed values in [0,1)")
        List<Double> values,

        @Schema(description = "Number of values returned")
        Integer count,

        @Schema(description = "Sources that contributed, in weighting order")
        @JsonProperty("sources_used") List<String> sourcesUsed,

        @Schema(description = "Per-source quality score in [0,1]")
        Map<String, Double> quality,

        @Schema(description = "Provenance of the values")
        MixedEntropyMetadataDTO metadata) {

    public static MixedEntropyResponseDTO from(MixedEntropy mixed) {
        return new MixedEntropyResponseDTO(
                mixed.values(),
                mixed.values().size(),
                mixed.sourcesUsed().stream().map(EntropySource::wireName).toList(),
                mixed.quality().byWireName(),
                new MixedEntropyMetadataDTO(mixed.generatedAt(), mixed.refreshCount()));
    }
}
