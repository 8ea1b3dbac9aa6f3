/* (C)2026 */
package com.ammann.randomness.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pool bookkeeping attached to a mixed entropy response.
 *
 * @param generatedAt  when the values were mixed
 * @param refreshCount refresh count of the pool they were mixed from
 */
@Schema(description = "Provenance of a mixed entropy response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MixedEntropyMetadataDTO(
        @Schema(description = "When the values were mixed")
        @JsonProperty("generated_at") Instant generatedAt,

        @Schema(description = "Refresh count of the entropy pool")
        @JsonProperty("refresh_count") Long refreshCount) {}
