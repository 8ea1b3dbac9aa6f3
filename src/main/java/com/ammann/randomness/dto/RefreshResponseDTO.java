/* (C)2026 */
package com.ammann.randomness.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Acknowledgement of an accepted refresh request.
 *
 * @param message         human readable acknowledgement
 * @param previousRefresh collection time of the pool live when the request arrived, or null
 * @param refreshCount    refresh count of that pool
 */
@Schema(description = "Refresh request accepted")
public record RefreshResponseDTO(
        @Schema(description = "Acknowledgement message") String message,
        @Schema(description = "Collection time of the pool live at request time", nullable = true)
        @JsonProperty("previous_refresh") Instant previousRefresh,
        @Schema(description = "Refresh count at request time")
        @JsonProperty("refresh_count") Long refreshCount) {}
