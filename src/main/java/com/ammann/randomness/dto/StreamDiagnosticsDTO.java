/* (C)2026 */
package com.ammann.randomness.dto;

import com.ammann.randomness.model.StreamDiagnostics;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Uniformity and independence indicators of the live mixed stream.
 */
@Schema(description = "Diagnostics of the live mixed stream")
public record StreamDiagnosticsDTO(
        @Schema(description = "Mixed values examined")
        @JsonProperty("sample_count") Integer sampleCount,

        @Schema(description = "Kolmogorov-Smirnov distance from Uniform(0,1)")
        @JsonProperty("ks_statistic") Double ksStatistic,

        @Schema(description = "p-value of the Kolmogorov-Smirnov distance")
        @JsonProperty("ks_p_value") Double ksPValue,

        @Schema(description = "Pearson correlation of consecutive values")
        @JsonProperty("lag_one_correlation") Double lagOneCorrelation,

        @Schema(description = "Refresh count of the examined pool")
        @JsonProperty("refresh_count") Long refreshCount) {

    public static StreamDiagnosticsDTO from(StreamDiagnostics diagnostics) {
        return new StreamDiagnosticsDTO(
                diagnostics.sampleCount(),
                diagnostics.ksStatistic(),
                diagnostics.ksPValue(),
                diagnostics.lagOneCorrelation(),
                diagnostics.refreshCount());
    }
}
