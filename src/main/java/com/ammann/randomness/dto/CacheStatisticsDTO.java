/* (C)2026 */
package com.ammann.randomness.dto;

import com.ammann.randomness.model.CacheStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Size and age of one derived cache")
public record CacheStatisticsDTO(
        @Schema(description = "Values held by the cache") Integer count,
        @Schema(description = "Seconds since the cache was built") @JsonProperty("age_seconds") Double ageSeconds,
        @Schema(description = "Refresh count of the source pool") @JsonProperty("refresh_count") Long refreshCount) {

    public static CacheStatisticsDTO from(CacheStatistics statistics) {
        return new CacheStatisticsDTO(
                statistics.count(),
                statistics.age().toMillis() / 1000.0,
                statistics.refreshCount());
    }
}
