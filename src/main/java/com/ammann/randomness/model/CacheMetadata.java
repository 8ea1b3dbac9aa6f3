/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.EntropySource;
import java.time.Instant;
import java.util.Map;

/**
 * Bookkeeping attached to every derived cache of a generation.
 *
 * @param generatedAt     when the owning generation was built
 * @param count           number of values held by the cache
 * @param qualitySnapshot per-source quality scores of the pool the cache was built from
 * @param refreshCount    refresh count of that pool
 */
public record CacheMetadata(
        Instant generatedAt,
        int count,
        Map<EntropySource, Double> qualitySnapshot,
        long refreshCount) {

    public CacheMetadata {
        qualitySnapshot = Map.copyOf(qualitySnapshot);
    }
}
