/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.CacheState;
import java.time.Instant;

/**
 * Point-in-time health of the randomness cache.
 *
 * @param cachePopulated whether a generation has ever been published
 * @param entropyFresh   whether the live pool is younger than the staleness threshold
 * @param state          current lifecycle state
 * @param lastRefresh    collection time of the live pool, {@code null} before the first one
 * @param refreshCount   refresh count of the live pool
 */
public record HealthStatus(
        boolean cachePopulated,
        boolean entropyFresh,
        CacheState state,
        Instant lastRefresh,
        long refreshCount) {

    /** Healthy means populated and fresh; anything else is degraded. */
    public boolean healthy() {
        return cachePopulated && entropyFresh;
    }
}
