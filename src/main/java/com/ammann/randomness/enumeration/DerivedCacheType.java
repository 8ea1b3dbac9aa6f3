/* (C)2026 */
package com.ammann.randomness.enumeration;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six derived caches built from one mixed stream, in window order.
 *
 * <p>Each type carries the largest {@code count} a single read may request. Reads outside
 * {@code [1, maxCount]} are rejected rather than clamped.
 */
public enum DerivedCacheType {
    /** Small symmetric perturbations in [-0.1, 0.1]. */
    STOCHASTIC_JITTER("stochastic_jitter", 1000),
    /** Five-component non-negative weight vectors summing to 1. */
    CLUSTERING_WEIGHTS("clustering_weights", 100),
    /** Variance multipliers in [0.5, 2.0]. */
    TEMPORAL_VARIANCE("temporal_variance", 1000),
    /** Integer seeds in [0, 2^31). */
    CONTENT_SEEDS("content_seeds", 1000),
    /** Similarity cut-offs in [0.1, 0.8]. */
    SIMILARITY_THRESHOLDS("similarity_thresholds", 1000),
    /** Raw mixed values in [0, 1). */
    EXPLORATION_PATHS("exploration_paths", 1000);

    private final String wireName;
    private final int maxCount;

    DerivedCacheType(String wireName, int maxCount) {
        this.wireName = wireName;
        this.maxCount = maxCount;
    }

    public static Optional<DerivedCacheType> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }

    public String wireName() { return wireName; }

    public int maxCount() { return maxCount; }
}
