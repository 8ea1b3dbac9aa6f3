/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.DerivedCacheType;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Atomic unit of consistency: all six derived caches built from one pool snapshot.
 *
 * <p>Instances are immutable once constructed and are only ever published whole.
 */
public final class Generation {

    private final long refreshCount;
    private final Instant poolRefreshedAt;
    private final Instant generatedAt;
    private final int streamLength;
    private final Map<DerivedCacheType, DerivedCache<?>> caches;

    public Generation(
            long refreshCount,
            Instant poolRefreshedAt,
            Instant generatedAt,
            int streamLength,
            DerivedCache<Double> stochasticJitter,
            DerivedCache<List<Double>> clusteringWeights,
            DerivedCache<Double> temporalVariance,
            DerivedCache<Long> contentSeeds,
            DerivedCache<Double> similarityThresholds,
            DerivedCache<Double> explorationPaths) {
        this.refreshCount = refreshCount;
        this.poolRefreshedAt = poolRefreshedAt;
        this.generatedAt = generatedAt;
        this.streamLength = streamLength;
        EnumMap<DerivedCacheType, DerivedCache<?>> map = new EnumMap<>(DerivedCacheType.class);
        map.put(DerivedCacheType.STOCHASTIC_JITTER, stochasticJitter);
        map.put(DerivedCacheType.CLUSTERING_WEIGHTS, clusteringWeights);
        map.put(DerivedCacheType.TEMPORAL_VARIANCE, temporalVariance);
        map.put(DerivedCacheType.CONTENT_SEEDS, contentSeeds);
        map.put(DerivedCacheType.SIMILARITY_THRESHOLDS, similarityThresholds);
        map.put(DerivedCacheType.EXPLORATION_PATHS, explorationPaths);
        this.caches = Collections.unmodifiableMap(map);
    }

    public DerivedCache<?> cache(DerivedCacheType type) {
        return caches.get(type);
    }

    @SuppressWarnings("unchecked")
    public DerivedCache<Double> scalarCache(DerivedCacheType type) {
        if (type == DerivedCacheType.CLUSTERING_WEIGHTS || type == DerivedCacheType.CONTENT_SEEDS) {
            throw new IllegalArgumentException(type.wireName() + " does not hold scalar values");
        }
        return (DerivedCache<Double>) caches.get(type);
    }

    @SuppressWarnings("unchecked")
    public DerivedCache<List<Double>> clusteringWeights() {
        return (DerivedCache<List<Double>>) caches.get(DerivedCacheType.CLUSTERING_WEIGHTS);
    }

    @SuppressWarnings("unchecked")
    public DerivedCache<Long> contentSeeds() {
        return (DerivedCache<Long>) caches.get(DerivedCacheType.CONTENT_SEEDS);
    }

    public Map<DerivedCacheType, DerivedCache<?>> caches() {
        return caches;
    }

    public long refreshCount() {
        return refreshCount;
    }

    public Instant poolRefreshedAt() {
        return poolRefreshedAt;
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    /** Length of the mixed stream the caches were cut from. */
    public int streamLength() {
        return streamLength;
    }
}
