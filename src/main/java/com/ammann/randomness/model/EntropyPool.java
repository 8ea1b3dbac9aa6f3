/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.EntropySource;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable snapshot of every source's observations from one collection cycle.
 *
 * <p>Observation arrays are copied on the way in and on the way out, so a snapshot handed to
 * the mixer or the quality analyzer can never be altered by a later collection.
 */
public final class EntropyPool {

    private static final double[] NO_OBSERVATIONS = new double[0];
    private static final EntropyPool EMPTY = new EntropyPool(Map.of(), null, 0L);

    private final Map<EntropySource, double[]> observations;
    private final Instant lastRefresh;
    private final long refreshCount;

    public EntropyPool(Map<EntropySource, double[]> observations, Instant lastRefresh, long refreshCount) {
        EnumMap<EntropySource, double[]> copy = new EnumMap<>(EntropySource.class);
        observations.forEach((source, values) -> copy.put(source, values.clone()));
        this.observations = Collections.unmodifiableMap(copy);
        this.lastRefresh = lastRefresh;
        this.refreshCount = refreshCount;
    }

    /** The pool that exists before the first collection: no observations, never refreshed. */
    public static EntropyPool empty() {
        return EMPTY;
    }

    /**
     * Returns a copy of the observations for a source; an empty array if the source has none.
     */
    public double[] observations(EntropySource source) {
        double[] values = observations.get(source);
        return values == null ? NO_OBSERVATIONS : values.clone();
    }

    /** Number of observations held for a source without copying them. */
    public int size(EntropySource source) {
        double[] values = observations.get(source);
        return values == null ? 0 : values.length;
    }

    /** Observation at {@code index}, wrapping cyclically over the source's vector. */
    public double cyclic(EntropySource source, int index) {
        double[] values = observations.get(source);
        return values[Math.floorMod(index, values.length)];
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /** Collection time of this snapshot, or {@code null} for the empty pool. */
    public Instant lastRefresh() {
        return lastRefresh;
    }

    public long refreshCount() {
        return refreshCount;
    }

    /**
     * Age of this snapshot relative to {@code now}; the empty pool is infinitely old.
     */
    public Duration age(Instant now) {
        if (lastRefresh == null) {
            return ChronoUnit.FOREVER.getDuration();
        }
        return Duration.between(lastRefresh, now);
    }
}
