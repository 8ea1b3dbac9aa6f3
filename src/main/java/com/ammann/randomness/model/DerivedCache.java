/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.DerivedCacheType;
import java.util.List;

/**
 * One immutable derived cache: typed values plus metadata.
 *
 * @param <T> element type ({@code Double}, {@code Long} or a {@code List<Double>} vector)
 */
public record DerivedCache<T>(DerivedCacheType type, List<T> values, CacheMetadata metadata) {

    public DerivedCache {
        values = List.copyOf(values);
    }

    /**
     * Returns the first {@code count} values, or all of them if the cache is shorter.
     */
    public List<T> head(int count) {
        return values.subList(0, Math.min(count, values.size()));
    }

    public int size() {
        return values.size();
    }
}
