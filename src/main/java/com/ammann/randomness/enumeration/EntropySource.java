/* (C)2026 */
package com.ammann.randomness.enumeration;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Named pseudo-random sources feeding the entropy pool.
 *
 * <p>Declaration order is the canonical mixing order: when no explicit source list is
 * requested, sources are mixed in this order and each is paired with its weight. The weights
 * of all seven sources sum to 1.0.
 */
public enum EntropySource {
    /** Fractional part of the wall-clock nanosecond reading. */
    SYSTEM_TIME("system_time", 0.20),
    /** Uniform 32-bit draws from {@link java.security.SecureRandom}. */
    CRYPTO_SECURE("crypto_secure", 0.15),
    /** Hash of time-offset strings, simulating atmospheric noise. */
    ATMOSPHERIC("atmospheric", 0.15),
    /** Logistic map iteration with a time-varying growth parameter. */
    MATHEMATICAL("mathematical", 0.15),
    /** Squared amplitude of a uniformly drawn phase. */
    QUANTUM_SIM("quantum_sim", 0.10),
    /** Leading 32 bits of SHA-256 digests over time and refresh-count tagged content. */
    CONTENT_HASH("content_hash", 0.15),
    /** Product of two slow sinusoids, normalized to [0,1]. */
    TEMPORAL_DRIFT("temporal_drift", 0.10);

    private static final List<EntropySource> CANONICAL_ORDER = List.of(values());

    private final String wireName;
    private final double weight;

    EntropySource(String wireName, double weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    /**
     * Resolves a source from its wire name (for example {@code crypto_secure}).
     *
     * @param name wire name, surrounding whitespace ignored
     * @return the matching source, or empty for unknown or blank names
     */
    public static Optional<EntropySource> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values()).filter(s -> s.wireName.equals(trimmed)).findFirst();
    }

    /** All sources in canonical mixing order. */
    public static List<EntropySource> canonicalOrder() {
        return CANONICAL_ORDER;
    }

    /** Wire names of all sources in canonical order. */
    public static List<String> wireNames() {
        return CANONICAL_ORDER.stream().map(EntropySource::wireName).toList();
    }

    public String wireName() { return wireName; }

    public double weight() { return weight; }
}
