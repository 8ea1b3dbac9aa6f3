/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.enumeration.QualityStatus;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-source quality scores computed from one pool snapshot.
 *
 * @param scores       score in [0,1] for every source, in canonical order
 * @param refreshCount refresh count of the assessed pool
 * @param assessedAt   when the assessment ran
 */
public record QualityReport(Map<EntropySource, Double> scores, long refreshCount, Instant assessedAt) {

    public QualityReport {
        EnumMap<EntropySource, Double> copy = new EnumMap<>(EntropySource.class);
        copy.putAll(scores);
        scores = Collections.unmodifiableMap(copy);
    }

    /** Mean of all scores; zero when there are none. */
    public double overallQuality() {
        return scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public QualityStatus overallStatus() {
        return QualityStatus.fromScore(overallQuality());
    }

    public double score(EntropySource source) {
        return scores.getOrDefault(source, 0.0);
    }

    /** Scores keyed by wire name, in canonical order, for JSON responses. */
    public Map<String, Double> byWireName() {
        Map<String, Double> result = new LinkedHashMap<>();
        scores.forEach((source, score) -> result.put(source.wireName(), score));
        return result;
    }
}
