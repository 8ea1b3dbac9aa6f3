/* (C)2026 */
package com.ammann.randomness.model;

import com.ammann.randomness.enumeration.EntropySource;
import java.time.Instant;
import java.util.List;

/**
 * A freshly mixed stream together with the pool bookkeeping it was mixed from.
 *
 * @param values       mixed values in [0,1)
 * @param sourcesUsed  sources that contributed, in weighting order
 * @param quality      quality of the pool the values came from
 * @param generatedAt  when the values were mixed
 * @param refreshCount refresh count of that pool
 */
public record MixedEntropy(
        List<Double> values,
        List<EntropySource> sourcesUsed,
        QualityReport quality,
        Instant generatedAt,
        long refreshCount) {

    public MixedEntropy {
        values = List.copyOf(values);
        sourcesUsed = List.copyOf(sourcesUsed);
    }
}
