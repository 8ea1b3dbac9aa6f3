/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.DerivedCacheType;
import com.ammann.randomness.model.CacheMetadata;
import com.ammann.randomness.model.DerivedCache;
import com.ammann.randomness.model.EntropyPool;
import com.ammann.randomness.model.Generation;
import com.ammann.randomness.model.QualityReport;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Cuts one mixed stream into six consecutive, non-overlapping windows and shapes each window
 * into a derived cache.
 *
 * <p>Window layout for a stream of length {@code T} (defaults for {@code T = 10_000}):
 * <ol>
 *   <li>stochastic jitter: {@code T/5} (2,000) values, {@code (v - 0.5) * 0.2}</li>
 *   <li>clustering weights: {@code T/10} rounded down to a multiple of five (1,000 values,
 *       200 vectors), each group of five normalized to sum to one</li>
 *   <li>temporal variance: {@code T/5} (2,000) values, {@code 0.5 + 1.5 * v}</li>
 *   <li>content seeds: {@code T/5} (2,000) values, {@code floor(v * 2^31)}</li>
 *   <li>similarity thresholds: {@code T/5} (2,000) values, {@code 0.1 + 0.7 * v}</li>
 *   <li>exploration paths: the remainder (1,000) passed through unchanged</li>
 * </ol>
 *
 * <p>Every transform maps [0,1) into its documented range, so no value is ever clamped.
 */
@ApplicationScoped
public class DerivedCacheBuilder {

    private static final Logger LOG = Logger.getLogger(DerivedCacheBuilder.class);

    static final int WEIGHT_VECTOR_DIMENSION = 5;
    private static final double SEED_SCALE = 2_147_483_648.0; // 2^31

    /**
     * Start/end offsets of each window within a stream.
     */
    record WindowLayout(int jitterEnd, int weightsEnd, int varianceEnd, int seedsEnd,
                        int thresholdsEnd, int streamLength) {

        static WindowLayout forLength(int length) {
            int fifth = length / 5;
            int weights = (length / 10) / WEIGHT_VECTOR_DIMENSION * WEIGHT_VECTOR_DIMENSION;
            int jitterEnd = fifth;
            int weightsEnd = jitterEnd + weights;
            int varianceEnd = weightsEnd + fifth;
            int seedsEnd = varianceEnd + fifth;
            int thresholdsEnd = seedsEnd + fifth;
            return new WindowLayout(jitterEnd, weightsEnd, varianceEnd, seedsEnd, thresholdsEnd, length);
        }
    }

    /**
     * Builds a complete generation from one pool snapshot and the stream mixed from it.
     *
     * @param pool        the snapshot the stream was mixed from
     * @param stream      mixed values in [0,1)
     * @param quality     quality report of {@code pool}, attached to every cache
     * @param generatedAt build timestamp
     * @return an immutable generation
     */
    public Generation build(EntropyPool pool, double[] stream, QualityReport quality, Instant generatedAt) {
        WindowLayout layout = WindowLayout.forLength(stream.length);

        List<Double> jitter = new ArrayList<>(layout.jitterEnd());
        for (int i = 0; i < layout.jitterEnd(); i++) {
            jitter.add((stream[i] - 0.5) * 0.2);
        }

        List<List<Double>> weights = new ArrayList<>();
        for (int i = layout.jitterEnd(); i + WEIGHT_VECTOR_DIMENSION <= layout.weightsEnd(); i += WEIGHT_VECTOR_DIMENSION) {
            double sum = 0.0;
            for (int k = 0; k < WEIGHT_VECTOR_DIMENSION; k++) {
                sum += stream[i + k];
            }
            if (sum <= 0.0) {
                continue;
            }
            List<Double> vector = new ArrayList<>(WEIGHT_VECTOR_DIMENSION);
            for (int k = 0; k < WEIGHT_VECTOR_DIMENSION; k++) {
                vector.add(stream[i + k] / sum);
            }
            weights.add(List.copyOf(vector));
        }

        List<Double> variance = new ArrayList<>();
        for (int i = layout.weightsEnd(); i < layout.varianceEnd(); i++) {
            variance.add(0.5 + stream[i] * 1.5);
        }

        List<Long> seeds = new ArrayList<>();
        for (int i = layout.varianceEnd(); i < layout.seedsEnd(); i++) {
            seeds.add((long) Math.floor(stream[i] * SEED_SCALE));
        }

        List<Double> thresholds = new ArrayList<>();
        for (int i = layout.seedsEnd(); i < layout.thresholdsEnd(); i++) {
            thresholds.add(0.1 + stream[i] * 0.7);
        }

        List<Double> exploration = new ArrayList<>();
        for (int i = layout.thresholdsEnd(); i < stream.length; i++) {
            exploration.add(stream[i]);
        }

        long refreshCount = pool.refreshCount();
        Generation generation = new Generation(
                refreshCount,
                pool.lastRefresh(),
                generatedAt,
                stream.length,
                cache(DerivedCacheType.STOCHASTIC_JITTER, jitter, quality, refreshCount, generatedAt),
                cache(DerivedCacheType.CLUSTERING_WEIGHTS, weights, quality, refreshCount, generatedAt),
                cache(DerivedCacheType.TEMPORAL_VARIANCE, variance, quality, refreshCount, generatedAt),
                cache(DerivedCacheType.CONTENT_SEEDS, seeds, quality, refreshCount, generatedAt),
                cache(DerivedCacheType.SIMILARITY_THRESHOLDS, thresholds, quality, refreshCount, generatedAt),
                cache(DerivedCacheType.EXPLORATION_PATHS, exploration, quality, refreshCount, generatedAt));

        LOG.debugf("Built generation #%d from %d mixed values: jitter=%d weights=%d variance=%d seeds=%d thresholds=%d paths=%d",
                refreshCount, stream.length, jitter.size(), weights.size(), variance.size(),
                seeds.size(), thresholds.size(), exploration.size());
        return generation;
    }

    private static <T> DerivedCache<T> cache(
            DerivedCacheType type, List<T> values, QualityReport quality, long refreshCount, Instant generatedAt) {
        CacheMetadata metadata = new CacheMetadata(generatedAt, values.size(), quality.scores(), refreshCount);
        return new DerivedCache<>(type, values, metadata);
    }
}
