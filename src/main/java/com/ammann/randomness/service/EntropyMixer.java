/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.EntropyPool;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Combines the observations of several sources into one stream in [0,1).
 *
 * <p>Output value {@code i} is {@code sum_j w_j * source_j[i mod len(source_j)]} reduced
 * modulo 1.0. Sources are treated as cyclic, so any {@code count} can be served from a pool of
 * any sample size. Weights come from {@link EntropySource#weight()} in canonical order and are
 * aligned to the position of each source in the requested list. When fewer than all sources are
 * requested the truncated weights are rescaled to sum to one.
 *
 * <p>Mixing never mutates the pool.
 */
@ApplicationScoped
public class EntropyMixer {

    private static final Logger LOG = Logger.getLogger(EntropyMixer.class);

    private static final double[] CANONICAL_WEIGHTS = EntropySource.canonicalOrder().stream()
            .mapToDouble(EntropySource::weight)
            .toArray();

    /**
     * Resolves a list of source wire names into sources.
     *
     * <p>Names are trimmed; unknown names are ignored; repeated names keep their first position.
     * A {@code null} or empty list selects all sources in canonical order.
     *
     * @param names requested wire names, may be {@code null}
     * @return the known sources in request order
     * @throws ValidationException if names were given but none of them is known
     */
    public List<EntropySource> resolveSources(List<String> names) {
        if (names == null || names.stream().allMatch(n -> n == null || n.isBlank())) {
            return EntropySource.canonicalOrder();
        }

        Set<EntropySource> resolved = new LinkedHashSet<>();
        for (String name : names) {
            Optional<EntropySource> source = EntropySource.fromWireName(name);
            if (source.isPresent()) {
                resolved.add(source.get());
            } else if (name != null && !name.isBlank()) {
                LOG.debugf("Ignoring unknown entropy source '%s'", name.trim());
            }
        }

        if (resolved.isEmpty()) {
            throw ValidationException.invalidParameter(
                    "sources", String.join(",", names), "one or more of " + EntropySource.wireNames());
        }
        return List.copyOf(resolved);
    }

    /**
     * Mixes all sources of the pool in canonical order.
     */
    public double[] mix(EntropyPool pool, int count) {
        return mix(pool, count, EntropySource.canonicalOrder());
    }

    /**
     * Mixes the given sources of the pool into {@code count} values.
     *
     * @param pool    snapshot to read from
     * @param count   number of values, at least 1
     * @param sources sources in weighting order; at most the first seven are used
     * @return mixed values, each in [0,1)
     */
    public double[] mix(EntropyPool pool, int count, List<EntropySource> sources) {
        if (count < 1) {
            throw ValidationException.invalidParameter("count", count, "a positive value");
        }

        List<EntropySource> weighted = new ArrayList<>(
                sources.subList(0, Math.min(sources.size(), CANONICAL_WEIGHTS.length)));
        double[] weights = weightsFor(weighted.size());

        double[] mixed = new double[count];
        for (int i = 0; i < count; i++) {
            double value = 0.0;
            for (int j = 0; j < weighted.size(); j++) {
                EntropySource source = weighted.get(j);
                if (pool.size(source) > 0) {
                    value += weights[j] * pool.cyclic(source, i);
                }
            }
            mixed[i] = value % 1.0;
        }
        return mixed;
    }

    /**
     * Returns the first {@code sourceCount} canonical weights, rescaled to sum to one.
     */
    double[] weightsFor(int sourceCount) {
        double[] weights = new double[sourceCount];
        double total = 0.0;
        for (int j = 0; j < sourceCount; j++) {
            weights[j] = CANONICAL_WEIGHTS[j];
            total += weights[j];
        }
        if (total > 0.0 && sourceCount < CANONICAL_WEIGHTS.length) {
            for (int j = 0; j < sourceCount; j++) {
                weights[j] /= total;
            }
        }
        return weights;
    }
}
