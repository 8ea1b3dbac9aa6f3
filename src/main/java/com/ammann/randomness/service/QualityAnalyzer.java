/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.model.EntropyPool;
import com.ammann.randomness.model.QualityReport;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Scores how uniform each source's observations look.
 *
 * <p>Per source: ten equal-width bins over [0,1], a chi-square statistic against the uniform
 * expectation, and its p-value under nine degrees of freedom. The score is
 * {@code min(1, 2p)}: any p-value of 0.5 or more saturates to a perfect score. This scaling is
 * a display convention kept for compatibility with existing dashboards, not a calibrated
 * metric. A source without observations scores 0.
 *
 * <p>Scores are advisory; they never gate refreshes or reads.
 */
@ApplicationScoped
public class QualityAnalyzer {

    private static final Logger LOG = Logger.getLogger(QualityAnalyzer.class);

    static final int BINS = 10;
    static final int DEGREES_OF_FREEDOM = BINS - 1;

    @Inject
    UniformityStatisticsService statistics;

    // Visible for testing
    Clock clock = Clock.systemUTC();

    /**
     * Assesses every source of the given pool.
     *
     * @param pool snapshot to assess; the empty pool scores 0 everywhere
     * @return per-source scores in canonical order
     */
    public QualityReport assess(EntropyPool pool) {
        Map<EntropySource, Double> scores = new EnumMap<>(EntropySource.class);
        for (EntropySource source : EntropySource.canonicalOrder()) {
            scores.put(source, score(pool.observations(source)));
        }

        QualityReport report = new QualityReport(scores, pool.refreshCount(), clock.instant());
        LOG.debugf("Quality assessment for refresh #%d: overall=%.3f (%s)",
                Long.valueOf(pool.refreshCount()), Double.valueOf(report.overallQuality()), report.overallStatus());
        return report;
    }

    /**
     * Scores a single observation vector.
     */
    double score(double[] observations) {
        if (observations.length == 0) {
            return 0.0;
        }
        double chiSquare = statistics.chiSquareUniformity(observations, BINS);
        double pValue = statistics.chiSquareSurvival(chiSquare, DEGREES_OF_FREEDOM);
        return Math.min(1.0, pValue * 2.0);
    }
}
