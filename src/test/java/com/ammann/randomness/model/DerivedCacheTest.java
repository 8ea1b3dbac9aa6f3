/* (C)2026 */
package com.ammann.randomness.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.randomness.enumeration.DerivedCacheType;
import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.enumeration.QualityStatus;
import com.ammann.randomness.support.TestEntropyPools;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DerivedCacheTest {

    private static final CacheMetadata METADATA =
            new CacheMetadata(TestEntropyPools.FIXED_INSTANT, 3, Map.of(EntropySource.CRYPTO_SECURE, 1.0), 2);

    @Test
    void headReturnsPrefixOrEverything() {
        DerivedCache<Double> cache = new DerivedCache<>(DerivedCacheType.STOCHASTIC_JITTER, List.of(0.01, 0.02, 0.03), METADATA);

        assertThat(cache.head(2)).containsExactly(0.01, 0.02);
        assertThat(cache.head(10)).containsExactly(0.01, 0.02, 0.03);
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void valuesAreDefensivelyCopied() {
        List<Long> seeds = new ArrayList<>(List.of(1L, 2L, 3L));
        DerivedCache<Long> cache = new DerivedCache<>(DerivedCacheType.CONTENT_SEEDS, seeds, METADATA);

        seeds.add(4L);

        assertThat(cache.values()).containsExactly(1L, 2L, 3L);
        assertThatThrownBy(() -> cache.values().add(5L)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void qualityReportAggregatesScores() {
        QualityReport report = new QualityReport(
                Map.of(EntropySource.CRYPTO_SECURE, 1.0, EntropySource.MATHEMATICAL, 0.5),
                3, TestEntropyPools.FIXED_INSTANT);

        assertThat(report.overallQuality()).isEqualTo(0.75);
        assertThat(report.overallStatus()).isEqualTo(QualityStatus.WARNING);
        assertThat(report.byWireName()).containsExactly(
                Map.entry("crypto_secure", 1.0), Map.entry("mathematical", 0.5));
    }

    @Test
    void emptyQualityReportIsCritical() {
        QualityReport report = new QualityReport(Map.of(), 0, TestEntropyPools.FIXED_INSTANT);

        assertThat(report.overallQuality()).isZero();
        assertThat(report.overallStatus()).isEqualTo(QualityStatus.CRITICAL);
    }
}
