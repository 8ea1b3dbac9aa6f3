/* (C)2026 */
package com.ammann.randomness.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ammann.randomness.dto.MixedEntropyResponseDTO;
import com.ammann.randomness.dto.QualityResponseDTO;
import com.ammann.randomness.dto.RefreshResponseDTO;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import com.ammann.randomness.service.RandomnessTestFixture;
import com.ammann.randomness.support.MutableClock;
import com.ammann.randomness.support.TestEntropyPools;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EntropyResourceTest {

    private RandomnessCacheCoordinator coordinator;
    private EntropyResource resource;

    @BeforeEach
    void setUp() {
        coordinator = RandomnessTestFixture.inlineCoordinator(new MutableClock(TestEntropyPools.FIXED_INSTANT));
        resource = new EntropyResource();
        resource.coordinator = coordinator;
    }

    @Test
    @SuppressWarnings("unchecked")
    void jitterDefaultsToTenValues() {
        Response response = resource.getJitter(null);

        List<Double> values = (List<Double>) response.getEntity();
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(values).hasSize(10).allSatisfy(v -> assertThat(v).isBetween(-0.1, 0.1));
    }

    @Test
    @SuppressWarnings("unchecked")
    void clusteringWeightsReturnsNormalizedVectors() {
        Response response = resource.getClusteringWeights("3");

        List<List<Double>> vectors = (List<List<Double>>) response.getEntity();
        assertThat(vectors).hasSize(3);
        for (List<Double> vector : vectors) {
            assertThat(vector).hasSize(5);
            assertThat(vector.stream().mapToDouble(Double::doubleValue).sum()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    void scalarEndpointsHonourRangesAndDefaults() {
        assertThat((List<Double>) resource.getTemporalVariance(null).getEntity())
                .hasSize(10).allSatisfy(v -> assertThat(v).isBetween(0.5, 2.0));
        assertThat((List<Double>) resource.getSimilarityThresholds("1000").getEntity())
                .hasSize(1000).allSatisfy(v -> assertThat(v).isBetween(0.1, 0.8));
        assertThat((List<Double>) resource.getExplorationPaths(null).getEntity())
                .hasSize(50).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0.0).isLessThan(1.0));
        assertThat((List<Long>) resource.getContentSeeds(" 25 ").getEntity())
                .hasSize(25).allSatisfy(v -> assertThat(v).isBetween(0L, (long) Integer.MAX_VALUE));
    }

    @Test
    void outOfRangeCountsAreRejected() {
        assertThatThrownBy(() -> resource.getJitter("1001")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.getJitter("0")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.getClusteringWeights("101")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.getMixed("5001", null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> resource.getExplorationPaths("-3")).isInstanceOf(ValidationException.class);
    }

    @Test
    void nonNumericCountIsRejected() {
        assertThatThrownBy(() -> resource.getTemporalVariance("ten"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("count");
    }

    @Test
    void mixedReportsSourcesUsedAndMetadata() {
        Response response = resource.getMixed("200", "crypto_secure, atmospheric,unknown");

        MixedEntropyResponseDTO dto = (MixedEntropyResponseDTO) response.getEntity();
        assertThat(dto.count()).isEqualTo(200);
        assertThat(dto.values()).hasSize(200);
        assertThat(dto.sourcesUsed()).containsExactly("crypto_secure", "atmospheric");
        assertThat(dto.quality()).hasSize(7);
        assertThat(dto.metadata().refreshCount()).isEqualTo(1L);
        assertThat(dto.metadata().generatedAt()).isEqualTo(TestEntropyPools.FIXED_INSTANT);
    }

    @Test
    void mixedDefaultsToAllSources() {
        MixedEntropyResponseDTO dto = (MixedEntropyResponseDTO) resource.getMixed(null, null).getEntity();

        assertThat(dto.count()).isEqualTo(100);
        assertThat(dto.sourcesUsed()).hasSize(7);
    }

    @Test
    void mixedRejectsSelectionWithoutKnownSource() {
        assertThatThrownBy(() -> resource.getMixed("10", "bogus"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sources");
    }

    @Test
    void qualityReportCoversSourcesAndCaches() {
        coordinator.refresh();

        QualityResponseDTO dto = (QualityResponseDTO) resource.getQuality().getEntity();

        assertThat(dto.entropyQuality()).hasSize(7).allSatisfy((source, score) -> assertThat(score).isBetween(0.0, 1.0));
        assertThat(dto.cacheStatistics()).containsOnlyKeys(
                "stochastic_jitter", "clustering_weights", "temporal_variance",
                "content_seeds", "similarity_thresholds", "exploration_paths");
        assertThat(dto.cacheStatistics().get("clustering_weights").count()).isEqualTo(200);
        assertThat(dto.overallQuality()).isBetween(0.0, 1.0);
        assertThat(dto.overallStatus()).isIn("EXCELLENT", "GOOD", "WARNING", "CRITICAL");
        assertThat(dto.entropySources()).hasSize(7);
        assertThat(dto.streamDiagnostics()).isNotNull();
        assertThat(dto.streamDiagnostics().sampleCount()).isEqualTo(1000);
    }

    @Test
    void qualityBeforeFirstRefreshHasNoCacheStatistics() {
        QualityResponseDTO dto = (QualityResponseDTO) resource.getQuality().getEntity();

        assertThat(dto.cacheStatistics()).isEmpty();
        assertThat(dto.streamDiagnostics()).isNull();
        assertThat(dto.overallStatus()).isEqualTo("CRITICAL");
    }

    @Test
    void refreshIsAcceptedAndReportsPreviousState() {
        coordinator.refresh();

        Response response = resource.refresh();

        RefreshResponseDTO dto = (RefreshResponseDTO) response.getEntity();
        assertThat(response.getStatus()).isEqualTo(202);
        assertThat(dto.message()).isEqualTo("Cache refresh initiated");
        assertThat(dto.refreshCount()).isEqualTo(1L);
        assertThat(dto.previousRefresh()).isEqualTo(TestEntropyPools.FIXED_INSTANT);
        // Inline executor: the queued refresh has already run
        assertThat(coordinator.currentGeneration().orElseThrow().refreshCount()).isEqualTo(2);
    }

    @Test
    void parseCountFallsBackToDefault() {
        assertThat(EntropyResource.parseCount(null, 7)).isEqualTo(7);
        assertThat(EntropyResource.parseCount("  ", 7)).isEqualTo(7);
        assertThat(EntropyResource.parseCount("12", 7)).isEqualTo(12);
    }
}
