/* (C)2026 */
package com.ammann.randomness.resource;

import com.ammann.randomness.dto.CacheStatisticsDTO;
import com.ammann.randomness.dto.MixedEntropyResponseDTO;
import com.ammann.randomness.dto.QualityResponseDTO;
import com.ammann.randomness.dto.RefreshResponseDTO;
import com.ammann.randomness.dto.StreamDiagnosticsDTO;
import com.ammann.randomness.enumeration.DerivedCacheType;
import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.CacheStatistics;
import com.ammann.randomness.model.HealthStatus;
import com.ammann.randomness.model.MixedEntropy;
import com.ammann.randomness.model.QualityReport;
import com.ammann.randomness.properties.ApiProperties;
import com.ammann.randomness.service.RandomnessCacheCoordinator;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for derived randomness caches, mixed entropy and quality reporting.
 *
 * <p>Cache reads are served from the published generation and never wait for a refresh in
 * progress. {@code count} is validated before anything else happens; out-of-range values are
 * rejected with 400, never clamped.
 */
@Path(ApiProperties.Entropy.BASE)
@Tag(name = "Entropy API", description = "Derived randomness caches and entropy quality")
@Produces(MediaType.APPLICATION_JSON)
public class EntropyResource {

    private static final Logger LOG = Logger.getLogger(EntropyResource.class);

    @Inject
    RandomnessCacheCoordinator coordinator;

    @GET
    @Path(ApiProperties.Entropy.JITTER)
    @Operation(summary = "Stochastic jitter", description = "Small symmetric perturbations in [-0.1, 0.1]")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Jitter values"),
            @APIResponse(responseCode = "400", description = "count outside 1..1000")
    })
    public Response getJitter(
            @Parameter(description = "Number of values (1-1000, default 10)")
            @QueryParam("count") String count) {
        return scalars(DerivedCacheType.STOCHASTIC_JITTER, count, 10);
    }

    @GET
    @Path(ApiProperties.Entropy.CLUSTERING_WEIGHTS)
    @Operation(summary = "Clustering weights", description = "Five-component weight vectors, each summing to 1")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Weight vectors"),
            @APIResponse(responseCode = "400", description = "count outside 1..100")
    })
    public Response getClusteringWeights(
            @Parameter(description = "Number of vectors (1-100, default 5)")
            @QueryParam("count") String count) {
        int n = parseCount(count, 5);
        List<List<Double>> weights = coordinator.readClusteringWeights(n);
        LOG.debugf("Served %d clustering weight vectors", weights.size());
        return Response.ok(weights).build();
    }

    @GET
    @Path(ApiProperties.Entropy.TEMPORAL_VARIANCE)
    @Operation(summary = "Temporal variance", description = "Multipliers in [0.5, 2.0]")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Variance multipliers"),
            @APIResponse(responseCode = "400", description = "count outside 1..1000")
    })
    public Response getTemporalVariance(
            @Parameter(description = "Number of values (1-1000, default 10)")
            @QueryParam("count") String count) {
        return scalars(DerivedCacheType.TEMPORAL_VARIANCE, count, 10);
    }

    @GET
    @Path(ApiProperties.Entropy.CONTENT_SEEDS)
    @Operation(summary = "Content seeds", description = "Integer seeds in [0, 2^31)")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Seeds"),
            @APIResponse(responseCode = "400", description = "count outside 1..1000")
    })
    public Response getContentSeeds(
            @Parameter(description = "Number of seeds (1-1000, default 10)")
            @QueryParam("count") String count) {
        int n = parseCount(count, 10);
        List<Long> seeds = coordinator.readContentSeeds(n);
        LOG.debugf("Served %d content seeds", seeds.size());
        return Response.ok(seeds).build();
    }

    @GET
    @Path(ApiProperties.Entropy.SIMILARITY_THRESHOLDS)
    @Operation(summary = "Similarity thresholds", description = "Thresholds in [0.1, 0.8]")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Thresholds"),
            @APIResponse(responseCode = "400", description = "count outside 1..1000")
    })
    public Response getSimilarityThresholds(
            @Parameter(description = "Number of values (1-1000, default 10)")
            @QueryParam("count") String count) {
        return scalars(DerivedCacheType.SIMILARITY_THRESHOLDS, count, 10);
    }

    @GET
    @Path(ApiProperties.Entropy.EXPLORATION_PATHS)
    @Operation(summary = "Exploration paths", description = "Unshaped mixed values in [0, 1)")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Exploration values"),
            @APIResponse(responseCode = "400", description = "count outside 1..1000")
    })
    public Response getExplorationPaths(
            @Parameter(description = "Number of values (1-1000, default 50)")
            @QueryParam("count") String count) {
        return scalars(DerivedCacheType.EXPLORATION_PATHS, count, 50);
    }

    @GET
    @Path(ApiProperties.Entropy.MIXED)
    @Operation(summary = "Mixed entropy", description = "Weighted mix of the live sources, optionally restricted to a subset")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Mixed values",
                    content = @Content(schema = @Schema(implementation = MixedEntropyResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "count outside 1..5000 or no known source")
    })
    public Response getMixed(
            @Parameter(description = "Number of values (1-5000, default 100)")
            @QueryParam("count") String count,
            @Parameter(description = "Comma-separated source names; all sources when omitted")
            @QueryParam("sources") String sources) {
        int n = parseCount(count, 100);
        List<String> names = sources == null ? null : Arrays.asList(sources.split(","));

        MixedEntropy mixed = coordinator.mixed(n, names);
        LOG.debugf("Mixed %d values from %d sources", n, mixed.sourcesUsed().size());
        return Response.ok(MixedEntropyResponseDTO.from(mixed)).build();
    }

    @GET
    @Path(ApiProperties.Entropy.QUALITY)
    @Operation(summary = "Entropy quality", description = "Per-source quality scores, cache statistics and stream diagnostics")
    @APIResponse(responseCode = "200", description = "Quality report",
            content = @Content(schema = @Schema(implementation = QualityResponseDTO.class)))
    public Response getQuality() {
        QualityReport report = coordinator.qualityReport();

        Map<String, CacheStatisticsDTO> cacheStatistics = new LinkedHashMap<>();
        for (Map.Entry<DerivedCacheType, CacheStatistics> entry : coordinator.cacheStatistics().entrySet()) {
            cacheStatistics.put(entry.getKey().wireName(), CacheStatisticsDTO.from(entry.getValue()));
        }

        var response = new QualityResponseDTO(
                report.byWireName(),
                cacheStatistics,
                report.overallQuality(),
                report.overallStatus().name(),
                EntropySource.wireNames(),
                coordinator.streamDiagnostics().map(StreamDiagnosticsDTO::from).orElse(null));
        return Response.ok(response).build();
    }

    @POST
    @Path(ApiProperties.Entropy.REFRESH)
    @Operation(summary = "Refresh caches", description = "Queues an asynchronous rebuild of all derived caches")
    @APIResponse(responseCode = "202", description = "Refresh accepted",
            content = @Content(schema = @Schema(implementation = RefreshResponseDTO.class)))
    public Response refresh() {
        HealthStatus before = coordinator.health();
        coordinator.requestRefresh("manual");

        LOG.infof("Manual refresh requested (current refresh #%d)", before.refreshCount());
        var response = new RefreshResponseDTO(
                "Cache refresh initiated", before.lastRefresh(), before.refreshCount());
        return Response.accepted(response).build();
    }

    private Response scalars(DerivedCacheType type, String count, int defaultCount) {
        int n = parseCount(count, defaultCount);
        List<Double> values = coordinator.readScalars(type, n);
        LOG.debugf("Served %d %s values", values.size(), type.wireName());
        return Response.ok(values).build();
    }

    /**
     * Parses a {@code count} query parameter; range checks happen in the coordinator.
     *
     * <p>{@code count} is bound as a string rather than an {@code int}: JAX-RS answers an
     * unparseable primitive query parameter with a bare 404, while a malformed count must
     * produce the same 400 {@code VALIDATION_ERROR} body as an out-of-range one.
     */
    static int parseCount(String raw, int defaultCount) {
        if (raw == null || raw.isBlank()) {
            return defaultCount;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw ValidationException.invalidParameter("count", raw, "an integer");
        }
    }
}
