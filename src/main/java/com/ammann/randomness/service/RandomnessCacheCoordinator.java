/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.config.ExecutorProducer;
import com.ammann.randomness.enumeration.CacheState;
import com.ammann.randomness.enumeration.DerivedCacheType;
import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.exception.NotReadyException;
import com.ammann.randomness.exception.ValidationException;
import com.ammann.randomness.model.CacheStatistics;
import com.ammann.randomness.model.DerivedCache;
import com.ammann.randomness.model.EntropyPool;
import com.ammann.randomness.model.Generation;
import com.ammann.randomness.model.HealthStatus;
import com.ammann.randomness.model.MixedEntropy;
import com.ammann.randomness.model.QualityReport;
import com.ammann.randomness.model.StreamDiagnostics;
import com.ammann.randomness.service.UniformityStatisticsService.KolmogorovSmirnovResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Owns the published generation of derived caches and everything that replaces it.
 *
 * <p>Lifecycle: {@code EMPTY -> READY -> REFRESHING -> READY}. Readers only ever dereference
 * an {@link AtomicReference} to an immutable {@link Generation}, so they never wait for a
 * refresh and never see a partially built one. Builders serialize on a private lock that
 * readers never take.
 *
 * <p>Refresh triggers (the periodic scheduler and the HTTP endpoint) go through
 * {@link #requestRefresh(String)}, a coalescing queue of depth one drained on the
 * {@value ExecutorProducer#REFRESH_EXECUTOR}: at most one build runs at a time, and any
 * number of requests arriving while it runs collapse into exactly one follow-up build.
 *
 * <p>A failed build is logged and counted; the previously published generation stays in
 * place and the next trigger retries.
 */
@ApplicationScoped
public class RandomnessCacheCoordinator {

    private static final Logger LOG = Logger.getLogger(RandomnessCacheCoordinator.class);

    static final int DEFAULT_TOTAL_SIZE = 10_000;
    static final Duration DEFAULT_STALENESS_THRESHOLD = Duration.ofMinutes(10);

    /** Largest {@code count} accepted by {@link #mixed(int, List)}. */
    public static final int MIXED_MAX_COUNT = 5000;

    /** Mixed values examined by {@link #streamDiagnostics()}. */
    static final int DIAGNOSTIC_SAMPLE_COUNT = 1000;

    @Inject
    SourceCollector collector;

    @Inject
    EntropyMixer mixer;

    @Inject
    DerivedCacheBuilder builder;

    @Inject
    QualityAnalyzer analyzer;

    @Inject
    UniformityStatisticsService statistics;

    @Inject
    @Named(ExecutorProducer.REFRESH_EXECUTOR)
    Executor refreshExecutor;

    @Inject
    MeterRegistry meterRegistry;

    /** Length of the mixed stream every generation is cut from. */
    @ConfigProperty(name = "randomness.cache.total-size", defaultValue = "10000")
    int totalSize = DEFAULT_TOTAL_SIZE;

    /** Maximum age of the live pool before health reports degraded. */
    @ConfigProperty(name = "randomness.health.staleness-threshold", defaultValue = "600s")
    Duration stalenessThreshold = DEFAULT_STALENESS_THRESHOLD;

    // Visible for testing
    Clock clock = Clock.systemUTC();

    private final AtomicReference<Generation> current = new AtomicReference<>();
    private final ReentrantLock buildLock = new ReentrantLock();
    private volatile boolean building;

    private final Object queueLock = new Object();
    private CompletableFuture<Generation> queuedRefresh; // guarded by queueLock
    private boolean draining; // guarded by queueLock

    private Counter refreshCounter;
    private Counter refreshFailureCounter;
    private Counter coalescedCounter;
    private Timer refreshTimer;

    /**
     * Registers refresh metrics. Safe when no registry is available.
     */
    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - refresh metrics disabled");
            return;
        }

        refreshCounter = Counter.builder("randomness_refresh_total")
                .description("Generations successfully built and published")
                .register(meterRegistry);
        refreshFailureCounter = Counter.builder("randomness_refresh_failures_total")
                .description("Refresh cycles that failed and kept the previous generation")
                .register(meterRegistry);
        coalescedCounter = Counter.builder("randomness_refresh_coalesced_total")
                .description("Refresh requests merged into an already queued refresh")
                .register(meterRegistry);
        refreshTimer = Timer.builder("randomness_refresh_duration")
                .description("Time to collect, mix and build one generation")
                .register(meterRegistry);
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    /**
     * Returns the first {@code count} values of a derived cache from the published generation.
     *
     * <p>Builds synchronously only if nothing was ever published.
     *
     * @param type  cache to read
     * @param count number of values, within {@code [1, type.maxCount()]}
     * @return up to {@code count} values; element type depends on {@code type}
     * @throws ValidationException if {@code count} is out of bounds
     * @throws NotReadyException if no generation exists and one cannot be built
     */
    public List<?> read(DerivedCacheType type, int count) {
        validateCount(type.wireName(), count, type.maxCount());
        return ensureGeneration().cache(type).head(count);
    }

    /**
     * Typed read for the scalar caches (jitter, variance, thresholds, exploration paths).
     */
    public List<Double> readScalars(DerivedCacheType type, int count) {
        validateCount(type.wireName(), count, type.maxCount());
        return ensureGeneration().scalarCache(type).head(count);
    }

    /**
     * Typed read for the five-component clustering weight vectors.
     */
    public List<List<Double>> readClusteringWeights(int count) {
        DerivedCacheType type = DerivedCacheType.CLUSTERING_WEIGHTS;
        validateCount(type.wireName(), count, type.maxCount());
        return ensureGeneration().clusteringWeights().head(count);
    }

    /**
     * Typed read for the integer content seeds.
     */
    public List<Long> readContentSeeds(int count) {
        DerivedCacheType type = DerivedCacheType.CONTENT_SEEDS;
        validateCount(type.wireName(), count, type.maxCount());
        return ensureGeneration().contentSeeds().head(count);
    }

    /**
     * Mixes {@code count} values from the live pool.
     *
     * @param count       number of values, within {@code [1, MIXED_MAX_COUNT]}
     * @param sourceNames wire names of the sources to mix, {@code null} for all
     * @throws ValidationException if {@code count} is out of bounds or no source name is known
     */
    public MixedEntropy mixed(int count, List<String> sourceNames) {
        validateCount("mixed", count, MIXED_MAX_COUNT);
        List<EntropySource> sources = mixer.resolveSources(sourceNames);
        ensureGeneration();

        EntropyPool pool = collector.currentPool();
        double[] values = mixer.mix(pool, count, sources);
        return new MixedEntropy(
                Arrays.stream(values).boxed().toList(),
                sources,
                analyzer.assess(pool),
                clock.instant(),
                pool.refreshCount());
    }

    public Optional<Generation> currentGeneration() {
        return Optional.ofNullable(current.get());
    }

    public CacheState state() {
        if (current.get() == null) {
            return CacheState.EMPTY;
        }
        return building ? CacheState.REFRESHING : CacheState.READY;
    }

    // -------------------------------------------------------------------------
    // Refresh
    // -------------------------------------------------------------------------

    /**
     * Builds and publishes a new generation on the calling thread.
     *
     * <p>Waits for any build already running, then runs its own.
     */
    public void refresh() {
        buildAndPublish("direct");
    }

    /**
     * Asks for a refresh without waiting for it.
     *
     * <p>If no refresh is queued, one is queued; otherwise this request joins the queued one.
     * Either way the returned future completes with a generation whose build started after
     * this call, or exceptionally if that build failed.
     *
     * @param trigger short label for logs, e.g. {@code scheduled} or {@code manual}
     * @return completion signal for the refresh covering this request
     */
    public CompletableFuture<Generation> requestRefresh(String trigger) {
        CompletableFuture<Generation> ticket;
        boolean startDrain;
        synchronized (queueLock) {
            if (queuedRefresh == null) {
                queuedRefresh = new CompletableFuture<>();
                LOG.debugf("Refresh queued (%s)", trigger);
            } else {
                increment(coalescedCounter);
                LOG.debugf("Refresh request (%s) coalesced into the queued refresh", trigger);
            }
            ticket = queuedRefresh;
            startDrain = !draining;
            draining = true;
        }

        if (startDrain) {
            try {
                refreshExecutor.execute(() -> drainRefreshQueue(trigger));
            } catch (RejectedExecutionException e) {
                synchronized (queueLock) {
                    draining = false;
                    if (queuedRefresh == ticket) {
                        queuedRefresh = null;
                    }
                }
                LOG.errorf(e, "Refresh executor rejected refresh (%s)", trigger);
                ticket.completeExceptionally(e);
            }
        }
        return ticket;
    }

    private void drainRefreshQueue(String trigger) {
        boolean drained = false;
        try {
            while (true) {
                CompletableFuture<Generation> ticket;
                synchronized (queueLock) {
                    ticket = queuedRefresh;
                    queuedRefresh = null;
                    if (ticket == null) {
                        draining = false;
                        drained = true;
                        return;
                    }
                }
                try {
                    ticket.complete(buildAndPublish(trigger));
                } catch (RuntimeException e) {
                    ticket.completeExceptionally(e);
                }
            }
        } finally {
            if (!drained) {
                synchronized (queueLock) {
                    draining = false;
                }
            }
        }
    }

    private Generation ensureGeneration() {
        Generation generation = current.get();
        if (generation != null) {
            return generation;
        }

        buildLock.lock();
        try {
            generation = current.get();
            if (generation != null) {
                return generation;
            }
            LOG.info("No generation published yet - building synchronously for first read");
            return buildAndPublish("first-read");
        } catch (RuntimeException e) {
            throw new NotReadyException("Randomness cache is not ready: " + e.getMessage(), e);
        } finally {
            buildLock.unlock();
        }
    }

    private Generation buildAndPublish(String trigger) {
        buildLock.lock();
        building = true;
        long startNanos = System.nanoTime();
        try {
            EntropyPool pool = collector.collect();
            double[] stream = mixer.mix(pool, Math.max(1, totalSize));
            QualityReport quality = analyzer.assess(pool);
            Generation next = builder.build(pool, stream, quality, clock.instant());

            current.set(next);
            increment(refreshCounter);
            LOG.infof("Published generation #%d (%s): %d mixed values, overall quality %.3f",
                    next.refreshCount(), trigger, stream.length, quality.overallQuality());
            return next;

        } catch (RuntimeException e) {
            increment(refreshFailureCounter);
            Generation kept = current.get();
            LOG.errorf(e, "Refresh (%s) failed - keeping generation #%s",
                    trigger, kept != null ? kept.refreshCount() : "none");
            throw e;
        } finally {
            if (refreshTimer != null) {
                refreshTimer.record(Duration.ofNanos(System.nanoTime() - startNanos));
            }
            building = false;
            buildLock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Quality and health
    // -------------------------------------------------------------------------

    /**
     * Scores the live pool. Never waits for a refresh.
     */
    public QualityReport qualityReport() {
        return analyzer.assess(collector.currentPool());
    }

    /**
     * Uniformity and lag-1 correlation of a mixed stream drawn from the live pool.
     *
     * @return diagnostics, or empty before the first collection
     */
    public Optional<StreamDiagnostics> streamDiagnostics() {
        EntropyPool pool = collector.currentPool();
        if (pool.isEmpty()) {
            return Optional.empty();
        }
        double[] stream = mixer.mix(pool, DIAGNOSTIC_SAMPLE_COUNT);
        KolmogorovSmirnovResult ks = statistics.kolmogorovSmirnovUniform(stream);
        return Optional.of(new StreamDiagnostics(
                stream.length,
                ks.statistic(),
                ks.pValue(),
                statistics.lagOneAutocorrelation(stream),
                pool.refreshCount()));
    }

    /**
     * Count, age and refresh count of every cache in the published generation.
     *
     * @return statistics per cache type; empty before the first generation
     */
    public Map<DerivedCacheType, CacheStatistics> cacheStatistics() {
        Map<DerivedCacheType, CacheStatistics> result = new EnumMap<>(DerivedCacheType.class);
        Generation generation = current.get();
        if (generation == null) {
            return result;
        }
        Instant now = clock.instant();
        generation.caches().forEach((type, cache) -> result.put(type, statisticsOf(cache, now)));
        return result;
    }

    /**
     * Degraded if nothing was ever published or the live pool is older than the staleness
     * threshold.
     */
    public HealthStatus health() {
        EntropyPool pool = collector.currentPool();
        boolean populated = current.get() != null;
        boolean fresh = pool.lastRefresh() != null
                && pool.age(clock.instant()).compareTo(stalenessThreshold) < 0;
        return new HealthStatus(populated, fresh, state(), pool.lastRefresh(), pool.refreshCount());
    }

    private static CacheStatistics statisticsOf(DerivedCache<?> cache, Instant now) {
        return new CacheStatistics(
                cache.metadata().count(),
                Duration.between(cache.metadata().generatedAt(), now),
                cache.metadata().refreshCount());
    }

    private static void validateCount(String target, int count, int max) {
        if (count < 1 || count > max) {
            throw ValidationException.countOutOfRange(target, count, 1, max);
        }
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
