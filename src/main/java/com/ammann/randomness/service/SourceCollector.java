/* (C)2026 */
package com.ammann.randomness.service;

import com.ammann.randomness.enumeration.EntropySource;
import com.ammann.randomness.model.EntropyPool;
import jakarta.enterprise.context.ApplicationScoped;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Collects fresh observation vectors for all seven entropy sources.
 *
 * <p>Apart from {@link EntropySource#CRYPTO_SECURE}, every source is a deterministic function
 * of the wall clock and an internal draw counter. Two collections under a fixed clock still
 * differ because the counter advances with every observation. This is pseudo-randomness for
 * statistical variety, not key material.
 *
 * <p>The collector owns the live {@link EntropyPool}. {@link #collect()} replaces it wholesale
 * and increments its refresh count; everything else only reads immutable snapshots through
 * {@link #currentPool()}.
 */
@ApplicationScoped
public class SourceCollector {

    private static final Logger LOG = Logger.getLogger(SourceCollector.class);

    static final int DEFAULT_SAMPLE_SIZE = 100;

    private static final double TWO_POW_32 = 4_294_967_296.0;
    private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;
    private static final int FRACTION_RESOLUTION = 10_000;

    /** Observations collected per source on every cycle. */
    @ConfigProperty(name = "randomness.source.sample-size", defaultValue = "100")
    int sampleSize = DEFAULT_SAMPLE_SIZE;

    // Visible for testing: replaced with a fixed clock to make collections reproducible
    Clock clock = Clock.systemUTC();

    // Visible for testing: replaced with a seeded generator to make CRYPTO_SECURE reproducible
    Random secureRandom = new SecureRandom();

    private final AtomicLong drawCounter = new AtomicLong();
    private final AtomicReference<EntropyPool> livePool = new AtomicReference<>(EntropyPool.empty());

    /**
     * Runs one collection cycle and publishes the result as the live pool.
     *
     * <p>Synchronized so that concurrent callers cannot interleave refresh counts.
     *
     * @return the newly published pool
     */
    public synchronized EntropyPool collect() {
        Instant now = clock.instant();
        long refreshCount = livePool.get().refreshCount() + 1;
        int n = Math.max(1, sampleSize);

        Map<EntropySource, double[]> observations = new EnumMap<>(EntropySource.class);
        observations.put(EntropySource.SYSTEM_TIME, systemTime(now, n));
        observations.put(EntropySource.CRYPTO_SECURE, cryptoSecure(n));
        observations.put(EntropySource.ATMOSPHERIC, atmospheric(now, n));
        observations.put(EntropySource.MATHEMATICAL, mathematical(now, n));
        observations.put(EntropySource.QUANTUM_SIM, quantumSim(now, n));
        observations.put(EntropySource.CONTENT_HASH, contentHash(now, refreshCount, n));
        observations.put(EntropySource.TEMPORAL_DRIFT, temporalDrift(now, n));

        EntropyPool pool = new EntropyPool(observations, now, refreshCount);
        livePool.set(pool);

        LOG.debugf("Collected %d observations from %d sources (refresh #%d)",
                Integer.valueOf(n), Integer.valueOf(observations.size()), Long.valueOf(refreshCount));
        return pool;
    }

    /**
     * Returns the live pool; {@link EntropyPool#empty()} before the first collection.
     */
    public EntropyPool currentPool() {
        return livePool.get();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private double[] systemTime(Instant now, int n) {
        long epochNanos = epochNanos(now);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            long reading = mix64(epochNanos + nextDraw() * GOLDEN_GAMMA);
            values[i] = Math.floorMod(reading, FRACTION_RESOLUTION) / (double) FRACTION_RESOLUTION;
        }
        return values;
    }

    private double[] cryptoSecure(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = (secureRandom.nextInt() & 0xFFFFFFFFL) / TWO_POW_32;
        }
        return values;
    }

    private double[] atmospheric(Instant now, int n) {
        double seconds = epochSeconds(now);
        long draw = nextDraw();
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            String reading = (seconds + i * 0.001) + ":" + draw;
            int noise = fmix32(reading.hashCode());
            values[i] = Math.floorMod(noise, FRACTION_RESOLUTION) / (double) FRACTION_RESOLUTION;
        }
        return values;
    }

    private double[] mathematical(Instant now, int n) {
        double seconds = epochSeconds(now);
        // Growth parameter stays in [3.801, 3.999]: chaotic and bounded below 1
        double r = 3.9 + 0.099 * Math.sin(seconds * 0.1);
        double x = 0.1 + 0.8 * unitInterval(mix64(epochNanos(now) ^ nextDraw() * GOLDEN_GAMMA));
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            x = r * x * (1.0 - x);
            values[i] = x;
        }
        return values;
    }

    private double[] quantumSim(Instant now, int n) {
        Random phases = new Random(mix64(epochNanos(now) + nextDraw() * GOLDEN_GAMMA));
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            double phase = phases.nextDouble() * 2.0 * Math.PI;
            double amplitude = Math.sin(phase);
            values[i] = amplitude * amplitude;
        }
        return values;
    }

    private double[] contentHash(Instant now, long refreshCount, int n) {
        MessageDigest digest = sha256();
        String base = "randomness_" + epochSeconds(now) + "_" + refreshCount;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            byte[] hash = digest.digest((base + "_" + i).getBytes(StandardCharsets.UTF_8));
            long leading = ByteBuffer.wrap(hash, 0, 4).getInt() & 0xFFFFFFFFL;
            values[i] = leading / TWO_POW_32;
        }
        return values;
    }

    private double[] temporalDrift(Instant now, int n) {
        double seconds = epochSeconds(now);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            double drift = Math.sin(seconds * 0.01 + i * 0.1) * Math.cos(seconds * 0.007 + i * 0.13);
            values[i] = (drift + 1.0) / 2.0;
        }
        return values;
    }

    private long nextDraw() {
        return drawCounter.incrementAndGet();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }

    private static long epochNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    private static double unitInterval(long bits) {
        return (bits >>> 11) * 0x1.0p-53;
    }

    /** SplitMix64 finalizer. */
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    /** MurmurHash3 32-bit finalizer. */
    private static int fmix32(int h) {
        h ^= h >>> 16;
        h *= 0x85EBCA6B;
        h ^= h >>> 13;
        h *= 0xC2B2AE35;
        h ^= h >>> 16;
        return h;
    }
}
