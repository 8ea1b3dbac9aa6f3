/* (C)2026 */
package com.ammann.randomness.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Registry of REST path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Service information at the root path. */
    public static final String ROOT = "/";

    /**
     * Derived cache, mixing and quality endpoints
     */
    public static final class Entropy {
        private Entropy() {}

        public static final String BASE = "/entropy";
        public static final String JITTER = "/jitter";
        public static final String CLUSTERING_WEIGHTS = "/clustering-weights";
        public static final String TEMPORAL_VARIANCE = "/temporal-variance";
        public static final String CONTENT_SEEDS = "/content-seeds";
        public static final String SIMILARITY_THRESHOLDS = "/similarity-thresholds";
        public static final String EXPLORATION_PATHS = "/exploration-paths";
        public static final String MIXED = "/mixed";
        public static final String QUALITY = "/quality";
        public static final String REFRESH = "/refresh";
    }

    /**
     * Service health endpoints
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/health";
        public static final String READY = "/q/health/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
