/* (C)2026 */
package com.ammann.calibration.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used across all JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Fusion endpoints
     */
    public static final class Fusion {
        private Fusion() {}

        public static final String BASE = "/fusion";
        public static final String EVALUATE = "/evaluate";
    }

    /**
     * Calibration inspection and governor endpoints
     */
    public static final class Calibration {
        private Calibration() {}

        public static final String BASE = "/calibration";
        public static final String SUMMARY = "/summary";
        public static final String LAYERS = "/layers";
        public static final String LAYER_DRIFT = LAYERS + "/{layerId}/drift";
        public static final String BOUNDED_PRODUCT = "/governor/bounded-product";
    }

    /**
     * Audit manifest endpoints
     */
    public static final class Manifest {
        private Manifest() {}

        public static final String BASE = "/manifest";
        public static final String ENTRIES = "/entries";
        public static final String ENTRY = ENTRIES + "/{sequence}";
        public static final String ENTRY_VERIFY = ENTRY + "/verify";
        public static final String VERIFY = "/verify";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
    }
}
