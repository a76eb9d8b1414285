/* (C)2026 */
package com.ammann.vibration.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralized registry of REST API path constants used by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Diagnosis endpoints
     */
    public static final class Diagnosis {
        private Diagnosis() {}

        public static final String BASE = "/diagnosis";
        public static final String SHEET = BASE + "/sheet";
        public static final String WORKBOOK = BASE + "/workbook";
        public static final String SAMPLE_RATE = BASE + "/sample-rate";
    }

    /**
     * Health check endpoints (Quarkus defaults)
     */
    public static final class Health {
        private Health() {}

        public static final String BASE = "/q/health";
        public static final String LIVE = BASE + "/live";
        public static final String READY = BASE + "/ready";
        public static final String METRICS = "/q/metrics";
        public static final String OPENAPI = "/q/openapi";
    }
}
