/* (C)2026 */
package com.ammann.clinicalkpi.properties;

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
     * KPI report endpoints
     */
    public static final class Kpi {
        private Kpi() {}

        public static final String BASE = "/kpi";
        public static final String UNIT = BASE + "/unit";
        public static final String PATIENT = BASE + "/patient/{admissionId}";
    }

    /**
     * Sector directory endpoints
     */
    public static final class Sectors {
        private Sectors() {}

        public static final String BASE = "/sectors";
        public static final String ADMITTED = BASE + "/{sectorId}/admitted";
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
