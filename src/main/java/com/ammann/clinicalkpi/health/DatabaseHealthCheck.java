/* (C)2026 */
package com.ammann.clinicalkpi.health;

import com.ammann.clinicalkpi.persistence.ClinicalRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.control.ActivateRequestContext;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness health check that verifies the clinical record store answers queries.
 *
 * <p>Reports DOWN if the check query fails or takes longer than 1 second.
 */
@Readiness
@ApplicationScoped
public class DatabaseHealthCheck implements HealthCheck {

    static final String NAME = "database-health";
    private static final long MAX_QUERY_MILLIS = 1000;

    @Inject ClinicalRecordStore store;

    @Override
    @ActivateRequestContext
    public HealthCheckResponse call() {
        try {
            Instant start = Instant.now();
            long admissions = store.countAdmissions();
            Duration queryTime = Duration.between(start, Instant.now());
            boolean performanceOk = queryTime.toMillis() < MAX_QUERY_MILLIS;

            return HealthCheckResponse.named(NAME)
                    .status(performanceOk)
                    .withData("admissions", admissions)
                    .withData("query-time-ms", queryTime.toMillis())
                    .withData("performance-ok", performanceOk)
                    .withData("database-type", "PostgreSQL")
                    .build();

        } catch (Exception e) {
            return HealthCheckResponse.named(NAME)
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .withData("database-accessible", false)
                    .build();
        }
    }
}
