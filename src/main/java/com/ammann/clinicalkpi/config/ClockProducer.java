/* (C)2026 */
package com.ammann.clinicalkpi.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.time.Clock;

/**
 * CDI producer for the clock that supplies "now" to report computations.
 *
 * <p>All KPI arithmetic is done in UTC.
 */
@ApplicationScoped
public class ClockProducer {

    @Produces
    @ApplicationScoped
    public Clock utcClock() {
        return Clock.systemUTC();
    }
}
