/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.time.Instant;

/**
 * A start/end pair used for ventilation sub-periods and antibiotic dosing periods.
 *
 * @param start     period start
 * @param end       period end, {@code null} when still running
 * @param endSource how the end was recorded (e.g. "extubation"), may be null
 */
public record TimePeriod(Instant start, Instant end, String endSource) {

    public TimePeriod(Instant start, Instant end) {
        this(start, end, null);
    }

    public boolean isOpen() {
        return end == null;
    }
}
