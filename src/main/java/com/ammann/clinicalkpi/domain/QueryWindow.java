/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Reporting period {@code [start, end)}.
 *
 * <p>Callers validate {@code start <= end} before building a window.
 */
public record QueryWindow(Instant start, Instant end) {

    public QueryWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /** True when {@code instant} lies in {@code [start, end)}. */
    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && instant.isBefore(end);
    }
}
