/* (C)2026 */
package com.ammann.clinicalkpi.calculation;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Overlap arithmetic between episodes and reporting windows.
 *
 * <p>All instants are UTC-normalized {@link Instant}s. Episodes may be open-ended; an open
 * episode runs up to the caller-supplied {@code now}. A missing or degenerate interval
 * contributes no overlap instead of failing the whole computation.
 */
public final class IntervalMath {

    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double SECONDS_PER_HOUR = 3_600.0;

    private IntervalMath() {}

    /**
     * Seconds shared by {@code [aStart, aEnd]} and {@code [windowStart, windowEnd)}.
     *
     * @param aStart      episode start; {@code null} yields 0
     * @param aEnd        episode end; {@code null} means open and is replaced by {@code now}
     * @param windowStart window start (inclusive)
     * @param windowEnd   window end (exclusive)
     * @param now         upper bound for open episodes
     * @return overlap in seconds, never negative
     */
    public static double overlapSeconds(
            Instant aStart, Instant aEnd, Instant windowStart, Instant windowEnd, Instant now) {
        if (aStart == null || windowStart == null || windowEnd == null) {
            return 0.0;
        }
        Instant effectiveEnd = aEnd != null ? aEnd : now;
        if (effectiveEnd == null) {
            return 0.0;
        }

        Instant from = aStart.isAfter(windowStart) ? aStart : windowStart;
        Instant to = effectiveEnd.isBefore(windowEnd) ? effectiveEnd : windowEnd;
        if (!to.isAfter(from)) {
            return 0.0;
        }
        return toSeconds(Duration.between(from, to));
    }

    /**
     * Seconds between two instants, 0 if either is missing or {@code end} precedes {@code start}.
     */
    public static double durationSeconds(Instant start, Instant end) {
        if (start == null || end == null || end.isBefore(start)) {
            return 0.0;
        }
        return toSeconds(Duration.between(start, end));
    }

    /**
     * Signed hours from {@code from} to {@code to}.
     */
    public static double hoursBetween(Instant from, Instant to) {
        return toSeconds(Duration.between(from, to)) / SECONDS_PER_HOUR;
    }

    public static double days(double seconds) {
        return seconds / SECONDS_PER_DAY;
    }

    /**
     * Parses an ISO-8601 timestamp that carries an explicit offset ({@code Z} or
     * {@code +hh:mm}).
     *
     * @param text timestamp text
     * @return the instant, or {@code null} if the text is blank, unparsable or has no offset
     */
    public static Instant parseOffsetInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static double toSeconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }
}
