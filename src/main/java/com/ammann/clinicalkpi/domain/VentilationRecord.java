/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Mechanical ventilation history of one admission. Intubation and extubation instants are
 * kept sorted ascending; null instants are dropped on construction.
 */
public record VentilationRecord(
        String admissionId,
        List<Instant> intubations,
        List<Instant> extubations,
        List<TimePeriod> periods) {

    public VentilationRecord {
        intubations = sortedNonNull(intubations);
        extubations = sortedNonNull(extubations);
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    public static VentilationRecord empty(String admissionId) {
        return new VentilationRecord(admissionId, List.of(), List.of(), List.of());
    }

    private static List<Instant> sortedNonNull(List<Instant> instants) {
        if (instants == null) {
            return List.of();
        }
        return instants.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.naturalOrder())
                .toList();
    }
}
