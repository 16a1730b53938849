/* (C)2026 */
package com.ammann.clinicalkpi.domain;

import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import java.time.Instant;

/**
 * Read snapshot of one hospital admission.
 *
 * @param admissionId      admission identifier
 * @param patientId        patient the admission belongs to
 * @param admittedAt       admission instant
 * @param dischargedAt     discharge instant, {@code null} while the admission is ongoing
 * @param outcome          recorded outcome, {@link AdmissionOutcome#UNKNOWN} when absent
 * @param destinationLabel free-text discharge destination, may be null
 */
public record Admission(
        String admissionId,
        String patientId,
        Instant admittedAt,
        Instant dischargedAt,
        AdmissionOutcome outcome,
        String destinationLabel) {

    public Admission {
        if (outcome == null) {
            outcome = AdmissionOutcome.UNKNOWN;
        }
    }

    public boolean isOngoing() {
        return dischargedAt == null;
    }
}
