/* (C)2026 */
package com.ammann.clinicalkpi.calculation;

import com.ammann.clinicalkpi.domain.Admission;
import java.util.Locale;

/**
 * Maps discharge records onto the destination vocabulary used by the unit report.
 */
public final class LabelNormalizer {

    public static final String WARD = "ward";
    public static final String DECEASED = "deceased";
    public static final String OTHER_HOSPITAL = "other-hospital";

    private LabelNormalizer() {}

    /**
     * Destination label for a discharged admission.
     *
     * <p>A recorded destination wins (trimmed, lower-cased). Otherwise the outcome decides:
     * deceased and transferred have their own labels, everything else is {@code ward}.
     *
     * @param admission discharged admission
     * @return destination label, never null
     */
    public static String normalizeDestination(Admission admission) {
        String destination = admission.destinationLabel();
        if (destination != null) {
            String normalized = destination.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                return normalized;
            }
        }
        return switch (admission.outcome()) {
            case DECEASED -> DECEASED;
            case TRANSFERRED -> OTHER_HOSPITAL;
            case DISCHARGED_ALIVE, UNKNOWN -> WARD;
        };
    }
}
