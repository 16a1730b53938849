/* (C)2026 */
package com.ammann.clinicalkpi.enumeration;

import java.util.Locale;

/**
 * Outcome recorded when an admission ends.
 *
 * <p>Stored codes follow the hospital information system export
 * ({@code alta}, {@code obito}, {@code transferencia}); English aliases are accepted too.
 */
public enum AdmissionOutcome {
    DISCHARGED_ALIVE("alta", "discharged"),
    DECEASED("obito", "deceased"),
    TRANSFERRED("transferencia", "transferred"),
    UNKNOWN("unknown", "unknown");

    private final String sourceCode;
    private final String label;

    AdmissionOutcome(String sourceCode, String label) {
        this.sourceCode = sourceCode;
        this.label = label;
    }

    public String getSourceCode() {
        return sourceCode;
    }

    /** Lower-case label used in output documents. */
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a stored outcome code. Blank or unrecognized codes map to {@link #UNKNOWN}.
     *
     * @param code stored outcome code, may be null
     * @return matching outcome, never null
     */
    public static AdmissionOutcome fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AdmissionOutcome outcome : values()) {
            if (outcome.sourceCode.equals(normalized)
                    || outcome.label.equals(normalized)
                    || outcome.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return outcome;
            }
        }
        return UNKNOWN;
    }
}
