/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Length of stay inside the sector and window, per presence-cohort admission, in days.
 * {@code byDischarge} holds the classic admission-to-discharge LOS of the discharge cohort.
 */
@Schema(description = "Length of stay in days")
public record LengthOfStayDTO(
        @Schema(description = "Mean LOS within the period") double mean,
        @Schema(description = "Median LOS within the period") double median,
        @Schema(description = "P90 LOS within the period") double p90,
        @Schema(description = "Admissions contributing") long count,
        @Schema(description = "Admission-to-discharge LOS of admissions discharged in the period")
                DistributionDTO byDischarge) {

    public static LengthOfStayDTO of(DistributionDTO inWindow, DistributionDTO byDischarge) {
        return new LengthOfStayDTO(
                inWindow.mean(), inWindow.median(), inWindow.p90(), inWindow.count(), byDischarge);
    }
}
