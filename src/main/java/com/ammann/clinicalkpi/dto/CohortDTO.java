/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Presence cohort of the reporting period")
public record CohortDTO(
        @Schema(description = "Criterion used to build the cohort") String criterion,
        @Schema(description = "Admissions present in the sector during the period") long count) {

    public static final String PRESENCE_IN_SECTOR = "presence-in-sector";

    public static CohortDTO presence(long count) {
        return new CohortDTO(PRESENCE_IN_SECTOR, count);
    }
}
