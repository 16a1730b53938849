/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Antibiotic exposure within the period")
public record AntibioticRankingDTO(
        @Schema(description = "Antibiotic name") String name,
        @Schema(description = "Days of therapy overlapping the period, two decimals") double dotDays,
        @Schema(description = "Distinct admissions exposed") long patientsExposed) {}
