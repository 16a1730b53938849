/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Days of therapy for one antibiotic")
public record DrugTherapyDaysDTO(
        @Schema(description = "Antibiotic name") String name,
        @Schema(description = "Days of therapy, two decimals") double dotDays) {}
