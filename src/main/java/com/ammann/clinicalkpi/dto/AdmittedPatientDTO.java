/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Admission currently present in a sector")
public record AdmittedPatientDTO(
        String patientId,
        String admissionId,
        @Schema(description = "Hospital admission instant") Instant admittedAt,
        @Schema(description = "Start of the open stay in the sector") Instant inSectorSince) {}
