/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Patient-level KPI document for one admission.
 *
 * @param admissionId   admission identifier
 * @param sectorId      requested sector when the admission passed through it, else empty
 * @param patientId     patient identifier
 * @param status        outcome label when discharged, {@code admitted} otherwise
 * @param admittedAt    admission instant
 * @param dischargedAt  discharge instant, absent while admitted
 * @param totalStayDays days from admission to discharge (or now), two decimals
 * @param ventilation   ventilation summary
 * @param devices       device usage grouped by category
 * @param antibiotics   days of therapy and timelines
 * @param labs          latest results and series
 */
@Schema(description = "Patient-level KPI report")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PatientKpiReportDTO(
        String admissionId,
        String sectorId,
        String patientId,
        String status,
        Instant admittedAt,
        Instant dischargedAt,
        double totalStayDays,
        PatientVentilationDTO ventilation,
        PatientDevicesDTO devices,
        PatientAntibioticsDTO antibiotics,
        LabsDTO labs) {

    public static final String STATUS_ADMITTED = "admitted";
}
