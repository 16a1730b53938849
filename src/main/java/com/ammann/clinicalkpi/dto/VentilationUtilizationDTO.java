/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Mechanical ventilation utilization and timing")
public record VentilationUtilizationDTO(
        @Schema(description = "Ventilated days") long deviceDays,
        @Schema(description = "Admission-days in the period") long patientDays,
        @Schema(description = "deviceDays / patientDays") double utilizationRate,
        @Schema(description = "Distinct ventilated admissions") long patients,
        @Schema(description = "Distinct admissions with any day in the period") long totalPatients,
        @Schema(description = "patients / totalPatients") double patientRate,
        @Schema(description = "Hours from admission to first intubation")
                DistributionDTO timeToFirstIntubationHours,
        @Schema(description = "Ventilated days overlapping the period, per ventilated admission")
                DistributionDTO ventilatedDaysInWindow) {

    public static VentilationUtilizationDTO of(
            DeviceUtilizationDTO utilization,
            DistributionDTO timeToFirstIntubationHours,
            DistributionDTO ventilatedDaysInWindow) {
        return new VentilationUtilizationDTO(
                utilization.deviceDays(),
                utilization.patientDays(),
                utilization.utilizationRate(),
                utilization.patients(),
                utilization.totalPatients(),
                utilization.patientRate(),
                timeToFirstIntubationHours,
                ventilatedDaysInWindow);
    }
}
