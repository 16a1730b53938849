/* (C)2026 */
package com.ammann.clinicalkpi.dto;

import com.ammann.clinicalkpi.calculation.StatisticsAggregator;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Device-day utilization and patient prevalence for one device type.
 *
 * @param deviceDays      days with the device in place
 * @param patientDays     admission-days in the sector and window
 * @param utilizationRate deviceDays / patientDays
 * @param patients        distinct admissions with the device on at least one day
 * @param totalPatients   distinct admissions with any day in the window
 * @param patientRate     patients / totalPatients
 */
@Schema(description = "Device utilization")
public record DeviceUtilizationDTO(
        long deviceDays,
        long patientDays,
        double utilizationRate,
        long patients,
        long totalPatients,
        double patientRate) {

    private static final int RATE_PRECISION = 4;

    public static DeviceUtilizationDTO of(
            long deviceDays, long patientDays, long patients, long totalPatients) {
        return new DeviceUtilizationDTO(
                deviceDays,
                patientDays,
                StatisticsAggregator.safeRatio(deviceDays, patientDays, RATE_PRECISION),
                patients,
                totalPatients,
                StatisticsAggregator.safeRatio(patients, totalPatients, RATE_PRECISION));
    }
}
