/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceDayAggregate;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import java.util.List;
import java.util.Map;

/**
 * Every record a unit report needs, fetched once.
 *
 * @param sectorId             target sector
 * @param window               reporting window
 * @param presenceStays        sector stays overlapping the window
 * @param cohortAdmissions     admissions of the presence cohort, by id
 * @param dischargedAdmissions admissions discharged inside the window, any sector
 * @param dischargedStays      sector stays of {@code dischargedAdmissions}, any time
 * @param patientAdmissions    all admissions of the discharged patients
 * @param patientSectorStays   sector stays of {@code patientAdmissions}, any time
 * @param ventilation          ventilation records of the presence cohort
 * @param deviceDays           device-day rollup of the sector and window
 * @param antibiotics          antibiotic usages of the presence cohort
 */
public record UnitSnapshot(
        String sectorId,
        QueryWindow window,
        List<SectorStay> presenceStays,
        Map<String, Admission> cohortAdmissions,
        List<Admission> dischargedAdmissions,
        List<SectorStay> dischargedStays,
        List<Admission> patientAdmissions,
        List<SectorStay> patientSectorStays,
        List<VentilationRecord> ventilation,
        DeviceDayAggregate deviceDays,
        List<AntibioticUsagePeriod> antibiotics) {

    public UnitSnapshot {
        presenceStays = List.copyOf(presenceStays);
        cohortAdmissions = Map.copyOf(cohortAdmissions);
        dischargedAdmissions = List.copyOf(dischargedAdmissions);
        dischargedStays = List.copyOf(dischargedStays);
        patientAdmissions = List.copyOf(patientAdmissions);
        patientSectorStays = List.copyOf(patientSectorStays);
        ventilation = List.copyOf(ventilation);
        deviceDays = deviceDays != null ? deviceDays : DeviceDayAggregate.EMPTY;
        antibiotics = List.copyOf(antibiotics);
    }

    /** Snapshot of a sector with no records at all. */
    public static UnitSnapshot empty(String sectorId, QueryWindow window) {
        return new UnitSnapshot(
                sectorId,
                window,
                List.of(),
                Map.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                List.of(),
                DeviceDayAggregate.EMPTY,
                List.of());
    }
}
