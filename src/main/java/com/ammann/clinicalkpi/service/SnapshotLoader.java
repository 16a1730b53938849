/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.enumeration.LabTest;
import com.ammann.clinicalkpi.exception.ResourceNotFoundException;
import com.ammann.clinicalkpi.persistence.ClinicalRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Reads every record one report needs from the {@link ClinicalRecordStore}, once, into an
 * immutable snapshot. The assembler then works on the snapshot without further I/O.
 */
@ApplicationScoped
public class SnapshotLoader {

    private static final Logger LOG = Logger.getLogger(SnapshotLoader.class);

    @Inject ClinicalRecordStore store;

    /**
     * Loads the records of a sector and window.
     *
     * @param sectorId target sector
     * @param window   reporting window
     * @return snapshot for {@link KpiDocumentAssembler#assembleUnitReport}
     */
    public UnitSnapshot loadUnit(String sectorId, QueryWindow window) {
        List<SectorStay> presenceStays = store.fetchSectorStaysOverlapping(sectorId, window);
        Set<String> presenceIds = admissionIdsOf(presenceStays);

        Map<String, Admission> cohortAdmissions =
                store.fetchAdmissions(presenceIds).stream()
                        .collect(Collectors.toMap(Admission::admissionId, Function.identity(), (a, b) -> a));

        List<Admission> discharged = store.fetchAdmissionsDischargedIn(window);
        List<SectorStay> dischargedStays =
                store.fetchSectorStaysFor(sectorId, discharged.stream().map(Admission::admissionId).toList());

        Set<String> patientIds =
                discharged.stream()
                        .map(Admission::patientId)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toCollection(TreeSet::new));
        List<Admission> patientAdmissions = store.fetchAdmissionsOfPatients(patientIds);
        List<SectorStay> patientSectorStays =
                store.fetchSectorStaysFor(
                        sectorId, patientAdmissions.stream().map(Admission::admissionId).toList());

        UnitSnapshot snapshot =
                new UnitSnapshot(
                        sectorId,
                        window,
                        presenceStays,
                        cohortAdmissions,
                        discharged,
                        dischargedStays,
                        patientAdmissions,
                        patientSectorStays,
                        store.fetchVentilationRecords(presenceIds),
                        store.fetchDeviceDayAggregate(sectorId, window),
                        store.fetchAntibioticUsage(presenceIds));

        LOG.debugf(
                "Loaded unit snapshot for sector=%s: %d stays, %d discharges, %d patient admissions",
                sectorId, presenceStays.size(), discharged.size(), patientAdmissions.size());
        return snapshot;
    }

    /**
     * Loads the records of a single admission.
     *
     * @param admissionId admission to report on
     * @param sectorId    optional sector echoed in the report when the admission passed through it
     * @return snapshot for {@link KpiDocumentAssembler#assemblePatientReport}
     * @throws ResourceNotFoundException when the admission does not exist
     */
    public PatientSnapshot loadPatient(String admissionId, String sectorId) {
        Admission admission =
                store.fetchAdmission(admissionId)
                        .orElseThrow(() -> ResourceNotFoundException.admission(admissionId));

        boolean passedThroughSector =
                sectorId != null && !sectorId.isBlank() && store.hasStayInSector(admissionId, sectorId);

        VentilationRecord ventilation =
                store.fetchVentilationRecords(List.of(admissionId)).stream()
                        .filter(v -> admissionId.equals(v.admissionId()))
                        .findFirst()
                        .orElse(VentilationRecord.empty(admissionId));

        return new PatientSnapshot(
                admission,
                sectorId,
                passedThroughSector,
                ventilation,
                store.fetchDeviceUsage(admissionId),
                store.fetchAntibioticUsage(List.of(admissionId)),
                store.fetchLabResults(admissionId, LabTest.lookupNames()));
    }

    private static Set<String> admissionIdsOf(List<SectorStay> stays) {
        return stays.stream()
                .map(SectorStay::admissionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
