/* (C)2026 */
package com.ammann.clinicalkpi.persistence;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceDayAggregate;
import com.ammann.clinicalkpi.domain.DeviceUsage;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the clinical records the KPI reports are computed from, plus the
 * snapshot upsert.
 *
 * <p>Every method fails with {@link com.ammann.clinicalkpi.exception.StorageException}
 * when the underlying store is unreachable. Methods taking an id collection return an
 * empty result for an empty collection without touching the store.
 */
public interface ClinicalRecordStore {

    /** Admissions of any sector with {@code dischargedAt} inside the window. */
    List<Admission> fetchAdmissionsDischargedIn(QueryWindow window);

    /** Stays in the sector that start before the window end and are open or end at/after its start. */
    List<SectorStay> fetchSectorStaysOverlapping(String sectorId, QueryWindow window);

    /** All stays of the given admissions in the sector, regardless of time. */
    List<SectorStay> fetchSectorStaysFor(String sectorId, Collection<String> admissionIds);

    List<Admission> fetchAdmissions(Collection<String> admissionIds);

    /** Every admission of the given patients, ordered by admission instant. */
    List<Admission> fetchAdmissionsOfPatients(Collection<String> patientIds);

    /**
     * Ventilation history per admission. Admissions without any ventilation data are
     * absent from the result.
     */
    List<VentilationRecord> fetchVentilationRecords(Collection<String> admissionIds);

    /** Device-day rollup of the census rows of the sector dated inside the window. */
    DeviceDayAggregate fetchDeviceDayAggregate(String sectorId, QueryWindow window);

    List<AntibioticUsagePeriod> fetchAntibioticUsage(Collection<String> admissionIds);

    Optional<Admission> fetchAdmission(String admissionId);

    List<DeviceUsage> fetchDeviceUsage(String admissionId);

    /**
     * Laboratory results of one admission for the given test codes, oldest first.
     * Codes are matched case-insensitively.
     */
    List<LabResult> fetchLabResults(String admissionId, Collection<String> testCodes);

    /** True when the admission has at least one stay in the sector. */
    boolean hasStayInSector(String admissionId, String sectorId);

    /** Distinct sector ids that appear in any stay, sorted. */
    List<String> fetchSectorIds();

    /** Stays in the sector that have no end yet. */
    List<SectorStay> fetchOpenSectorStays(String sectorId);

    /** Number of admissions in the store, used as a connectivity check. */
    long countAdmissions();

    /**
     * Inserts or replaces the stored unit report for {@code (sectorId, window)}.
     *
     * @return true when a new row was created, false when an existing one was replaced
     */
    boolean upsertSnapshot(String sectorId, QueryWindow window, Instant computedAt, String documentJson);
}
