/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.dto.AdmittedPatientDTO;
import com.ammann.clinicalkpi.dto.AdmittedPatientsDTO;
import com.ammann.clinicalkpi.dto.SectorListDTO;
import com.ammann.clinicalkpi.exception.ValidationException;
import com.ammann.clinicalkpi.persistence.ClinicalRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sector lookups used by report clients: known sectors and the admissions currently
 * present in a sector.
 */
@ApplicationScoped
public class SectorDirectoryService {

    @Inject ClinicalRecordStore store;

    public SectorListDTO listSectors() {
        return new SectorListDTO(store.fetchSectorIds());
    }

    /**
     * Admissions with an open stay in the sector that have not been discharged, ordered by
     * sector entry. An admission with several open stays is listed once, with its earliest.
     */
    public AdmittedPatientsDTO listAdmitted(String sectorId) {
        if (sectorId == null || sectorId.isBlank()) {
            throw ValidationException.missingParameter("sectorId");
        }

        Map<String, Instant> inSectorSince = new TreeMap<>();
        for (SectorStay stay : store.fetchOpenSectorStays(sectorId)) {
            if (stay.admissionId() == null || stay.start() == null) {
                continue;
            }
            inSectorSince.merge(stay.admissionId(), stay.start(), (a, b) -> a.isBefore(b) ? a : b);
        }

        Map<String, Admission> admissions =
                store.fetchAdmissions(inSectorSince.keySet()).stream()
                        .collect(Collectors.toMap(Admission::admissionId, Function.identity(), (a, b) -> a));

        List<AdmittedPatientDTO> patients =
                inSectorSince.entrySet().stream()
                        .map(e -> {
                            Admission admission = admissions.get(e.getKey());
                            if (admission == null || !admission.isOngoing()) {
                                return null;
                            }
                            return new AdmittedPatientDTO(
                                    admission.patientId(),
                                    admission.admissionId(),
                                    admission.admittedAt(),
                                    e.getValue());
                        })
                        .filter(Objects::nonNull)
                        .sorted(Comparator.comparing(AdmittedPatientDTO::inSectorSince)
                                .thenComparing(AdmittedPatientDTO::admissionId))
                        .toList();

        return new AdmittedPatientsDTO(sectorId, patients);
    }
}
