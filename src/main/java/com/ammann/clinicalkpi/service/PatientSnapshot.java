/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceUsage;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import java.util.List;
import java.util.Objects;

/**
 * Every record a patient report needs, fetched once.
 *
 * @param admission        the admission
 * @param requestedSector  sector asked for by the caller, may be null
 * @param passedThroughSector whether the admission has a stay in {@code requestedSector}
 * @param ventilation      ventilation record, empty when never ventilated
 * @param devices          device usages
 * @param antibiotics      antibiotic usages
 * @param labs             tracked laboratory results
 */
public record PatientSnapshot(
        Admission admission,
        String requestedSector,
        boolean passedThroughSector,
        VentilationRecord ventilation,
        List<DeviceUsage> devices,
        List<AntibioticUsagePeriod> antibiotics,
        List<LabResult> labs) {

    public PatientSnapshot {
        Objects.requireNonNull(admission, "admission");
        if (ventilation == null) {
            ventilation = VentilationRecord.empty(admission.admissionId());
        }
        devices = List.copyOf(devices);
        antibiotics = List.copyOf(antibiotics);
        labs = List.copyOf(labs);
    }
}
