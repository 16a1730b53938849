/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Hospital admission as exported by the hospital information system.
 */
@Entity
@Table(name = AdmissionEntity.TABLE_NAME, indexes = {
        @Index(name = "idx_admission_patient", columnList = "patient_id"),
        @Index(name = "idx_admission_discharged_at", columnList = "discharged_at")
})
public class AdmissionEntity extends PanacheEntityBase
{
    public static final String TABLE_NAME = "admission";

    @Id
    @Column(name = "admission_id", length = 64)
    public String admissionId;

    @Column(name = "patient_id", nullable = false, length = 64)
    public String patientId;

    @Column(name = "admitted_at", nullable = false)
    public Instant admittedAt;

    /** Discharge instant, null while the patient is admitted. */
    @Column(name = "discharged_at")
    public Instant dischargedAt;

    /** Outcome code ({@code alta}, {@code obito}, {@code transferencia}). */
    @Column(name = "outcome", length = 32)
    public String outcome;

    @Column(name = "discharge_destination", length = 128)
    public String dischargeDestination;

    public static Optional<AdmissionEntity> findByAdmissionId(String admissionId) {
        return findByIdOptional(admissionId);
    }

    public static List<AdmissionEntity> findDischargedBetween(Instant start, Instant end) {
        return find("dischargedAt >= ?1 AND dischargedAt < ?2 ORDER BY dischargedAt, admissionId",
                start, end).list();
    }

    public static List<AdmissionEntity> findByAdmissionIds(Collection<String> admissionIds) {
        return find("admissionId IN ?1 ORDER BY admissionId", admissionIds).list();
    }

    public static List<AdmissionEntity> findByPatientIds(Collection<String> patientIds) {
        return find("patientId IN ?1 ORDER BY admittedAt, admissionId", patientIds).list();
    }

    public Admission toDomain() {
        return new Admission(
                admissionId,
                patientId,
                admittedAt,
                dischargedAt,
                AdmissionOutcome.fromCode(outcome),
                dischargeDestination);
    }
}
