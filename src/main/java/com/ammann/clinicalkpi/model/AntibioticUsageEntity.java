/* (C)2026 */
package com.ammann.clinicalkpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.util.Collection;
import java.util.List;

/**
 * Antibiotic prescribed during an admission. Dosing periods live in
 * {@link AntibioticPeriodEntity}.
 */
@Entity
@Table(name = "antibiotic_usage", indexes = {
        @Index(name = "idx_antibiotic_usage_admission", columnList = "admission_id")
})
public class AntibioticUsageEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Column(name = "antibiotic_name", length = 128)
    public String antibioticName;

    public static List<AntibioticUsageEntity> findByAdmissionIds(Collection<String> admissionIds) {
        return find("admissionId IN ?1 ORDER BY id", admissionIds).list();
    }
}
