/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.LabResult;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Entity
@Table(name = "lab_result", indexes = {
        @Index(name = "idx_lab_result_admission_test", columnList = "admission_id, test_name, taken_at")
})
public class LabResultEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Column(name = "test_name", nullable = false, length = 64)
    public String testName;

    @Column(name = "taken_at", nullable = false)
    public Instant takenAt;

    @Column(name = "result_value")
    public Double value;

    @Column(name = "unit", length = 32)
    public String unit;

    /**
     * Results of the given tests for one admission, oldest first. Test names are compared
     * case-insensitively.
     */
    public static List<LabResultEntity> findForAdmission(String admissionId, Collection<String> testNames) {
        return find("admissionId = ?1 AND lower(testName) IN ?2 ORDER BY takenAt",
                admissionId, testNames).list();
    }

    public LabResult toDomain() {
        return new LabResult(admissionId, testName, takenAt, value, unit);
    }
}
