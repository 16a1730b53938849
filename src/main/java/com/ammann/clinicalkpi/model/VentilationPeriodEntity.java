/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.TimePeriod;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Continuous mechanical ventilation period; open while {@code endAt} is null.
 */
@Entity
@Table(name = "ventilation_period", indexes = {
        @Index(name = "idx_ventilation_period_admission", columnList = "admission_id")
})
public class VentilationPeriodEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Column(name = "start_at")
    public Instant startAt;

    @Column(name = "end_at")
    public Instant endAt;

    @Column(name = "end_source", length = 64)
    public String endSource;

    public static List<VentilationPeriodEntity> findByAdmissionIds(Collection<String> admissionIds) {
        return find("admissionId IN ?1 ORDER BY startAt", admissionIds).list();
    }

    public TimePeriod toDomain() {
        return new TimePeriod(startAt, endAt, endSource);
    }
}
