/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.enumeration.VentilationEventType;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Single intubation or extubation of an admission.
 */
@Entity
@Table(name = "ventilation_event", indexes = {
        @Index(name = "idx_ventilation_event_admission", columnList = "admission_id")
})
public class VentilationEventEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 16)
    public VentilationEventType eventType;

    @Column(name = "occurred_at", nullable = false)
    public Instant occurredAt;

    public static List<VentilationEventEntity> findByAdmissionIds(Collection<String> admissionIds) {
        return find("admissionId IN ?1 ORDER BY occurredAt", admissionIds).list();
    }
}
