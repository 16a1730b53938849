/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.DeviceUsage;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "device_usage", indexes = {
        @Index(name = "idx_device_usage_admission", columnList = "admission_id")
})
public class DeviceUsageEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    /** Device type as charted (e.g. "cvc", "foley", "art_line"). */
    @Column(name = "device_type", length = 64)
    public String deviceType;

    @Column(name = "start_at")
    public Instant startAt;

    @Column(name = "end_at")
    public Instant endAt;

    @Column(name = "end_source", length = 64)
    public String endSource;

    public static List<DeviceUsageEntity> findByAdmissionId(String admissionId) {
        return find("admissionId = ?1 ORDER BY startAt", admissionId).list();
    }

    public DeviceUsage toDomain() {
        return new DeviceUsage(admissionId, deviceType, startAt, endAt, endSource);
    }
}
