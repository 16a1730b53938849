/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.DeviceDayRecord;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDate;
import java.util.List;

/**
 * Daily device census row: one per admission, sector and calendar day.
 */
@Entity
@Table(name = "device_day", indexes = {
        @Index(name = "idx_device_day_sector_day", columnList = "sector_id, day")
})
public class DeviceDayEntity extends PanacheEntity
{
    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Column(name = "sector_id", nullable = false, length = 64)
    public String sectorId;

    @Column(name = "day", nullable = false)
    public LocalDate day;

    @Column(name = "central_line", nullable = false)
    public boolean centralLine;

    @Column(name = "urinary_catheter", nullable = false)
    public boolean urinaryCatheter;

    @Column(name = "arterial_line", nullable = false)
    public boolean arterialLine;

    @Column(name = "ventilated", nullable = false)
    public boolean ventilated;

    /**
     * Rows of a sector for the days in {@code [fromDay, toDay)}.
     */
    public static List<DeviceDayEntity> findInSector(String sectorId, LocalDate fromDay, LocalDate toDay) {
        return find("sectorId = ?1 AND day >= ?2 AND day < ?3 ORDER BY day, admissionId",
                sectorId, fromDay, toDay).list();
    }

    public DeviceDayRecord toDomain() {
        return new DeviceDayRecord(
                admissionId, sectorId, day, centralLine, urinaryCatheter, arterialLine, ventilated);
    }
}
