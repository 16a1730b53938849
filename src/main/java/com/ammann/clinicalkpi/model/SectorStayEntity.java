/* (C)2026 */
package com.ammann.clinicalkpi.model;

import com.ammann.clinicalkpi.domain.SectorStay;
import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Contiguous presence of an admission in a hospital sector.
 */
@Entity
@Table(name = SectorStayEntity.TABLE_NAME, indexes = {
        @Index(name = "idx_sector_stay_sector_start", columnList = "sector_id, start_at"),
        @Index(name = "idx_sector_stay_admission", columnList = "admission_id")
})
public class SectorStayEntity extends PanacheEntity
{
    public static final String TABLE_NAME = "sector_stay";

    @Column(name = "admission_id", nullable = false, length = 64)
    public String admissionId;

    @Column(name = "sector_id", nullable = false, length = 64)
    public String sectorId;

    @Column(name = "start_at", nullable = false)
    public Instant startAt;

    /** End of the stay, null while the admission is still in the sector. */
    @Column(name = "end_at")
    public Instant endAt;

    /**
     * Stays in a sector that touch {@code [start, end)}: starting before the window end and
     * either still open or ending at or after the window start.
     */
    public static List<SectorStayEntity> findOverlapping(String sectorId, Instant start, Instant end) {
        return find("sectorId = ?1 AND startAt < ?3 AND (endAt IS NULL OR endAt >= ?2) "
                        + "ORDER BY admissionId, startAt",
                sectorId, start, end).list();
    }

    public static List<SectorStayEntity> findBySectorAndAdmissions(
            String sectorId, Collection<String> admissionIds) {
        return find("sectorId = ?1 AND admissionId IN ?2 ORDER BY admissionId, startAt",
                sectorId, admissionIds).list();
    }

    public static List<SectorStayEntity> findOpenInSector(String sectorId) {
        return find("sectorId = ?1 AND endAt IS NULL ORDER BY startAt", sectorId).list();
    }

    public static boolean existsFor(String admissionId, String sectorId) {
        return count("admissionId = ?1 AND sectorId = ?2", admissionId, sectorId) > 0;
    }

    public static List<String> findDistinctSectorIds() {
        return getEntityManager()
                .createQuery("SELECT DISTINCT s.sectorId FROM SectorStayEntity s ORDER BY s.sectorId",
                        String.class)
                .getResultList();
    }

    public SectorStay toDomain() {
        return new SectorStay(admissionId, sectorId, startAt, endAt);
    }
}
