/* (C)2026 */
package com.ammann.clinicalkpi.model;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Optional;
import org.hibernate.annotations.ColumnTransformer;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Last computed unit report for a sector and window. One row per
 * {@code (sector_id, window_start, window_end)}; recomputation replaces the document.
 */
@Entity
@Table(name = "kpi_snapshot", uniqueConstraints = {
        @UniqueConstraint(name = "uk_kpi_snapshot_key", columnNames = {"sector_id", "window_start", "window_end"})
})
public class KpiSnapshotEntity extends PanacheEntityBase {

    /**
     * Single-statement upsert on the natural key. Returns true when the row was inserted,
     * false when an existing row was overwritten ({@code xmax} is 0 only for fresh tuples).
     */
    public static final String UPSERT_SQL =
            "INSERT INTO kpi_snapshot (sector_id, window_start, window_end, computed_at, document) "
                    + "VALUES (?1, ?2, ?3, ?4, CAST(?5 AS jsonb)) "
                    + "ON CONFLICT (sector_id, window_start, window_end) "
                    + "DO UPDATE SET computed_at = EXCLUDED.computed_at, document = EXCLUDED.document "
                    + "RETURNING (xmax = 0)";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(name = "sector_id", nullable = false, length = 64)
    public String sectorId;

    @Column(name = "window_start", nullable = false)
    public Instant windowStart;

    @Column(name = "window_end", nullable = false)
    public Instant windowEnd;

    @Column(name = "computed_at", nullable = false)
    public Instant computedAt;

    /** Unit report serialized as a JSONB document. */
    @JdbcTypeCode(SqlTypes.JSON)
    @ColumnTransformer(write = "CAST(? AS jsonb)")
    @Column(name = "document", columnDefinition = "jsonb", nullable = false)
    public String document;

    public static Optional<KpiSnapshotEntity> findByKey(String sectorId, Instant windowStart, Instant windowEnd) {
        return find("sectorId = ?1 AND windowStart = ?2 AND windowEnd = ?3",
                sectorId, windowStart, windowEnd).firstResultOptional();
    }
}
