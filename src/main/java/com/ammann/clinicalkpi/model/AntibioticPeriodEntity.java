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

@Entity
@Table(name = "antibiotic_period", indexes = {
        @Index(name = "idx_antibiotic_period_usage", columnList = "usage_id")
})
public class AntibioticPeriodEntity extends PanacheEntity
{
    @Column(name = "usage_id", nullable = false)
    public Long usageId;

    @Column(name = "start_at")
    public Instant startAt;

    @Column(name = "end_at")
    public Instant endAt;

    public static List<AntibioticPeriodEntity> findByUsageIds(Collection<Long> usageIds) {
        return find("usageId IN ?1 ORDER BY startAt", usageIds).list();
    }

    public TimePeriod toDomain() {
        return new TimePeriod(startAt, endAt);
    }
}
