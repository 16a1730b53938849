/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.dto.UnitKpiReportDTO;
import com.ammann.clinicalkpi.exception.SomeThingWentWrongException;
import com.ammann.clinicalkpi.persistence.ClinicalRecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Persists computed unit reports as JSONB snapshots.
 *
 * <p>The snapshot for a {@code (sectorId, windowStart, windowEnd)} key is replaced on
 * every recomputation, so repeated saves leave exactly one row per key.
 */
@ApplicationScoped
public class KpiSnapshotService {

    private static final Logger LOG = Logger.getLogger(KpiSnapshotService.class);

    @Inject ClinicalRecordStore store;

    @Inject ObjectMapper objectMapper;

    @ConfigProperty(name = "kpi.snapshot.enabled", defaultValue = "true")
    boolean snapshotEnabled = true;

    /**
     * Saves the report under its sector and window.
     *
     * @param report     computed unit report
     * @param window     window the report was computed for
     * @param computedAt computation instant
     * @return true when the report was written, false when snapshots are disabled
     */
    public boolean save(UnitKpiReportDTO report, QueryWindow window, Instant computedAt) {
        if (!snapshotEnabled) {
            LOG.debugf("Snapshot persistence disabled, skipping sector=%s", report.sectorId());
            return false;
        }

        String document;
        try {
            document = objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new SomeThingWentWrongException(e);
        }

        boolean created = store.upsertSnapshot(report.sectorId(), window, computedAt, document);
        LOG.infof(
                "%s KPI snapshot for sector=%s window=[%s, %s)",
                created ? "Created" : "Replaced", report.sectorId(), window.start(), window.end());
        return true;
    }
}
