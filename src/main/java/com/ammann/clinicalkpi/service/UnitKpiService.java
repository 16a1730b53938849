/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.dto.UnitKpiReportDTO;
import com.ammann.clinicalkpi.exception.ValidationException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import org.jboss.logging.Logger;

/**
 * Computes unit-level KPI reports for a sector and window.
 *
 * <p>Loads one snapshot, assembles the document and, when asked to, stores it as a
 * snapshot. A storage failure aborts the whole computation.
 */
@ApplicationScoped
public class UnitKpiService {

    private static final Logger LOG = Logger.getLogger(UnitKpiService.class);

    @Inject SnapshotLoader snapshotLoader;

    @Inject KpiDocumentAssembler assembler;

    @Inject KpiSnapshotService snapshotService;

    @Inject Clock clock;

    @Inject MeterRegistry meterRegistry;

    private Timer computationTimer;
    private Counter persistedCounter;

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - unit KPI metrics disabled");
            return;
        }
        computationTimer =
                Timer.builder("kpi_unit_report_duration")
                        .description("Unit KPI report computation time")
                        .register(meterRegistry);
        persistedCounter =
                Counter.builder("kpi_unit_snapshots_persisted_total")
                        .description("Unit KPI reports persisted as snapshots")
                        .register(meterRegistry);
    }

    /**
     * Computes the unit report.
     *
     * @param sectorId target sector, required
     * @param window   reporting window
     * @param persist  whether to upsert the result as a snapshot
     * @return unit report
     */
    public UnitKpiReportDTO computeUnitReport(String sectorId, QueryWindow window, boolean persist) {
        if (sectorId == null || sectorId.isBlank()) {
            throw ValidationException.missingParameter("sector");
        }
        if (window == null) {
            throw ValidationException.missingParameter("window");
        }

        Instant now = clock.instant();
        LOG.debugf("Computing unit KPIs: sector=%s, window=[%s, %s)", sectorId, window.start(), window.end());

        UnitKpiReportDTO report =
                computationTimer != null
                        ? computationTimer.record(() -> assemble(sectorId, window, now))
                        : assemble(sectorId, window, now);

        if (persist && snapshotService.save(report, window, now) && persistedCounter != null) {
            persistedCounter.increment();
        }

        LOG.infof(
                "Unit KPIs computed: sector=%s, cohort=%d, discharges=%d",
                sectorId, report.cohort().count(), report.mortality().discharges());
        return report;
    }

    private UnitKpiReportDTO assemble(String sectorId, QueryWindow window, Instant now) {
        return assembler.assembleUnitReport(snapshotLoader.loadUnit(sectorId, window), now);
    }
}
