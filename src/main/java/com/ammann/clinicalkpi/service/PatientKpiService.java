/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.dto.PatientKpiReportDTO;
import com.ammann.clinicalkpi.exception.ValidationException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Instant;
import org.jboss.logging.Logger;

/**
 * Computes the KPI report of a single admission.
 */
@ApplicationScoped
public class PatientKpiService {

    private static final Logger LOG = Logger.getLogger(PatientKpiService.class);

    @Inject SnapshotLoader snapshotLoader;

    @Inject KpiDocumentAssembler assembler;

    @Inject Clock clock;

    @Inject MeterRegistry meterRegistry;

    private Timer computationTimer;

    @PostConstruct
    void initMetrics() {
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - patient KPI metrics disabled");
            return;
        }
        computationTimer =
                Timer.builder("kpi_patient_report_duration")
                        .description("Patient KPI report computation time")
                        .register(meterRegistry);
    }

    /**
     * @param admissionId admission to report on, required
     * @param sectorId    optional sector context
     * @return patient report
     * @throws com.ammann.clinicalkpi.exception.ResourceNotFoundException when the admission is unknown
     */
    public PatientKpiReportDTO computePatientReport(String admissionId, String sectorId) {
        if (admissionId == null || admissionId.isBlank()) {
            throw ValidationException.missingParameter("admissionId");
        }

        Instant now = clock.instant();
        LOG.debugf("Computing patient KPIs: admission=%s, sector=%s", admissionId, sectorId);

        if (computationTimer == null) {
            return assemble(admissionId, sectorId, now);
        }
        return computationTimer.record(() -> assemble(admissionId, sectorId, now));
    }

    private PatientKpiReportDTO assemble(String admissionId, String sectorId, Instant now) {
        return assembler.assemblePatientReport(snapshotLoader.loadPatient(admissionId, sectorId), now);
    }
}
