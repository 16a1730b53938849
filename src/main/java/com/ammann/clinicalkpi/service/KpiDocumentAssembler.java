/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.calculation.IntervalMath;
import com.ammann.clinicalkpi.calculation.LabelNormalizer;
import com.ammann.clinicalkpi.calculation.StatisticsAggregator;
import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.dto.AntibioticRankingDTO;
import com.ammann.clinicalkpi.dto.CohortDTO;
import com.ammann.clinicalkpi.dto.DestinationShareDTO;
import com.ammann.clinicalkpi.dto.DeviceUtilizationDTO;
import com.ammann.clinicalkpi.dto.DistributionDTO;
import com.ammann.clinicalkpi.dto.LengthOfStayDTO;
import com.ammann.clinicalkpi.dto.MortalityDTO;
import com.ammann.clinicalkpi.dto.PatientAntibioticsDTO;
import com.ammann.clinicalkpi.dto.PatientDevicesDTO;
import com.ammann.clinicalkpi.dto.PatientKpiReportDTO;
import com.ammann.clinicalkpi.dto.PatientVentilationDTO;
import com.ammann.clinicalkpi.dto.PeriodDTO;
import com.ammann.clinicalkpi.dto.UnitAntibioticsDTO;
import com.ammann.clinicalkpi.dto.UnitDevicesDTO;
import com.ammann.clinicalkpi.dto.UnitKpiReportDTO;
import com.ammann.clinicalkpi.dto.VentilationUtilizationDTO;
import com.ammann.clinicalkpi.enumeration.DeviceType;
import com.ammann.clinicalkpi.service.CohortResolver.DischargeCohort;
import com.ammann.clinicalkpi.service.CohortResolver.PresenceCohort;
import com.ammann.clinicalkpi.service.EpisodeMetricsBuilder.VentilationSummary;
import com.ammann.clinicalkpi.service.EventWindowDetector.EventMatchCount;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes the unit-level and patient-level KPI documents from pre-fetched snapshots.
 *
 * <p>Performs no I/O: the same snapshot and {@code now} always yield an equal document.
 */
@ApplicationScoped
public class KpiDocumentAssembler {

    private static final int RATE_PRECISION = 4;
    private static final int DAYS_PRECISION = 2;

    @Inject CohortResolver cohortResolver;

    @Inject EventWindowDetector eventWindowDetector;

    @Inject EpisodeMetricsBuilder episodeMetricsBuilder;

    /**
     * Builds the unit-level document.
     *
     * @param snapshot records of the sector and window
     * @param now      bound for open stays and ventilation periods
     * @return unit report
     */
    public UnitKpiReportDTO assembleUnitReport(UnitSnapshot snapshot, Instant now) {
        String sectorId = snapshot.sectorId();

        PresenceCohort presence =
                cohortResolver.resolvePresence(
                        sectorId, snapshot.presenceStays(), snapshot.window(), now);
        DischargeCohort discharges =
                cohortResolver.resolveDischarges(
                        sectorId,
                        snapshot.dischargedAdmissions(),
                        snapshot.dischargedStays(),
                        snapshot.window());

        LengthOfStayDTO los =
                LengthOfStayDTO.of(
                        DistributionDTO.fromSamples(presence.lengthOfStayDays()),
                        DistributionDTO.fromSamples(dischargeLengthOfStay(discharges)));

        long deaths = discharges.deaths();
        MortalityDTO mortality =
                new MortalityDTO(
                        deaths,
                        discharges.size(),
                        StatisticsAggregator.safeRatio(deaths, discharges.size(), RATE_PRECISION));

        EventMatchCount readmissions =
                eventWindowDetector.detectReadmissions(
                        sectorId,
                        discharges,
                        snapshot.patientAdmissions(),
                        snapshot.patientSectorStays());

        List<VentilationRecord> cohortVentilation =
                snapshot.ventilation().stream()
                        .filter(v -> presence.contains(v.admissionId()))
                        .toList();
        VentilationSummary ventilation =
                episodeMetricsBuilder.summarizeVentilation(
                        cohortVentilation, snapshot.cohortAdmissions(), snapshot.window(), now);

        List<AntibioticUsagePeriod> cohortAntibiotics =
                snapshot.antibiotics().stream()
                        .filter(a -> presence.contains(a.admissionId()))
                        .toList();
        List<AntibioticRankingDTO> ranking =
                episodeMetricsBuilder.rankAntibioticExposure(cohortAntibiotics, snapshot.window());

        return new UnitKpiReportDTO(
                PeriodDTO.of(snapshot.window()),
                sectorId,
                CohortDTO.presence(presence.size()),
                los,
                mortality,
                readmissions.toRate(),
                ventilation.reintubation().toRate(),
                destinationDistribution(discharges),
                UnitAntibioticsDTO.fromRanking(ranking),
                devices(snapshot, ventilation));
    }

    /**
     * Builds the patient-level document.
     *
     * @param snapshot records of the admission
     * @param now      bound for an ongoing admission and open ventilation periods
     * @return patient report
     */
    public PatientKpiReportDTO assemblePatientReport(PatientSnapshot snapshot, Instant now) {
        Admission admission = snapshot.admission();
        VentilationRecord ventilation = snapshot.ventilation();

        String status =
                admission.isOngoing()
                        ? PatientKpiReportDTO.STATUS_ADMITTED
                        : admission.outcome().getLabel();
        Instant stayEnd = admission.isOngoing() ? now : admission.dischargedAt();
        double totalStayDays =
                StatisticsAggregator.round(
                        IntervalMath.days(
                                IntervalMath.durationSeconds(admission.admittedAt(), stayEnd)),
                        DAYS_PRECISION);

        Double hoursToFirstIntubation =
                episodeMetricsBuilder
                        .firstIntubationHours(ventilation, admission)
                        .map(h -> StatisticsAggregator.round(h, DAYS_PRECISION))
                        .orElse(null);

        PatientVentilationDTO ventilationDto =
                new PatientVentilationDTO(
                        episodeMetricsBuilder.totalVentilatedDays(ventilation, now),
                        hoursToFirstIntubation,
                        episodeMetricsBuilder.ventilationPeriods(ventilation),
                        ventilation.extubations(),
                        eventWindowDetector.hasReintubation(ventilation));

        return new PatientKpiReportDTO(
                admission.admissionId(),
                snapshot.passedThroughSector() ? snapshot.requestedSector() : "",
                admission.patientId(),
                status,
                admission.admittedAt(),
                admission.dischargedAt(),
                totalStayDays,
                ventilationDto,
                new PatientDevicesDTO(episodeMetricsBuilder.groupDevices(snapshot.devices())),
                new PatientAntibioticsDTO(
                        episodeMetricsBuilder.daysOfTherapyByDrug(snapshot.antibiotics()),
                        episodeMetricsBuilder.antibioticTimelines(snapshot.antibiotics())),
                episodeMetricsBuilder.summarizeLabs(snapshot.labs()));
    }

    private UnitDevicesDTO devices(UnitSnapshot snapshot, VentilationSummary ventilation) {
        Map<DeviceType, DeviceUtilizationDTO> utilization =
                episodeMetricsBuilder.summarizeDevices(snapshot.deviceDays());

        return new UnitDevicesDTO(
                VentilationUtilizationDTO.of(
                        utilization.get(DeviceType.VENTILATION),
                        DistributionDTO.fromSamples(ventilation.hoursToFirstIntubation()),
                        DistributionDTO.fromSamples(ventilation.ventilatedDaysInWindow())),
                utilization.get(DeviceType.CENTRAL_LINE),
                utilization.get(DeviceType.URINARY_CATHETER),
                utilization.get(DeviceType.ARTERIAL_LINE));
    }

    private static List<Double> dischargeLengthOfStay(DischargeCohort discharges) {
        return discharges.admissions().stream()
                .filter(a -> a.admittedAt() != null && a.dischargedAt() != null)
                .map(a -> IntervalMath.durationSeconds(a.admittedAt(), a.dischargedAt()))
                .map(IntervalMath::days)
                .toList();
    }

    private static List<DestinationShareDTO> destinationDistribution(DischargeCohort discharges) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Admission admission : discharges.admissions()) {
            counts.merge(LabelNormalizer.normalizeDestination(admission), 1L, Long::sum);
        }
        long total = discharges.size();

        return counts.entrySet().stream()
                .sorted(
                        Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                                .thenComparing(Map.Entry.comparingByKey()))
                .map(
                        e ->
                                new DestinationShareDTO(
                                        e.getKey(),
                                        e.getValue(),
                                        StatisticsAggregator.safeRatio(
                                                e.getValue(), total, RATE_PRECISION)))
                .toList();
    }
}
