/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.calculation.IntervalMath;
import com.ammann.clinicalkpi.calculation.StatisticsAggregator;
import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.AntibioticUsagePeriod;
import com.ammann.clinicalkpi.domain.DeviceDayAggregate;
import com.ammann.clinicalkpi.domain.DeviceUsage;
import com.ammann.clinicalkpi.domain.LabResult;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.TimePeriod;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.dto.AntibioticRankingDTO;
import com.ammann.clinicalkpi.dto.AntibioticTimelineDTO;
import com.ammann.clinicalkpi.dto.DatePeriodDTO;
import com.ammann.clinicalkpi.dto.DeviceGroupDTO;
import com.ammann.clinicalkpi.dto.DeviceUtilizationDTO;
import com.ammann.clinicalkpi.dto.DrugTherapyDaysDTO;
import com.ammann.clinicalkpi.dto.EpisodePeriodDTO;
import com.ammann.clinicalkpi.dto.LabPointDTO;
import com.ammann.clinicalkpi.dto.LabsDTO;
import com.ammann.clinicalkpi.dto.LatestLabDTO;
import com.ammann.clinicalkpi.enumeration.DeviceType;
import com.ammann.clinicalkpi.enumeration.LabTest;
import com.ammann.clinicalkpi.service.EventWindowDetector.EventMatchCount;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/**
 * Per-admission derivations: ventilation timing and exposure, device-day rollups,
 * antibiotic days of therapy and laboratory summaries.
 *
 * <p>Window-restricted figures use {@link IntervalMath#overlapSeconds}; patient-level
 * figures cover the whole admission.
 */
@ApplicationScoped
public class EpisodeMetricsBuilder {

    private static final Logger LOG = Logger.getLogger(EpisodeMetricsBuilder.class);

    static final String UNKNOWN_ANTIBIOTIC = "unknown";
    static final String VENTILATION_EPISODE = "ventilation";
    private static final int DAYS_PRECISION = 2;

    @Inject EventWindowDetector eventWindowDetector;

    /**
     * Ventilation figures of a presence cohort.
     *
     * @param hoursToFirstIntubation  per intubated admission, hours from admission to first intubation
     * @param ventilatedDaysInWindow  per admission ventilated inside the window, days of overlap
     * @param reintubation            48h reintubations against extubations
     */
    public record VentilationSummary(
            List<Double> hoursToFirstIntubation,
            List<Double> ventilatedDaysInWindow,
            EventMatchCount reintubation) {}

    /**
     * Summarizes ventilation of the given records.
     *
     * <p>Time to first intubation is global (not window-restricted) and needs the
     * admission instant; records without a known admission are skipped for that figure only.
     *
     * @param records    ventilation records of the cohort
     * @param admissions cohort admissions by id
     * @param window     reporting window
     * @param now        bound for open ventilation periods
     * @return summary, empty lists for no records
     */
    public VentilationSummary summarizeVentilation(
            Collection<VentilationRecord> records,
            Map<String, Admission> admissions,
            QueryWindow window,
            Instant now) {
        List<Double> hoursToFirst = new ArrayList<>();
        List<Double> ventilatedDays = new ArrayList<>();

        for (VentilationRecord record : records) {
            Admission admission = admissions.get(record.admissionId());
            firstIntubationHours(record, admission).ifPresent(hoursToFirst::add);

            double seconds = 0.0;
            for (TimePeriod period : record.periods()) {
                seconds +=
                        IntervalMath.overlapSeconds(
                                period.start(), period.end(), window.start(), window.end(), now);
            }
            if (seconds > 0) {
                ventilatedDays.add(IntervalMath.days(seconds));
            }
        }

        EventMatchCount reintubation = eventWindowDetector.detectReintubations(records);

        LOG.debugf(
                "Ventilation summary: %d records, %d intubated, %d ventilated, %d/%d reintubations",
                records.size(),
                hoursToFirst.size(),
                ventilatedDays.size(),
                reintubation.matches(),
                reintubation.opportunities());

        return new VentilationSummary(
                List.copyOf(hoursToFirst), List.copyOf(ventilatedDays), reintubation);
    }

    /**
     * Hours from admission to the earliest intubation.
     *
     * @return hours, empty when never intubated or the admission instant is unknown
     */
    public Optional<Double> firstIntubationHours(VentilationRecord record, Admission admission) {
        if (record == null
                || record.intubations().isEmpty()
                || admission == null
                || admission.admittedAt() == null) {
            return Optional.empty();
        }
        return Optional.of(
                IntervalMath.hoursBetween(admission.admittedAt(), record.intubations().get(0)));
    }

    /**
     * Device-day utilization per tracked device type.
     */
    public Map<DeviceType, DeviceUtilizationDTO> summarizeDevices(DeviceDayAggregate aggregate) {
        DeviceDayAggregate source = aggregate != null ? aggregate : DeviceDayAggregate.EMPTY;
        Map<DeviceType, DeviceUtilizationDTO> utilization = new EnumMap<>(DeviceType.class);

        for (DeviceType type : DeviceType.values()) {
            if (type == DeviceType.OTHER) {
                continue;
            }
            utilization.put(
                    type,
                    DeviceUtilizationDTO.of(
                            source.deviceDays(type),
                            source.patientDays(),
                            source.admissionIds(type).size(),
                            source.allAdmissionIds().size()));
        }
        return utilization;
    }

    /**
     * Days of therapy overlapping the window, per antibiotic, highest first.
     *
     * <p>Dosing periods are closed; a period without an end is treated as malformed and
     * contributes nothing. An admission counts as exposed to an antibiotic when at least
     * one of its periods overlaps the window.
     *
     * @param usages antibiotic usages of the cohort
     * @param window reporting window
     * @return ranking ordered by DOT descending, then name
     */
    public List<AntibioticRankingDTO> rankAntibioticExposure(
            Collection<AntibioticUsagePeriod> usages, QueryWindow window) {
        Map<String, Double> secondsByDrug = new TreeMap<>();
        Map<String, Set<String>> exposedByDrug = new TreeMap<>();

        for (AntibioticUsagePeriod usage : usages) {
            String name = antibioticName(usage);
            for (TimePeriod period : usage.dosingPeriods()) {
                double seconds =
                        IntervalMath.overlapSeconds(
                                period.start(), period.end(), window.start(), window.end(), null);
                if (seconds <= 0) {
                    continue;
                }
                secondsByDrug.merge(name, seconds, Double::sum);
                Set<String> exposed = exposedByDrug.computeIfAbsent(name, k -> new HashSet<>());
                if (usage.admissionId() != null) {
                    exposed.add(usage.admissionId());
                }
            }
        }

        return secondsByDrug.entrySet().stream()
                .map(
                        e ->
                                new AntibioticRankingDTO(
                                        e.getKey(),
                                        StatisticsAggregator.round(
                                                IntervalMath.days(e.getValue()), DAYS_PRECISION),
                                        exposedByDrug.getOrDefault(e.getKey(), Set.of()).size()))
                .sorted(
                        Comparator.comparingDouble(AntibioticRankingDTO::dotDays)
                                .reversed()
                                .thenComparing(AntibioticRankingDTO::name))
                .toList();
    }

    /**
     * Total ventilated days of one admission; open periods run until {@code now}.
     */
    public double totalVentilatedDays(VentilationRecord record, Instant now) {
        if (record == null) {
            return 0.0;
        }
        double seconds = 0.0;
        for (TimePeriod period : record.periods()) {
            Instant end = period.end() != null ? period.end() : now;
            seconds += IntervalMath.durationSeconds(period.start(), end);
        }
        return StatisticsAggregator.round(IntervalMath.days(seconds), DAYS_PRECISION);
    }

    public List<EpisodePeriodDTO> ventilationPeriods(VentilationRecord record) {
        if (record == null) {
            return List.of();
        }
        return record.periods().stream()
                .map(
                        p ->
                                new EpisodePeriodDTO(
                                        VENTILATION_EPISODE,
                                        p.start(),
                                        p.end(),
                                        p.endSource() != null ? p.endSource() : ""))
                .toList();
    }

    /**
     * Days of therapy over the whole admission, per antibiotic, in first-prescribed order.
     */
    public List<DrugTherapyDaysDTO> daysOfTherapyByDrug(Collection<AntibioticUsagePeriod> usages) {
        Map<String, Double> secondsByDrug = new LinkedHashMap<>();
        for (AntibioticUsagePeriod usage : usages) {
            double seconds =
                    usage.dosingPeriods().stream()
                            .mapToDouble(p -> IntervalMath.durationSeconds(p.start(), p.end()))
                            .sum();
            secondsByDrug.merge(antibioticName(usage), seconds, Double::sum);
        }
        return secondsByDrug.entrySet().stream()
                .map(
                        e ->
                                new DrugTherapyDaysDTO(
                                        e.getKey(),
                                        StatisticsAggregator.round(
                                                IntervalMath.days(e.getValue()), DAYS_PRECISION)))
                .toList();
    }

    /**
     * Dosing periods of each usage as UTC calendar dates. Periods without both ends are left out.
     */
    public List<AntibioticTimelineDTO> antibioticTimelines(
            Collection<AntibioticUsagePeriod> usages) {
        return usages.stream()
                .map(
                        usage ->
                                new AntibioticTimelineDTO(
                                        antibioticName(usage),
                                        usage.dosingPeriods().stream()
                                                .filter(p -> p.start() != null && p.end() != null)
                                                .map(
                                                        p ->
                                                                new DatePeriodDTO(
                                                                        utcDate(p.start()),
                                                                        utcDate(p.end())))
                                                .toList()))
                .toList();
    }

    /**
     * Device usages grouped by category. Every category is present, in declaration order.
     */
    public List<DeviceGroupDTO> groupDevices(Collection<DeviceUsage> usages) {
        Map<DeviceType, List<EpisodePeriodDTO>> grouped = new EnumMap<>(DeviceType.class);
        for (DeviceType type : DeviceType.values()) {
            grouped.put(type, new ArrayList<>());
        }
        for (DeviceUsage usage : usages) {
            grouped.get(usage.type())
                    .add(
                            new EpisodePeriodDTO(
                                    usage.rawType() != null ? usage.rawType() : "",
                                    usage.start(),
                                    usage.end(),
                                    usage.endSource() != null ? usage.endSource() : ""));
        }

        List<DeviceGroupDTO> groups = new ArrayList<>();
        grouped.forEach(
                (type, list) -> groups.add(new DeviceGroupDTO(type.getKey(), List.copyOf(list))));
        return groups;
    }

    /**
     * Latest result and ascending series per tracked laboratory test.
     *
     * @param results results of one admission, any order; untracked tests are ignored
     * @return labs summary with every tracked test present in the series section
     */
    public LabsDTO summarizeLabs(Collection<LabResult> results) {
        Map<LabTest, List<LabResult>> byTest = new EnumMap<>(LabTest.class);
        for (LabResult result : results) {
            if (result.takenAt() == null) {
                continue;
            }
            LabTest.fromCode(result.testName())
                    .ifPresent(
                            test -> byTest.computeIfAbsent(test, t -> new ArrayList<>()).add(result));
        }
        byTest.values().forEach(list -> list.sort(Comparator.comparing(LabResult::takenAt)));

        Map<String, LatestLabDTO> latest = new LinkedHashMap<>();
        byTest.forEach(
                (test, list) -> {
                    LabResult last = list.get(list.size() - 1);
                    latest.put(
                            test.getKey(),
                            new LatestLabDTO(
                                    last.value(),
                                    last.unit() != null ? last.unit() : "",
                                    test.flag(last.value()),
                                    last.takenAt()));
                });

        Map<String, Object> series = new LinkedHashMap<>();
        Map<LabTest.LabPanel, Map<String, List<LabPointDTO>>> panels =
                new EnumMap<>(LabTest.LabPanel.class);
        for (LabTest test : LabTest.values()) {
            List<LabPointDTO> points =
                    byTest.getOrDefault(test, List.of()).stream()
                            .map(r -> new LabPointDTO(r.takenAt(), r.value()))
                            .toList();
            if (test.getPanel() == null) {
                series.put(test.getKey(), points);
                continue;
            }
            Map<String, List<LabPointDTO>> panel = panels.get(test.getPanel());
            if (panel == null) {
                panel = new LinkedHashMap<>();
                panels.put(test.getPanel(), panel);
                series.put(test.getPanel().getKey(), panel);
            }
            panel.put(test.getKey(), points);
        }

        return new LabsDTO(latest, series);
    }

    private static String antibioticName(AntibioticUsagePeriod usage) {
        String name = usage.antibioticName();
        return name == null || name.isBlank() ? UNKNOWN_ANTIBIOTIC : name.trim();
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
