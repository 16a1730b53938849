/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.calculation.StatisticsAggregator;
import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.domain.VentilationRecord;
import com.ammann.clinicalkpi.dto.EventRateDTO;
import com.ammann.clinicalkpi.service.CohortResolver.DischargeCohort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Detects "next qualifying event within N hours" patterns.
 *
 * <p>For each trigger the earliest candidate strictly after it is looked up; the trigger
 * matches when that gap is at most the threshold. Triggers are evaluated independently, so
 * one candidate may answer several triggers.
 */
@ApplicationScoped
public class EventWindowDetector {

    private static final Logger LOG = Logger.getLogger(EventWindowDetector.class);

    static final long DEFAULT_THRESHOLD_HOURS = 48;
    private static final int RATE_PRECISION = 4;

    @ConfigProperty(name = "kpi.event-window.threshold-hours", defaultValue = "48")
    long thresholdHours = DEFAULT_THRESHOLD_HOURS;

    @Inject CohortResolver cohortResolver;

    /**
     * Matches against its opportunity base.
     *
     * @param matches       triggers followed by a candidate within the threshold
     * @param opportunities triggers evaluated
     */
    public record EventMatchCount(long matches, long opportunities) {

        public static final EventMatchCount NONE = new EventMatchCount(0, 0);

        public EventMatchCount plus(EventMatchCount other) {
            return new EventMatchCount(
                    matches + other.matches, opportunities + other.opportunities);
        }

        public EventRateDTO toRate() {
            return new EventRateDTO(
                    matches,
                    opportunities,
                    StatisticsAggregator.safeRatio(matches, opportunities, RATE_PRECISION));
        }
    }

    public Duration threshold() {
        return Duration.ofHours(thresholdHours);
    }

    /**
     * Earliest candidate strictly after {@code trigger}.
     *
     * @param trigger          trigger instant
     * @param sortedCandidates candidates in ascending order
     * @return the candidate, empty when none follows the trigger
     */
    public Optional<Instant> firstCandidateAfter(Instant trigger, List<Instant> sortedCandidates) {
        if (trigger == null) {
            return Optional.empty();
        }
        return sortedCandidates.stream()
                .filter(Objects::nonNull)
                .filter(candidate -> candidate.isAfter(trigger))
                .findFirst();
    }

    /**
     * Whether the earliest candidate after {@code trigger} lies within {@code threshold}.
     */
    public boolean matchesWithin(
            Instant trigger, List<Instant> sortedCandidates, Duration threshold) {
        return firstCandidateAfter(trigger, sortedCandidates)
                .map(candidate -> Duration.between(trigger, candidate).compareTo(threshold) <= 0)
                .orElse(false);
    }

    /**
     * Evaluates every trigger against the same candidate list.
     *
     * @param triggers   trigger instants, any order
     * @param candidates candidate instants, any order
     * @param threshold  maximum gap for a match
     * @return matches against the number of triggers
     */
    public EventMatchCount countMatches(
            Collection<Instant> triggers, Collection<Instant> candidates, Duration threshold) {
        if (triggers == null || triggers.isEmpty()) {
            return EventMatchCount.NONE;
        }
        List<Instant> sortedCandidates = sorted(candidates);

        long matches =
                triggers.stream()
                        .filter(trigger -> matchesWithin(trigger, sortedCandidates, threshold))
                        .count();
        return new EventMatchCount(matches, triggers.size());
    }

    /**
     * 48h readmission into the same sector.
     *
     * <p>Each discharged-alive admission of the cohort is one opportunity. Its candidates are
     * the admission instants of the same patient's other admissions that also have a stay in
     * {@code sectorId}; admissions into other sectors never count.
     *
     * @param sectorId             target sector
     * @param cohort               discharge cohort
     * @param patientAdmissions    all admissions of the cohort's patients
     * @param candidateSectorStays stays of {@code patientAdmissions}, any sector
     * @return readmissions against discharges alive
     */
    public EventMatchCount detectReadmissions(
            String sectorId,
            DischargeCohort cohort,
            Collection<Admission> patientAdmissions,
            Collection<SectorStay> candidateSectorStays) {
        List<Admission> base = cohort.dischargedAlive();
        if (base.isEmpty()) {
            return EventMatchCount.NONE;
        }

        Set<String> inSector = cohortResolver.admissionsWithStayIn(sectorId, candidateSectorStays);
        Map<String, List<Admission>> byPatient =
                patientAdmissions.stream()
                        .filter(a -> a.patientId() != null && a.admittedAt() != null && a.admissionId() != null)
                        .filter(a -> inSector.contains(a.admissionId()))
                        .collect(Collectors.groupingBy(Admission::patientId));

        Duration threshold = threshold();
        long matches = 0;
        for (Admission discharge : base) {
            List<Instant> candidates =
                    byPatient.getOrDefault(discharge.patientId(), List.of()).stream()
                            .filter(a -> !a.admissionId().equals(discharge.admissionId()))
                            .map(Admission::admittedAt)
                            .sorted()
                            .toList();
            if (matchesWithin(discharge.dischargedAt(), candidates, threshold)) {
                matches++;
            }
        }

        LOG.debugf(
                "Readmissions within %dh in sector %s: %d of %d",
                thresholdHours, sectorId, matches, base.size());
        return new EventMatchCount(matches, base.size());
    }

    /**
     * 48h reintubation: every extubation is one opportunity, matched against the
     * intubations of the same admission.
     */
    public EventMatchCount detectReintubations(Collection<VentilationRecord> records) {
        EventMatchCount total = EventMatchCount.NONE;
        for (VentilationRecord record : records) {
            total = total.plus(reintubations(record));
        }
        return total;
    }

    /**
     * Whether any extubation of the record was followed by an intubation within the threshold.
     */
    public boolean hasReintubation(VentilationRecord record) {
        return record != null && reintubations(record).matches() > 0;
    }

    private EventMatchCount reintubations(VentilationRecord record) {
        return countMatches(record.extubations(), record.intubations(), threshold());
    }

    private static List<Instant> sorted(Collection<Instant> instants) {
        if (instants == null) {
            return List.of();
        }
        return instants.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.naturalOrder())
                .toList();
    }
}
