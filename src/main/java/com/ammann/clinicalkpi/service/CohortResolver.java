/* (C)2026 */
package com.ammann.clinicalkpi.service;

import com.ammann.clinicalkpi.calculation.IntervalMath;
import com.ammann.clinicalkpi.domain.Admission;
import com.ammann.clinicalkpi.domain.QueryWindow;
import com.ammann.clinicalkpi.domain.SectorStay;
import com.ammann.clinicalkpi.enumeration.AdmissionOutcome;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.jboss.logging.Logger;

/**
 * Resolves the two cohorts a unit report is built from.
 *
 * <p>The <b>presence cohort</b> holds admissions with a stay in the sector overlapping the
 * window; it drives length of stay, ventilation, devices and antibiotics. The
 * <b>discharge cohort</b> holds admissions discharged inside the window that passed through
 * the sector at any time; it drives mortality, destinations and readmission. An admission
 * can belong to either, both or neither.
 */
@ApplicationScoped
public class CohortResolver {

    private static final Logger LOG = Logger.getLogger(CohortResolver.class);

    /**
     * Presence cohort of a sector.
     *
     * @param admissionIds     admissions with at least one stay touching the window
     * @param secondsInSector  seconds inside the window and sector, only for admissions
     *                         with a positive overlap
     */
    public record PresenceCohort(Set<String> admissionIds, Map<String, Double> secondsInSector) {

        public static final PresenceCohort EMPTY = new PresenceCohort(Set.of(), Map.of());

        /** Per-admission length of stay inside the window, in days. */
        public List<Double> lengthOfStayDays() {
            return secondsInSector.values().stream().map(IntervalMath::days).toList();
        }

        /** Admissions that actually spent time in the sector during the window. */
        public int size() {
            return secondsInSector.size();
        }

        /** False for a null id, which never belongs to a cohort. */
        public boolean contains(String admissionId) {
            return admissionId != null && admissionIds.contains(admissionId);
        }
    }

    /**
     * Discharge cohort of a sector, in the order the admissions were supplied.
     */
    public record DischargeCohort(List<Admission> admissions) {

        public static final DischargeCohort EMPTY = new DischargeCohort(List.of());

        public int size() {
            return admissions.size();
        }

        public long deaths() {
            return admissions.stream()
                    .filter(a -> a.outcome() == AdmissionOutcome.DECEASED)
                    .count();
        }

        /** Admissions discharged alive; the base for readmission detection. */
        public List<Admission> dischargedAlive() {
            return admissions.stream()
                    .filter(a -> a.outcome() == AdmissionOutcome.DISCHARGED_ALIVE)
                    .toList();
        }
    }

    /**
     * Builds the presence cohort.
     *
     * <p>A stay qualifies when it is in {@code sectorId}, {@code start < window.end} and its
     * end is absent or {@code >= window.start}. Overlap of all qualifying stays of one
     * admission is summed.
     *
     * @param sectorId target sector
     * @param stays    candidate stays; stays of other sectors or without a start are ignored
     * @param window   reporting window
     * @param now      bound for open stays
     * @return cohort, empty when nothing qualifies
     */
    public PresenceCohort resolvePresence(
            String sectorId, Collection<SectorStay> stays, QueryWindow window, Instant now) {
        if (stays == null || stays.isEmpty()) {
            return PresenceCohort.EMPTY;
        }

        Set<String> admissionIds = new TreeSet<>();
        Map<String, Double> seconds = new TreeMap<>();

        for (SectorStay stay : stays) {
            if (!overlapsWindow(sectorId, stay, window)) {
                continue;
            }
            admissionIds.add(stay.admissionId());

            double overlap =
                    IntervalMath.overlapSeconds(
                            stay.start(), stay.end(), window.start(), window.end(), now);
            if (overlap > 0) {
                seconds.merge(stay.admissionId(), overlap, Double::sum);
            }
        }

        LOG.debugf(
                "Presence cohort for sector %s: %d admissions, %d with time in window",
                sectorId, admissionIds.size(), seconds.size());

        return new PresenceCohort(
                Collections.unmodifiableSet(admissionIds), Collections.unmodifiableMap(seconds));
    }

    /**
     * Builds the discharge cohort.
     *
     * @param sectorId    target sector
     * @param discharged  candidate admissions; those discharged outside the window are ignored
     * @param sectorStays stays of the candidates, at any time; only the sector is checked
     * @param window      reporting window
     * @return cohort in the supplied order
     */
    public DischargeCohort resolveDischarges(
            String sectorId,
            Collection<Admission> discharged,
            Collection<SectorStay> sectorStays,
            QueryWindow window) {
        if (discharged == null || discharged.isEmpty()) {
            return DischargeCohort.EMPTY;
        }

        Set<String> passedThroughSector = admissionsWithStayIn(sectorId, sectorStays);

        List<Admission> cohort =
                discharged.stream()
                        .filter(a -> window.contains(a.dischargedAt()))
                        .filter(a -> a.admissionId() != null && passedThroughSector.contains(a.admissionId()))
                        .toList();

        LOG.debugf(
                "Discharge cohort for sector %s: %d of %d discharged admissions",
                sectorId, cohort.size(), discharged.size());

        return new DischargeCohort(cohort);
    }

    /**
     * Admission ids having at least one stay in {@code sectorId}, regardless of time.
     */
    public Set<String> admissionsWithStayIn(String sectorId, Collection<SectorStay> stays) {
        if (stays == null) {
            return Set.of();
        }
        return stays.stream()
                .filter(s -> Objects.equals(sectorId, s.sectorId()))
                .map(SectorStay::admissionId)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static boolean overlapsWindow(String sectorId, SectorStay stay, QueryWindow window) {
        if (stay.admissionId() == null || stay.start() == null) {
            return false;
        }
        if (!Objects.equals(sectorId, stay.sectorId())) {
            return false;
        }
        return stay.start().isBefore(window.end())
                && (stay.end() == null || !stay.end().isBefore(window.start()));
    }
}
